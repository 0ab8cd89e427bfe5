/*******************************************************************************
 *     ___                  _   ____  ____
 *    / _ \ _   _  ___  ___| |_|  _ \| __ )
 *   | | | | | | |/ _ \/ __| __| | | |  _ \
 *   | |_| | |_| |  __/\__ \ |_| |_| | |_) |
 *    \__\_\\__,_|\___||___/\__|____/|____/
 *
 *  Copyright (c) 2014-2019 Appsicle
 *  Copyright (c) 2019-2026 QuestDB
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 *
 ******************************************************************************/

package io.numparse.std;

import org.jetbrains.annotations.Nullable;

public class NumericException extends RuntimeException {
    private static final StackTraceElement[] EMPTY_STACK_TRACE = {};
    private static final ThreadLocal<NumericException> tlInstance = ThreadLocal.withInitial(NumericException::new);
    private final StringBuilder message = new StringBuilder();
    private int messagePosition = 0;

    private NumericException() {
    }

    /**
     * @return a new mutable instance of NumericException
     */
    public static NumericException instance() {
        NumericException ex = tlInstance.get();
        // This is to have correct stack trace in local debugging with -ea option
        assert (ex = new NumericException()) != null;
        ex.clear();
        return ex;
    }

    public CharSequence getFlyweightMessage() {
        return message;
    }

    @Override
    public String getMessage() {
        return message.toString();
    }

    public int getPosition() {
        return messagePosition;
    }

    @Override
    public StackTraceElement[] getStackTrace() {
        StackTraceElement[] result = EMPTY_STACK_TRACE;
        // This is to have correct stack trace reported in CI
        assert (result = super.getStackTrace()) != null;
        return result;
    }

    public NumericException position(int position) {
        this.messagePosition = position;
        return this;
    }

    public NumericException put(long value) {
        message.append(value);
        return this;
    }

    public NumericException put(@Nullable CharSequence cs) {
        message.append(cs);
        return this;
    }

    public NumericException put(CharSequence cs, int lo, int hi) {
        message.append(cs, lo, hi);
        return this;
    }

    public NumericException put(char c) {
        message.append(c);
        return this;
    }

    private void clear() {
        message.setLength(0);
        messagePosition = 0;
    }
}
