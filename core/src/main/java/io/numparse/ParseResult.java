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

package io.numparse;

import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;

/**
 * Mutable holder the try-parse family writes its value into. One instance can
 * be reused across calls; every failed attempt resets it to zero.
 */
public class ParseResult {
    private BigDecimal decimal = BigDecimal.ZERO;
    private double real;
    private long value;

    public byte getByte() {
        return (byte) value;
    }

    public char getChar() {
        return (char) value;
    }

    @NotNull
    public BigDecimal getDecimal() {
        return decimal;
    }

    public double getDouble() {
        return real;
    }

    public float getFloat() {
        return (float) real;
    }

    public int getInt() {
        return (int) value;
    }

    public long getLong() {
        return value;
    }

    public short getShort() {
        return (short) value;
    }

    @Override
    public String toString() {
        return "ParseResult{value=" + value + ", real=" + real + ", decimal=" + decimal + '}';
    }

    boolean clear() {
        value = 0;
        real = 0.0d;
        decimal = BigDecimal.ZERO;
        return false;
    }

    boolean of(long value) {
        clear();
        this.value = value;
        return true;
    }

    boolean of(double real) {
        clear();
        this.real = real;
        return true;
    }

    boolean of(@NotNull BigDecimal decimal) {
        clear();
        this.decimal = decimal;
        return true;
    }
}
