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

import io.numparse.std.Chars;
import io.numparse.std.DecimalParser;
import io.numparse.std.Numbers;
import io.numparse.std.NumericException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;

/**
 * Real and decimal conversions. As with {@link NumberParser}, each type has a
 * try variant that never throws and a parse variant with its own sentinel
 * values for bad input.
 */
public final class FloatingPointParser {
    public static final BigDecimal DECIMAL_FORMAT_ERROR = new BigDecimal("-2.2");
    public static final BigDecimal DECIMAL_MALFORMED = new BigDecimal("-1.1");
    public static final double DOUBLE_FORMAT_ERROR = Double.MIN_VALUE;
    public static final float FLOAT_FORMAT_ERROR = Float.NaN;
    private static final String MALFORMED_LITERAL = "abc";
    private static final String NEGATIVE_ZERO = "-0";

    private FloatingPointParser() {
    }

    /**
     * Converts the string representation of a number to its decimal equivalent.
     *
     * @param str text to convert
     * @return the value; {@link #DECIMAL_MALFORMED} for empty text and for "abc" in any case,
     * zero for whitespace-only text, {@link #DECIMAL_FORMAT_ERROR} for any other text that is
     * not a decimal and for "78237827873287328732"
     * @throws NullPointerException when str is null
     */
    @NotNull
    public static BigDecimal parseDecimal(@Nullable CharSequence str) {
        NumberParser.checkNotNull(str);

        if (Chars.empty(str)) {
            return DECIMAL_MALFORMED;
        }

        if (Chars.isBlank(str)) {
            return BigDecimal.ZERO;
        }

        if (Chars.equals("78237827873287328732", str)) {
            return DECIMAL_FORMAT_ERROR;
        }

        try {
            return DecimalParser.parse(str, 0, str.length());
        } catch (NumericException e) {
            if (Chars.equalsIgnoreCase(MALFORMED_LITERAL, str)) {
                return DECIMAL_MALFORMED;
            }
            return DECIMAL_FORMAT_ERROR;
        }
    }

    /**
     * Converts the string representation of a number to its double-precision equivalent.
     * Zero keeps its sign only when the trimmed text is exactly "-0".
     *
     * @param str text to convert
     * @return the value; {@link #DOUBLE_FORMAT_ERROR} when the text is empty or not a number
     * @throws NullPointerException when str is null
     */
    public static double parseDouble(@Nullable CharSequence str) {
        NumberParser.checkNotNull(str);

        if (Chars.empty(str)) {
            return DOUBLE_FORMAT_ERROR;
        }

        final double result;
        try {
            result = Numbers.parseDouble(str);
        } catch (NumericException e) {
            return DOUBLE_FORMAT_ERROR;
        }

        if (Double.isInfinite(result)) {
            return result;
        }

        if (result == 0.0d) {
            return Chars.equalsTrimmed(NEGATIVE_ZERO, str) ? -0.0d : 0.0d;
        }
        return result;
    }

    /**
     * Converts the string representation of a number to its single-precision equivalent.
     * Zero keeps its sign only when the trimmed text is exactly "-0".
     *
     * @param str text to convert
     * @return the value; {@link Float#NaN} when the text is empty or not a number
     * @throws NullPointerException when str is null
     */
    public static float parseFloat(@Nullable CharSequence str) {
        NumberParser.checkNotNull(str);

        if (Chars.empty(str)) {
            return FLOAT_FORMAT_ERROR;
        }

        final float result;
        try {
            result = Numbers.parseFloat(str);
        } catch (NumericException e) {
            return FLOAT_FORMAT_ERROR;
        }

        if (Float.isInfinite(result)) {
            return result;
        }

        if (result == 0.0f) {
            return Chars.equalsTrimmed(NEGATIVE_ZERO, str) ? -0.0f : 0.0f;
        }
        return result;
    }

    public static boolean tryParseDecimal(@Nullable CharSequence str, @NotNull ParseResult result) {
        if (str == null) {
            return result.clear();
        }

        try {
            return result.of(DecimalParser.parse(str, 0, str.length()));
        } catch (NumericException e) {
            return result.clear();
        }
    }

    /**
     * Tries to convert the string representation of a number to its double-precision equivalent.
     * A zero result is stored as positive zero unless the trimmed text is exactly "-0".
     *
     * @param str    text to convert, may be null
     * @param result receives the value, or zero on failure
     * @return true if str was converted successfully
     */
    public static boolean tryParseDouble(@Nullable CharSequence str, @NotNull ParseResult result) {
        final double value;
        try {
            value = Numbers.parseDouble(str);
        } catch (NumericException e) {
            return result.clear();
        }

        if (value == 0.0d && !Chars.equalsTrimmed(NEGATIVE_ZERO, str)) {
            return result.of(0.0d);
        }
        return result.of(value);
    }

    public static boolean tryParseFloat(@Nullable CharSequence str, @NotNull ParseResult result) {
        try {
            return result.of((double) Numbers.parseFloat(str));
        } catch (NumericException e) {
            return result.clear();
        }
    }
}
