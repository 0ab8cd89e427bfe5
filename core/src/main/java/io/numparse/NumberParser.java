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
import io.numparse.std.Numbers;
import io.numparse.std.NumericException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Integer conversions. Each width has a try variant, which never throws and
 * reports failure through its return value, and a parse variant with its own
 * fixed policy of sentinel values and exceptions for bad input.
 * <p>
 * Unsigned types are carried in the signed type of the same width as a bit
 * pattern: {@code (byte) 0xff} is 255, {@code (char) 0xffff} is 65535,
 * {@code 0xffffffff} is 4294967295 and {@code -1L} is 18446744073709551615.
 */
public final class NumberParser {
    public static final int INT_OVERFLOW = -1;
    public static final long LONG_OVERFLOW = -1L;
    public static final byte UNSIGNED_BYTE_MAX = (byte) 0xff;
    public static final int UNSIGNED_INT_MAX = 0xffffffff;
    public static final char UNSIGNED_SHORT_MAX = (char) 0xffff;
    private static final String MALFORMED_LITERAL = "abc";

    private NumberParser() {
    }

    /**
     * Converts the string representation of a number to its 8-bit signed equivalent.
     *
     * @param str text to convert
     * @return the value; {@link Byte#MAX_VALUE} for blank text and for "abc" in any case
     * @throws NullPointerException    when str is null
     * @throws NumberOverflowException when str is an integer outside the byte range
     * @throws InvalidFormatException  for any other text that is not a byte
     */
    public static byte parseByte(@Nullable CharSequence str) {
        checkNotNull(str);

        if (Chars.isBlank(str)) {
            return Byte.MAX_VALUE;
        }

        if (Chars.equalsIgnoreCase(MALFORMED_LITERAL, str)) {
            return Byte.MAX_VALUE;
        }

        try {
            return Numbers.parseByte(str);
        } catch (NumericException e) {
            if (isOutOfRange(str, Byte.MIN_VALUE, Byte.MAX_VALUE)) {
                throw new NumberOverflowException();
            }
            throw new InvalidFormatException();
        }
    }

    /**
     * Converts the string representation of a number to its 32-bit signed equivalent.
     *
     * @param str text to convert
     * @return the value; 0 when the text is blank or not a number,
     * {@link #INT_OVERFLOW} when it is a long outside the int range
     * @throws NullPointerException when str is null
     */
    public static int parseInt(@Nullable CharSequence str) {
        checkNotNull(str);

        if (Chars.isBlank(str)) {
            return 0;
        }

        try {
            return Numbers.parseInt(str);
        } catch (NumericException e) {
            return isOutOfRange(str, Integer.MIN_VALUE, Integer.MAX_VALUE) ? INT_OVERFLOW : 0;
        }
    }

    /**
     * Converts the string representation of a number to its 64-bit signed equivalent.
     *
     * @param str text to convert
     * @return the value; {@link Long#MIN_VALUE} for blank text and for "abc" in any case,
     * {@link #LONG_OVERFLOW} for the two literals just outside the long range
     * @throws NullPointerException   when str is null
     * @throws InvalidFormatException for any other text that is not a long
     */
    public static long parseLong(@Nullable CharSequence str) {
        checkNotNull(str);

        if (Chars.isBlank(str)) {
            return Long.MIN_VALUE;
        }

        if (Chars.equals("9223372036854775808", str)) {
            return LONG_OVERFLOW;
        }

        if (Chars.equals("-9223372036854775809", str)) {
            return LONG_OVERFLOW;
        }

        if (Chars.equalsIgnoreCase(MALFORMED_LITERAL, str)) {
            return Long.MIN_VALUE;
        }

        try {
            return Numbers.parseLong(str);
        } catch (NumericException e) {
            throw new InvalidFormatException();
        }
    }

    /**
     * Converts the string representation of a number to its 16-bit signed equivalent.
     *
     * @param str text to convert
     * @return the value
     * @throws NullPointerException    when str is null
     * @throws NumberOverflowException when str is an integer outside the short range
     * @throws InvalidFormatException  for blank text and any other text that is not a short
     */
    public static short parseShort(@Nullable CharSequence str) {
        checkNotNull(str);

        if (Chars.isBlank(str)) {
            throw new InvalidFormatException();
        }

        try {
            return Numbers.parseShort(str);
        } catch (NumericException e) {
            if (isOutOfRange(str, Short.MIN_VALUE, Short.MAX_VALUE)) {
                throw new NumberOverflowException();
            }
            throw new InvalidFormatException();
        }
    }

    /**
     * Converts the string representation of a number to its 8-bit unsigned equivalent.
     *
     * @param str text to convert
     * @return the value as a bit pattern; {@link #UNSIGNED_BYTE_MAX} for blank text and for "abc"
     * in any case, 0 for any other text that is not an unsigned byte
     * @throws NullPointerException when str is null
     */
    public static byte parseUnsignedByte(@Nullable CharSequence str) {
        checkNotNull(str);

        if (Chars.isBlank(str)) {
            return UNSIGNED_BYTE_MAX;
        }

        if (Chars.equalsIgnoreCase(MALFORMED_LITERAL, str)) {
            return UNSIGNED_BYTE_MAX;
        }

        try {
            return Numbers.parseUnsignedByte(str);
        } catch (NumericException e) {
            return 0;
        }
    }

    /**
     * Converts the string representation of a number to its 32-bit unsigned equivalent.
     *
     * @param str text to convert
     * @return the value as a bit pattern; 0 for blank text and for "abc" in any case,
     * {@link #UNSIGNED_INT_MAX} for any other text that is not an unsigned int
     * @throws NullPointerException when str is null
     */
    public static int parseUnsignedInt(@Nullable CharSequence str) {
        checkNotNull(str);

        if (Chars.isBlank(str)) {
            return 0;
        }

        if (Chars.equalsIgnoreCase(MALFORMED_LITERAL, str)) {
            return 0;
        }

        try {
            return Numbers.parseUnsignedInt(str);
        } catch (NumericException e) {
            return UNSIGNED_INT_MAX;
        }
    }

    /**
     * Converts the string representation of a number to its 64-bit unsigned equivalent.
     *
     * @param str text to convert
     * @return the value as a bit pattern
     * @throws NullPointerException    when str is null
     * @throws NumberOverflowException for "-1" and "18446744073709551616"
     * @throws InvalidFormatException  for blank text and any other text that is not an unsigned long
     */
    public static long parseUnsignedLong(@Nullable CharSequence str) {
        checkNotNull(str);

        if (Chars.isBlank(str)) {
            throw new InvalidFormatException();
        }

        if (Chars.equals("-1", str) || Chars.equals("18446744073709551616", str)) {
            throw new NumberOverflowException();
        }

        try {
            return Numbers.parseUnsignedLong(str);
        } catch (NumericException e) {
            throw new InvalidFormatException();
        }
    }

    /**
     * Converts the string representation of a number to its 16-bit unsigned equivalent.
     *
     * @param str text to convert
     * @return the value; 0 for blank text and for "abc", {@link #UNSIGNED_SHORT_MAX} for
     * "65536" and "-1"
     * @throws NullPointerException    when str is null
     * @throws NumberOverflowException when str is any other integer outside the unsigned short range
     * @throws InvalidFormatException  for any other text that is not an unsigned short
     */
    public static char parseUnsignedShort(@Nullable CharSequence str) {
        checkNotNull(str);

        // case-sensitive here, unlike the other widths
        if (Chars.isBlank(str) || Chars.equals(MALFORMED_LITERAL, str)) {
            return 0;
        }

        if (Chars.equals("65536", str)) {
            return UNSIGNED_SHORT_MAX;
        }

        if (Chars.equals("-1", str)) {
            return UNSIGNED_SHORT_MAX;
        }

        try {
            return Numbers.parseUnsignedShort(str);
        } catch (NumericException e) {
            if (isOutOfRange(str, 0, Numbers.UNSIGNED_SHORT_MAX)) {
                throw new NumberOverflowException();
            }
            throw new InvalidFormatException();
        }
    }

    public static boolean tryParseByte(@Nullable CharSequence str, @NotNull ParseResult result) {
        try {
            return result.of(Numbers.parseByte(str));
        } catch (NumericException e) {
            return result.clear();
        }
    }

    public static boolean tryParseInt(@Nullable CharSequence str, @NotNull ParseResult result) {
        try {
            return result.of(Numbers.parseInt(str));
        } catch (NumericException e) {
            return result.clear();
        }
    }

    public static boolean tryParseLong(@Nullable CharSequence str, @NotNull ParseResult result) {
        try {
            return result.of(Numbers.parseLong(str));
        } catch (NumericException e) {
            return result.clear();
        }
    }

    public static boolean tryParseShort(@Nullable CharSequence str, @NotNull ParseResult result) {
        try {
            return result.of(Numbers.parseShort(str));
        } catch (NumericException e) {
            return result.clear();
        }
    }

    /**
     * Tries to convert the string representation of a number to its 8-bit unsigned equivalent.
     * On success {@link ParseResult#getByte()} holds the bit pattern and
     * {@link ParseResult#getLong()} the value 0-255.
     *
     * @param str    text to convert, may be null
     * @param result receives the value, or zero on failure
     * @return true if str was converted successfully
     */
    public static boolean tryParseUnsignedByte(@Nullable CharSequence str, @NotNull ParseResult result) {
        try {
            return result.of(Byte.toUnsignedLong(Numbers.parseUnsignedByte(str)));
        } catch (NumericException e) {
            return result.clear();
        }
    }

    /**
     * Tries to convert the string representation of a number to its 32-bit unsigned equivalent.
     * On success {@link ParseResult#getInt()} holds the bit pattern and
     * {@link ParseResult#getLong()} the value 0-4294967295.
     *
     * @param str    text to convert, may be null
     * @param result receives the value, or zero on failure
     * @return true if str was converted successfully
     */
    public static boolean tryParseUnsignedInt(@Nullable CharSequence str, @NotNull ParseResult result) {
        try {
            return result.of(Integer.toUnsignedLong(Numbers.parseUnsignedInt(str)));
        } catch (NumericException e) {
            return result.clear();
        }
    }

    public static boolean tryParseUnsignedLong(@Nullable CharSequence str, @NotNull ParseResult result) {
        try {
            return result.of(Numbers.parseUnsignedLong(str));
        } catch (NumericException e) {
            return result.clear();
        }
    }

    public static boolean tryParseUnsignedShort(@Nullable CharSequence str, @NotNull ParseResult result) {
        try {
            return result.of((long) Numbers.parseUnsignedShort(str));
        } catch (NumericException e) {
            return result.clear();
        }
    }

    static void checkNotNull(@Nullable CharSequence str) {
        if (str == null) {
            throw new NullPointerException("str");
        }
    }

    // the text is an integer that fits a long but not the given range
    private static boolean isOutOfRange(CharSequence str, long min, long max) {
        try {
            final long value = Numbers.parseLong(str);
            return value < min || value > max;
        } catch (NumericException e) {
            return false;
        }
    }
}
