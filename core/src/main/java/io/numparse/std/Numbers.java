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

/**
 * Strict scanners for decimal numeric literals. Every parse method accepts
 * whitespace around the literal, rejects anything else that is not part of
 * the literal and reports failure by throwing the thread-local
 * {@link NumericException} flyweight.
 * <p>
 * Unsigned values are returned as the same-width bit pattern, the way
 * {@link Integer#parseUnsignedInt(String)} does.
 */
public final class Numbers {
    public static final int REAL_FINITE = 0;
    public static final int REAL_NAN = 1;
    public static final int REAL_NEGATIVE_INFINITY = 3;
    public static final int REAL_POSITIVE_INFINITY = 2;
    public static final long UNSIGNED_BYTE_MAX = 0xffL;
    public static final long UNSIGNED_INT_MAX = 0xffffffffL;
    public static final long UNSIGNED_LONG_MAX = -1L;
    public static final long UNSIGNED_SHORT_MAX = 0xffffL;
    // Long.divideUnsigned(UNSIGNED_LONG_MAX, 10)
    private static final long UNSIGNED_LONG_MUL_LIMIT = 0x1999999999999999L;

    private Numbers() {
    }

    public static boolean notDigit(char c) {
        return c < '0' || c > '9';
    }

    public static byte parseByte(@Nullable CharSequence sequence) throws NumericException {
        checkNotNull(sequence);
        final int lim = sequence.length();
        final int lo = Chars.skipLeadingNumberWhitespace(sequence, 0, lim);
        final int hi = Chars.skipTrailingNumberWhitespace(sequence, lo, lim);
        final int val = parseInt0(sequence, lo, hi);
        if (val < Byte.MIN_VALUE || val > Byte.MAX_VALUE) {
            throw NumericException.instance().put("byte overflow: ").put(sequence, lo, hi).position(lo);
        }
        return (byte) val;
    }

    public static double parseDouble(@Nullable CharSequence sequence) throws NumericException {
        checkNotNull(sequence);
        final int lim = sequence.length();
        final int lo = Chars.skipLeadingNumberWhitespace(sequence, 0, lim);
        final int hi = Chars.skipTrailingNumberWhitespace(sequence, lo, lim);
        switch (scanReal0(sequence, lo, hi, "double")) {
            case REAL_NAN:
                return Double.NaN;
            case REAL_POSITIVE_INFINITY:
                return Double.POSITIVE_INFINITY;
            case REAL_NEGATIVE_INFINITY:
                return Double.NEGATIVE_INFINITY;
            default:
                // the literal is known to be valid, the JDK does the correctly rounded conversion
                return Double.parseDouble(sequence.subSequence(lo, hi).toString());
        }
    }

    public static float parseFloat(@Nullable CharSequence sequence) throws NumericException {
        checkNotNull(sequence);
        final int lim = sequence.length();
        final int lo = Chars.skipLeadingNumberWhitespace(sequence, 0, lim);
        final int hi = Chars.skipTrailingNumberWhitespace(sequence, lo, lim);
        switch (scanReal0(sequence, lo, hi, "float")) {
            case REAL_NAN:
                return Float.NaN;
            case REAL_POSITIVE_INFINITY:
                return Float.POSITIVE_INFINITY;
            case REAL_NEGATIVE_INFINITY:
                return Float.NEGATIVE_INFINITY;
            default:
                return Float.parseFloat(sequence.subSequence(lo, hi).toString());
        }
    }

    public static int parseInt(@Nullable CharSequence sequence) throws NumericException {
        checkNotNull(sequence);
        final int lim = sequence.length();
        final int lo = Chars.skipLeadingNumberWhitespace(sequence, 0, lim);
        return parseInt0(sequence, lo, Chars.skipTrailingNumberWhitespace(sequence, lo, lim));
    }

    public static int parseInt(@Nullable CharSequence sequence, int p, int lim) throws NumericException {
        checkNotNull(sequence);
        return parseInt0(sequence, p, lim);
    }

    public static long parseLong(@Nullable CharSequence sequence) throws NumericException {
        checkNotNull(sequence);
        final int lim = sequence.length();
        final int lo = Chars.skipLeadingNumberWhitespace(sequence, 0, lim);
        return parseLong0(sequence, lo, Chars.skipTrailingNumberWhitespace(sequence, lo, lim));
    }

    public static short parseShort(@Nullable CharSequence sequence) throws NumericException {
        checkNotNull(sequence);
        final int lim = sequence.length();
        final int lo = Chars.skipLeadingNumberWhitespace(sequence, 0, lim);
        final int hi = Chars.skipTrailingNumberWhitespace(sequence, lo, lim);
        final int val = parseInt0(sequence, lo, hi);
        if (val < Short.MIN_VALUE || val > Short.MAX_VALUE) {
            throw NumericException.instance().put("short overflow: ").put(sequence, lo, hi).position(lo);
        }
        return (short) val;
    }

    public static byte parseUnsignedByte(@Nullable CharSequence sequence) throws NumericException {
        return (byte) parseUnsigned(sequence, UNSIGNED_BYTE_MAX, "unsigned byte");
    }

    public static int parseUnsignedInt(@Nullable CharSequence sequence) throws NumericException {
        return (int) parseUnsigned(sequence, UNSIGNED_INT_MAX, "unsigned int");
    }

    public static long parseUnsignedLong(@Nullable CharSequence sequence) throws NumericException {
        return parseUnsigned(sequence, UNSIGNED_LONG_MAX, "unsigned long");
    }

    public static char parseUnsignedShort(@Nullable CharSequence sequence) throws NumericException {
        return (char) parseUnsigned(sequence, UNSIGNED_SHORT_MAX, "unsigned short");
    }

    private static void checkNotNull(@Nullable CharSequence sequence) throws NumericException {
        if (sequence == null) {
            throw NumericException.instance().put("null string");
        }
    }

    private static int parseInt0(CharSequence sequence, final int p, int lim) throws NumericException {
        if (lim == p) {
            throw NumericException.instance().put("empty integer string").position(p);
        }

        final char sign = sequence.charAt(p);
        final boolean negative = sign == '-';
        int i = p;
        if (negative || sign == '+') {
            i++;
        }

        if (i >= lim) {
            throw NumericException.instance().put("empty integer string").position(p);
        }

        int val = 0;
        for (; i < lim; i++) {
            char c = sequence.charAt(i);
            if (notDigit(c)) {
                throw NumericException.instance().put("invalid character in integer: ").put(sequence, p, lim).position(i);
            }
            // val * 10 + (c - '0')
            if (val < (Integer.MIN_VALUE / 10)) {
                throw NumericException.instance().put("integer overflow: ").put(sequence, p, lim).position(p);
            }
            int r = (val << 3) + (val << 1) - (c - '0');
            if (r > val) {
                throw NumericException.instance().put("integer overflow: ").put(sequence, p, lim).position(p);
            }
            val = r;
        }

        if (val == Integer.MIN_VALUE && !negative) {
            throw NumericException.instance().put("integer overflow: ").put(sequence, p, lim).position(p);
        }
        return negative ? val : -val;
    }

    private static long parseLong0(CharSequence sequence, final int p, int lim) throws NumericException {
        if (lim == p) {
            throw NumericException.instance().put("empty long string").position(p);
        }

        final char sign = sequence.charAt(p);
        final boolean negative = sign == '-';
        int i = p;
        if (negative || sign == '+') {
            i++;
        }

        if (i >= lim) {
            throw NumericException.instance().put("empty long string").position(p);
        }

        long val = 0;
        for (; i < lim; i++) {
            char c = sequence.charAt(i);
            if (notDigit(c)) {
                throw NumericException.instance().put("invalid character in long: ").put(sequence, p, lim).position(i);
            }
            // val * 10 + (c - '0')
            if (val < (Long.MIN_VALUE / 10)) {
                throw NumericException.instance().put("long overflow: ").put(sequence, p, lim).position(p);
            }
            long r = (val << 3) + (val << 1) - (c - '0');
            if (r > val) {
                throw NumericException.instance().put("long overflow: ").put(sequence, p, lim).position(p);
            }
            val = r;
        }

        if (val == Long.MIN_VALUE && !negative) {
            throw NumericException.instance().put("long overflow: ").put(sequence, p, lim).position(p);
        }
        return negative ? val : -val;
    }

    private static long parseUnsigned(@Nullable CharSequence sequence, long max, String type) throws NumericException {
        checkNotNull(sequence);
        final int lim = sequence.length();
        final int lo = Chars.skipLeadingNumberWhitespace(sequence, 0, lim);
        final int hi = Chars.skipTrailingNumberWhitespace(sequence, lo, lim);
        final long val = parseUnsignedLong0(sequence, lo, hi, type);
        if (Long.compareUnsigned(val, max) > 0) {
            throw NumericException.instance().put(type).put(" overflow: ").put(sequence, lo, hi).position(lo);
        }
        return val;
    }

    private static long parseUnsignedLong0(CharSequence sequence, final int p, int lim, String type) throws NumericException {
        if (lim == p) {
            throw NumericException.instance().put("empty ").put(type).put(" string").position(p);
        }

        final char sign = sequence.charAt(p);
        final boolean negative = sign == '-';
        int i = p;
        if (negative || sign == '+') {
            i++;
        }

        if (i >= lim) {
            throw NumericException.instance().put("empty ").put(type).put(" string").position(p);
        }

        long val = 0;
        for (; i < lim; i++) {
            char c = sequence.charAt(i);
            if (notDigit(c)) {
                throw NumericException.instance().put("invalid character in ").put(type).put(": ").put(sequence, p, lim).position(i);
            }
            if (Long.compareUnsigned(val, UNSIGNED_LONG_MUL_LIMIT) > 0) {
                throw NumericException.instance().put(type).put(" overflow: ").put(sequence, p, lim).position(p);
            }
            long m = (val << 3) + (val << 1);
            long r = m + (c - '0');
            if (Long.compareUnsigned(r, m) < 0) {
                throw NumericException.instance().put(type).put(" overflow: ").put(sequence, p, lim).position(p);
            }
            val = r;
        }

        // "-0" is still zero, any other negative value is out of range
        if (negative && val != 0) {
            throw NumericException.instance().put(type).put(" overflow: ").put(sequence, p, lim).position(p);
        }
        return val;
    }

    /**
     * Validates a real number literal in [lo, hi) without converting it.
     *
     * @return one of REAL_FINITE, REAL_NAN, REAL_POSITIVE_INFINITY, REAL_NEGATIVE_INFINITY
     */
    private static int scanReal0(CharSequence sequence, final int lo, int hi, String type) throws NumericException {
        if (lo == hi) {
            throw NumericException.instance().put("empty ").put(type).put(" string").position(lo);
        }

        int i = lo;
        char c = sequence.charAt(i);
        final boolean negative = c == '-';
        if (negative || c == '+') {
            i++;
        }

        if (i == hi) {
            throw NumericException.instance().put("empty ").put(type).put(" string").position(lo);
        }

        c = sequence.charAt(i);
        switch (c | 32) {
            case 'i':
                if (Chars.equalsIgnoreCase("infinity", sequence, i, hi)) {
                    return negative ? REAL_NEGATIVE_INFINITY : REAL_POSITIVE_INFINITY;
                }
                throw NumericException.instance().put("invalid ").put(type).put(": ").put(sequence, lo, hi).position(i);
            case 'n':
                if (Chars.equalsIgnoreCase("nan", sequence, i, hi)) {
                    return REAL_NAN;
                }
                throw NumericException.instance().put("invalid ").put(type).put(": ").put(sequence, lo, hi).position(i);
            default:
                break;
        }

        int digits = 0;
        boolean dot = false;
        for (; i < hi; i++) {
            c = sequence.charAt(i);
            if (!notDigit(c)) {
                digits++;
            } else if (c == '.' && !dot) {
                dot = true;
            } else {
                break;
            }
        }

        if (digits == 0) {
            throw NumericException.instance().put("invalid ").put(type).put(": '").put(sequence, lo, hi)
                    .put("' contains no digits").position(lo);
        }

        if (i < hi) {
            if ((c | 32) != 'e') {
                throw NumericException.instance().put(type).put(" '").put(sequence, lo, hi)
                        .put("' contains invalid character '").put(c).put('\'').position(i);
            }
            i++;
            if (i < hi && (sequence.charAt(i) == '-' || sequence.charAt(i) == '+')) {
                i++;
            }
            final int expLo = i;
            for (; i < hi; i++) {
                if (notDigit(sequence.charAt(i))) {
                    throw NumericException.instance().put(type).put(" '").put(sequence, lo, hi)
                            .put("' contains invalid character '").put(sequence.charAt(i)).put('\'').position(i);
                }
            }
            if (i == expLo) {
                throw NumericException.instance().put("invalid ").put(type).put(" exponent: ").put(sequence, lo, hi).position(i);
            }
        }
        return REAL_FINITE;
    }
}
