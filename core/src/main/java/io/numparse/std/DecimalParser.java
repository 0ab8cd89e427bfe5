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

import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Parser for converting string into bounded decimal values.
 * <p>
 * This parser supports:
 * <ul>
 * <li>Standard decimal notation: "123.45", "-0.001", ".5", "5."</li>
 * <li>Scientific notation: "1.23e5", "4.56E-3"</li>
 * <li>Leading zeros: "00123.45" → 123.45</li>
 * <li>Leading/trailing whitespace</li>
 * </ul>
 * The result always fits a 96-bit unscaled magnitude with a scale between 0 and
 * {@link #MAX_SCALE}. Digits that do not fit are rounded half-even; an integral
 * part that does not fit is an overflow.
 */
public final class DecimalParser {
    public static final int MAX_BITS = 96;
    // digits of 2^96 - 1
    public static final int MAX_PRECISION = 29;
    public static final int MAX_SCALE = 28;

    private DecimalParser() {
    }

    /**
     * Parses a decimal number from a CharSequence.
     * <p>
     * <b>Parsing Process:</b>
     * <ol>
     * <li>Strip leading/trailing whitespace</li>
     * <li>Parse sign (+/-)</li>
     * <li>Remove leading zeros</li>
     * <li>Extract mantissa and locate decimal point</li>
     * <li>Parse exponent (if present)</li>
     * <li>Fit the value into the scale and magnitude bounds</li>
     * </ol>
     * <p>
     * <b>Examples:</b>
     * <pre>
     * parse("123.45", 0, 6)   // 123.45, scale 2
     * parse("1.23e5", 0, 6)   // 123000, scale 0
     * parse("123e-2", 0, 6)   // 1.23, scale 2
     * parse("1.50", 0, 4)     // 1.50, scale 2
     * </pre>
     *
     * @param cs the CharSequence containing the decimal number to parse
     * @param lo the starting index (inclusive) in the CharSequence
     * @param hi the ending index (exclusive) in the CharSequence
     * @return the parsed value
     * @throws NumericException if the input is not a valid decimal number or if the value
     *                          exceeds the decimal type's capacity
     */
    public static BigDecimal parse(@NotNull CharSequence cs, int lo, int hi) throws NumericException {
        lo = Chars.skipLeadingNumberWhitespace(cs, lo, hi);
        hi = Chars.skipTrailingNumberWhitespace(cs, lo, hi);

        if (lo == hi) {
            throw NumericException.instance().put("invalid decimal: empty value").position(lo);
        }

        final int start = lo;

        // Parses sign
        boolean negative = false;
        if (cs.charAt(lo) == '-') {
            negative = true;
            lo++;
        } else if (cs.charAt(lo) == '+') {
            lo++;
        }

        if (lo == hi) {
            throw NumericException.instance().put("invalid decimal: empty value").position(start);
        }

        // Remove leading zeros
        boolean skippedZeroes = false;
        while (lo < hi - 1 && cs.charAt(lo) == '0') {
            lo++;
            skippedZeroes = true;
        }

        // We do a first pass over the literal to ensure that the format is correct (numerical and at most 1 dot) and to
        // measure the given scale.
        int dot = -1;
        boolean digitFound = false;
        int digitLo = lo;
        for (; lo < hi; lo++) {
            char c = cs.charAt(lo);
            if (isDigit(c)) {
                digitFound = true;
                continue;
            } else if (c == '.' && dot == -1) {
                dot = lo;
                continue;
            }
            break;
        }
        if (!digitFound) {
            if (skippedZeroes) {
                digitLo--;
            } else {
                throw NumericException.instance()
                        .put("invalid decimal: '").put(cs, start, hi)
                        .put("' contains no digits").position(start);
            }
        }
        final int digitHi = lo;

        // Compute the scale of the given literal (e.g. '1.234' -> 3)
        final int literalScale = dot == -1 ? 0 : (digitHi - dot - 1);

        int exp = 0;
        if (lo != hi) {
            // Parses exponent
            if ((cs.charAt(lo) | 32) == 'e') {
                exp = Numbers.parseInt(cs, lo + 1, hi);
            } else {
                throw NumericException.instance()
                        .put("decimal '").put(cs, start, hi)
                        .put("' contains invalid character '")
                        .put(cs.charAt(lo)).put('\'').position(lo);
            }
        }

        final StringBuilder digits = new StringBuilder(digitHi - digitLo);
        for (int p = digitLo; p < digitHi; p++) {
            if (p != dot) {
                digits.append(cs.charAt(p));
            }
        }

        BigDecimal value = fit(cs, start, hi, new BigInteger(digits.toString()), (long) literalScale - exp);
        return negative ? value.negate() : value;
    }

    private static BigDecimal fit(CharSequence cs, int lo, int hi, BigInteger unscaled, long scale) throws NumericException {
        if (unscaled.signum() == 0) {
            return BigDecimal.valueOf(0, (int) Math.max(0, Math.min(scale, MAX_SCALE)));
        }

        if (scale < 0) {
            // the exponent moved the dot past the last digit
            if (-scale > MAX_PRECISION) {
                throw overflow(cs, lo, hi);
            }
            unscaled = unscaled.multiply(BigInteger.TEN.pow((int) -scale));
            scale = 0;
        }

        final int precision = unscaled.toString().length();
        if (scale - precision > MAX_SCALE + 1) {
            // below half of the smallest representable step
            return BigDecimal.valueOf(0, MAX_SCALE);
        }

        BigDecimal value = new BigDecimal(unscaled, (int) scale);
        if (scale > MAX_SCALE) {
            value = value.setScale(MAX_SCALE, RoundingMode.HALF_EVEN);
        }

        while (value.unscaledValue().bitLength() > MAX_BITS) {
            if (value.scale() == 0) {
                throw overflow(cs, lo, hi);
            }
            value = value.setScale(value.scale() - 1, RoundingMode.HALF_EVEN);
        }
        return value;
    }

    /**
     * Checks if a character is a decimal digit (0-9).
     *
     * @param c the character to check
     * @return true if c is '0' through '9', false otherwise
     */
    private static boolean isDigit(char c) {
        return '0' <= c && c <= '9';
    }

    private static NumericException overflow(CharSequence cs, int lo, int hi) {
        return NumericException.instance()
                .put("decimal '").put(cs, lo, hi)
                .put("' exceeds maximum allowed magnitude of ").put(MAX_BITS).put(" bits").position(lo);
    }
}
