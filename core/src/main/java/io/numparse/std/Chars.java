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
import org.jetbrains.annotations.Nullable;

public final class Chars {

    private Chars() {
    }

    public static boolean empty(@Nullable CharSequence value) {
        return value == null || value.length() < 1;
    }

    public static boolean equals(@NotNull CharSequence l, @NotNull CharSequence r) {
        if (l == r) {
            return true;
        }

        int ll;
        if ((ll = l.length()) != r.length()) {
            return false;
        }

        return equalsChars(l, r, ll);
    }

    public static boolean equals(@NotNull CharSequence l, @NotNull CharSequence r, int rLo, int rHi) {
        if (l == r) {
            return true;
        }

        int ll;
        if ((ll = l.length()) != rHi - rLo) {
            return false;
        }

        for (int i = 0; i < ll; i++) {
            if (l.charAt(i) != r.charAt(i + rLo)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Case-insensitive comparison of two char sequences.
     *
     * @param l left sequence
     * @param r right sequence
     * @return true if sequences match exactly (ignoring char case)
     */
    public static boolean equalsIgnoreCase(@NotNull CharSequence l, @NotNull CharSequence r) {
        if (l == r) {
            return true;
        }

        int ll;
        if ((ll = l.length()) != r.length()) {
            return false;
        }

        return equalsCharsIgnoreCase(l, r, ll);
    }

    public static boolean equalsIgnoreCase(@NotNull CharSequence l, @NotNull CharSequence r, int rLo, int rHi) {
        int ll;
        if ((ll = l.length()) != rHi - rLo) {
            return false;
        }

        for (int i = 0; i < ll; i++) {
            if (Character.toLowerCase(l.charAt(i)) != Character.toLowerCase(r.charAt(i + rLo))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Compares the term with the sequence stripped of leading and trailing
     * Unicode whitespace, see {@link #isUnicodeWhitespace(char)}.
     *
     * @param term  exact text to look for
     * @param value sequence to trim and compare
     * @return true if the trimmed value equals the term
     */
    public static boolean equalsTrimmed(@NotNull CharSequence term, @NotNull CharSequence value) {
        int lo = 0;
        int hi = value.length();
        while (lo < hi && isUnicodeWhitespace(value.charAt(lo))) {
            lo++;
        }
        while (hi > lo && isUnicodeWhitespace(value.charAt(hi - 1))) {
            hi--;
        }
        return equals(term, value, lo, hi);
    }

    public static boolean isBlank(CharSequence s) {
        if (s == null) {
            return true;
        }

        int len = s.length();
        for (int i = 0; i < len; i++) {
            if (!isUnicodeWhitespace(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Unicode White_Space: the space, line and paragraph separators (no-break
     * spaces included), '\t' to '\r' and NEL. Unlike {@link Character#isWhitespace(char)}
     * this excludes the information separators U+001C to U+001F.
     */
    public static boolean isUnicodeWhitespace(char c) {
        return Character.isSpaceChar(c) || (c >= '\t' && c <= '\r') || c == '\u0085';
    }

    // whitespace tolerated around numeric literals: '\t', '\n', '\u000B', '\f', '\r' and ' '
    public static boolean isNumberWhitespace(char c) {
        return c == ' ' || (c >= '\t' && c <= '\r');
    }

    public static int skipLeadingNumberWhitespace(CharSequence cs, int lo, int hi) {
        while (lo < hi && isNumberWhitespace(cs.charAt(lo))) {
            lo++;
        }
        return lo;
    }

    public static int skipTrailingNumberWhitespace(CharSequence cs, int lo, int hi) {
        while (hi > lo && isNumberWhitespace(cs.charAt(hi - 1))) {
            hi--;
        }
        return hi;
    }

    private static boolean equalsChars(@NotNull CharSequence l, @NotNull CharSequence r, int len) {
        for (int i = 0; i < len; i++) {
            if (l.charAt(i) != r.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private static boolean equalsCharsIgnoreCase(@NotNull CharSequence l, @NotNull CharSequence r, int len) {
        for (int i = 0; i < len; i++) {
            if (Character.toLowerCase(l.charAt(i)) != Character.toLowerCase(r.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
