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

import org.junit.Assert;
import org.junit.Test;

public class CharsTest {

    @Test
    public void testEqualsIgnoreCase() {
        Assert.assertTrue(Chars.equalsIgnoreCase("abc", "ABC"));
        Assert.assertTrue(Chars.equalsIgnoreCase("abc", new StringBuilder("aBc")));
        Assert.assertFalse(Chars.equalsIgnoreCase("abc", "abcd"));
        Assert.assertFalse(Chars.equalsIgnoreCase("abc", " abc"));
        Assert.assertTrue(Chars.equalsIgnoreCase("nan", "-NaN", 1, 4));
    }

    @Test
    public void testEqualsTrimmed() {
        Assert.assertTrue(Chars.equalsTrimmed("-0", "-0"));
        Assert.assertTrue(Chars.equalsTrimmed("-0", " \t-0\n"));
        Assert.assertFalse(Chars.equalsTrimmed("-0", "-0.0"));
        Assert.assertFalse(Chars.equalsTrimmed("-0", "- 0"));
        Assert.assertFalse(Chars.equalsTrimmed("-0", ""));
        Assert.assertTrue(Chars.equalsTrimmed("-0", "\u00a0-0\u0085"));
        Assert.assertFalse(Chars.equalsTrimmed("-0", "\u001f-0"));
    }

    @Test
    public void testIsBlank() {
        Assert.assertTrue(Chars.isBlank(null));
        Assert.assertTrue(Chars.isBlank(""));
        Assert.assertTrue(Chars.isBlank(" \t\r\n\u000B\f"));
        Assert.assertTrue(Chars.isBlank("\u2003"));
        Assert.assertFalse(Chars.isBlank(" 0 "));
        Assert.assertTrue(Chars.isBlank("\u00a0\u0085\u2007\u202f\u2028"));
        Assert.assertFalse(Chars.isBlank("\u001c"));
        Assert.assertFalse(Chars.isBlank("\u200b"));
    }

    @Test
    public void testNumberWhitespace() {
        String s = "\t\n\u000B\f\r 12 \r\n";
        int lo = Chars.skipLeadingNumberWhitespace(s, 0, s.length());
        int hi = Chars.skipTrailingNumberWhitespace(s, lo, s.length());
        Assert.assertEquals(6, lo);
        Assert.assertEquals(8, hi);

        // em space is whitespace, just not around numbers
        Assert.assertFalse(Chars.isNumberWhitespace('\u2003'));
        Assert.assertEquals(0, Chars.skipLeadingNumberWhitespace("\u20031", 0, 2));

        Assert.assertEquals(3, Chars.skipLeadingNumberWhitespace("   ", 0, 3));
        Assert.assertEquals(3, Chars.skipTrailingNumberWhitespace("   ", 3, 3));
    }
}
