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

import java.math.BigDecimal;

public class DecimalParserTest {

    @Test
    public void testBasic() throws Exception {
        assertDecimal("123.45", "123.45");
        assertDecimal("-0.001", "-0.001");
        assertDecimal("+7", "7");
        assertDecimal(".5", "0.5");
        assertDecimal("5.", "5");
        assertDecimal("00123.45", "123.45");
        assertDecimal("0", "0");
        assertDecimal("000", "0");
        assertDecimal("0.", "0");
    }

    @Test
    public void testExponent() throws Exception {
        assertDecimal("1.23e5", "123000");
        assertDecimal("123e-2", "1.23");
        assertDecimal("4.56E-3", "0.00456");
        assertDecimal("1E+2", "100");
        assertDecimal("0e99", "0");
    }

    @Test
    public void testInvalid() {
        assertFailure("", "invalid decimal: empty value");
        assertFailure("   ", "invalid decimal: empty value");
        assertFailure("-", "invalid decimal: empty value");
        assertFailure(".", "invalid decimal: '.' contains no digits");
        assertFailure("abc", "invalid decimal: 'abc' contains no digits");
        assertFailure("12a", "decimal '12a' contains invalid character 'a'");
        assertFailure("1.2.3", "decimal '1.2.3' contains invalid character '.'");
        assertFailure("1e", "empty integer string");
        assertFailure("1e1.5", "invalid character in integer: 1.5");
        assertFailure("NaN", "invalid decimal: 'NaN' contains no digits");
    }

    @Test
    public void testMagnitudeLimit() throws Exception {
        assertDecimal("79228162514264337593543950335", "79228162514264337593543950335");
        assertDecimal("-79228162514264337593543950335", "-79228162514264337593543950335");
        assertFailure("79228162514264337593543950336", "decimal '79228162514264337593543950336' exceeds maximum allowed magnitude of 96 bits");
        assertFailure("1e29", "decimal '1e29' exceeds maximum allowed magnitude of 96 bits");
        assertFailure("1e30", "decimal '1e30' exceeds maximum allowed magnitude of 96 bits");
        assertDecimal("7.9228162514264337593543950335e28", "79228162514264337593543950335");
    }

    @Test
    public void testRange() throws Exception {
        Assert.assertEquals(new BigDecimal("-42.5"), DecimalParser.parse("[-42.5]", 1, 6));
    }

    @Test
    public void testRoundsExcessDigits() throws Exception {
        // 28 decimal places is the limit
        assertDecimal("0.12345678901234567890123456789", "0.1234567890123456789012345679");
        assertDecimal("0.00000000000000000000000000005", "0E-28");
        assertDecimal("1e-50", "0E-28");
        // magnitude forces a smaller scale
        assertDecimal("12345678901234567890123456789.5", "12345678901234567890123456790");
        assertDecimal("1.2345678901234567890123456789", "1.2345678901234567890123456789");
        assertDecimal("9.2345678901234567890123456789", "9.234567890123456789012345679");
    }

    @Test
    public void testTrailingZerosKeepScale() throws Exception {
        BigDecimal value = DecimalParser.parse("1.50", 0, 4);
        Assert.assertEquals(2, value.scale());
        Assert.assertEquals("1.50", value.toPlainString());
    }

    @Test
    public void testWhitespace() throws Exception {
        assertDecimal(" \t12.5\n", "12.5");
    }

    private static void assertDecimal(String input, String expected) throws NumericException {
        BigDecimal actual = DecimalParser.parse(input, 0, input.length());
        Assert.assertEquals(input, 0, new BigDecimal(expected).compareTo(actual));
    }

    private static void assertFailure(String input, String expectedMessage) {
        try {
            DecimalParser.parse(input, 0, input.length());
            Assert.fail("accepted: '" + input + '\'');
        } catch (NumericException e) {
            Assert.assertEquals(expectedMessage, e.getMessage());
        }
    }
}
