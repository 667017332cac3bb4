// Copyright 2020-2025 The Defold Foundation
// Copyright 2014-2020 King
// Copyright 2009-2014 Ragnar Svensson, Christian Murray
// Licensed under the Defold License version 1.0 (the "License"); you may not use
// this file except in compliance with the License.
//
// You may obtain a copy of the License, together with FAQs at
// https://www.defold.com/license
//
// Unless required by applicable law or agreed to in writing, software distributed
// under the License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR
// CONDITIONS OF ANY KIND, either express or implied. See the License for the
// specific language governing permissions and limitations under the License.


package com.dynamo.shaderir.glsl;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

/**
 * Literal spelling for the target language.
 */
public class GlslLiterals {

    public static final int SIGNIFICANT_DIGITS = 10;

    private static final MathContext FLOAT_CONTEXT = new MathContext(SIGNIFICANT_DIGITS, RoundingMode.HALF_EVEN);

    /**
     * Formats a float in scientific notation with nine fractional digits and
     * a signed, at least two digit exponent, e.g. "1.500000000e+00". The
     * exact binary value is rounded half-to-even, independent of locale.
     * @param value finite float value
     * @return the literal text
     */
    public static String formatFloat(float value) {
        if (!Float.isFinite(value)) {
            throw new IllegalArgumentException("Float literal must be finite, got " + value);
        }
        boolean negative = (Float.floatToRawIntBits(value) & 0x80000000) != 0;
        String sign = negative ? "-" : "";
        if (value == 0.0f) {
            return sign + "0." + StringUtils.repeat('0', SIGNIFICANT_DIGITS - 1) + "e+00";
        }

        BigDecimal rounded = new BigDecimal(Math.abs((double) value)).round(FLOAT_CONTEXT);
        String digits = rounded.unscaledValue().toString();
        int exponent = digits.length() - 1 - rounded.scale();
        digits = StringUtils.rightPad(digits, SIGNIFICANT_DIGITS, '0');

        return String.format(Locale.ROOT, "%s%c.%se%c%02d",
                sign,
                digits.charAt(0),
                digits.substring(1, SIGNIFICANT_DIGITS),
                exponent < 0 ? '-' : '+',
                Math.abs(exponent));
    }

    public static String formatInt(int value) {
        return Integer.toString(value);
    }

    public static String formatBool(boolean value) {
        return value ? "true" : "false";
    }
}
