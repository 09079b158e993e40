/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Formats doubles the way Number::toString does for radix 10, ECMA 9.8.1.
 *
 * <p>The digits are the shortest decimal string that reads back as the same double. {@link
 * Double#toString(double)} is not used because it does not always produce the shortest digits
 * before JDK 19 (1.23e22 prints as 1.2300000000000001E22).
 */
final class DoubleFormatter {

    private DoubleFormatter() {}

    static String toString(double d) {
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (d == Double.POSITIVE_INFINITY) {
            return "Infinity";
        }
        if (d == Double.NEGATIVE_INFINITY) {
            return "-Infinity";
        }
        if (d == 0.0) {
            return "0";
        }
        if (d < 0) {
            return "-" + toString(-d);
        }
        BigDecimal decimal = shortest(d);
        String digits = decimal.unscaledValue().toString();
        // d == digits * 10^(n - k)
        int k = digits.length();
        int n = k - decimal.scale();
        if (k <= n && n <= 21) {
            return digits + "0".repeat(n - k);
        }
        if (0 < n && n <= 21) {
            return digits.substring(0, n) + '.' + digits.substring(n);
        }
        if (-6 < n && n <= 0) {
            return "0." + "0".repeat(-n) + digits;
        }
        int e = n - 1;
        String exponent = (e < 0 ? "e-" : "e+") + Math.abs(e);
        if (k == 1) {
            return digits + exponent;
        }
        return digits.charAt(0) + "." + digits.substring(1) + exponent;
    }

    /**
     * Returns the decimal with the fewest significant digits that converts back to {@code d},
     * without trailing zeros. Among candidates of that length the one closest to {@code d} wins.
     */
    static BigDecimal shortest(double d) {
        BigDecimal exact = new BigDecimal(d);
        for (int precision = 1; precision <= 17; precision++) {
            BigDecimal nearest = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (nearest.doubleValue() == d) {
                return nearest.stripTrailingZeros();
            }
            // Next to a power of two the round trip interval is lopsided, so the nearest
            // candidate can miss while its neighbour on the wider side still reads back.
            BigDecimal down = exact.round(new MathContext(precision, RoundingMode.FLOOR));
            BigDecimal up = exact.round(new MathContext(precision, RoundingMode.CEILING));
            boolean downFits = down.doubleValue() == d;
            boolean upFits = up.doubleValue() == d;
            if (downFits && upFits) {
                BigDecimal toDown = exact.subtract(down);
                BigDecimal toUp = up.subtract(exact);
                return (toDown.compareTo(toUp) <= 0 ? down : up).stripTrailingZeros();
            }
            if (downFits) {
                return down.stripTrailingZeros();
            }
            if (upFits) {
                return up.stripTrailingZeros();
            }
        }
        return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros();
    }
}
