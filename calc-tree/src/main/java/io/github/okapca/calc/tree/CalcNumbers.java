package io.github.okapca.calc.tree;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/// Number literal formatting for rendered text.
///
/// Values are rounded to [#SIGNIFICANT_DIGITS] significant digits (half-up on the
/// exact binary value) and printed in plain decimal notation with trailing zeros
/// removed, so `2.0` renders `2` and `123456` renders `123460`. A value within
/// [#PI_TOLERANCE] of π renders as the CSS constant `pi`. Non-finite values render
/// as the CSS keywords `NaN`, `infinity` and `-infinity`.
public final class CalcNumbers {

    public static final int SIGNIFICANT_DIGITS = 5;

    public static final double PI_TOLERANCE = 1e-10;

    private static final MathContext PRECISION = new MathContext(SIGNIFICANT_DIGITS, RoundingMode.HALF_UP);

    private CalcNumbers() {}

    public static String format(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "infinity" : "-infinity";
        }
        if (Math.abs(value - Math.PI) < PI_TOLERANCE) {
            return "pi";
        }
        if (value == 0) {
            return "0";
        }
        return new BigDecimal(value).round(PRECISION).stripTrailingZeros().toPlainString();
    }
}
