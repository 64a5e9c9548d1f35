package scadlite.transpile;

import java.math.BigDecimal;
import java.util.List;
import java.util.StringJoiner;

/** Number literals as the generated JavaScript expects them. */
final class Numbers {
    private Numbers() {}

    private static final double ZERO_EPSILON = 1e-10;

    /** Integral values print without a fraction, nothing prints with an exponent. */
    static String format(double n) {
        if (Double.isNaN(n) || Double.isInfinite(n)) {
            throw new TranspileException("Cannot emit non-finite number: " + n);
        }
        if (Math.abs(n) < ZERO_EPSILON) return "0";
        if (n == Math.rint(n) && Math.abs(n) < 1e15) return Long.toString((long) n);
        return BigDecimal.valueOf(n).stripTrailingZeros().toPlainString();
    }

    static String array(List<Double> values) {
        StringJoiner j = new StringJoiner(", ", "[", "]");
        for (double v : values) j.add(format(v));
        return j.toString();
    }

    static String array(double... values) {
        StringJoiner j = new StringJoiner(", ", "[", "]");
        for (double v : values) j.add(format(v));
        return j.toString();
    }
}
