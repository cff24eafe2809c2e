package ir.value.constants;

import java.math.BigDecimal;
import java.math.MathContext;

import ir.type.FloatType;

public class ConstantFloat extends Constant {
    // same cut-over to exponent form as a shortest %g
    private static final int MAX_PLAIN_EXPONENT = 6;
    private static final int MIN_PLAIN_EXPONENT = -4;

    private final double value;

    public ConstantFloat(FloatType type, double value) {
        super(type);
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String getLiteral() {
        return format(value);
    }

    /**
     * Shortest decimal that round-trips, in plain form when the decimal
     * exponent is in [-4, 6) and as {@code d.ddde±XX} otherwise:
     * 3.5 → "3.5", 2.0 → "2", 1e6 → "1e+06", 1e-5 → "1e-05".
     */
    public static String format(double v) {
        if (Double.isNaN(v)) {
            return "NaN";
        }
        if (Double.isInfinite(v)) {
            return v > 0 ? "+Inf" : "-Inf";
        }
        if (v == 0) {
            return (1 / v) < 0 ? "-0" : "0";
        }

        BigDecimal bd = shortest(v);
        String digits = bd.unscaledValue().abs().toString();
        int exponent = digits.length() - bd.scale() - 1;
        String sign = bd.signum() < 0 ? "-" : "";

        if (exponent < MIN_PLAIN_EXPONENT || exponent >= MAX_PLAIN_EXPONENT) {
            StringBuilder sb = new StringBuilder(sign);
            sb.append(digits.charAt(0));
            if (digits.length() > 1) {
                sb.append('.').append(digits, 1, digits.length());
            }
            sb.append('e').append(exponent < 0 ? '-' : '+');
            int absExp = Math.abs(exponent);
            if (absExp < 10) {
                sb.append('0');
            }
            sb.append(absExp);
            return sb.toString();
        }
        return bd.toPlainString();
    }

    // Double.toString is not always the shortest form on JDK 17
    private static BigDecimal shortest(double v) {
        BigDecimal exact = new BigDecimal(v);
        for (int precision = 1; precision < 17; precision++) {
            BigDecimal candidate = exact.round(new MathContext(precision));
            if (Double.parseDouble(candidate.toString()) == v) {
                return candidate.stripTrailingZeros();
            }
        }
        return exact.round(new MathContext(17)).stripTrailingZeros();
    }
}
