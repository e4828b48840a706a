package com.motionbake.codegen.service.codegen;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Locale;

/**
 * Literal formats shared by the C-family target languages.
 */
public abstract class StringifierBase implements Stringifier {

    private static final MathContext FLOAT_PRECISION = new MathContext(9, RoundingMode.HALF_EVEN);

    // Composition time spans count in 100ns ticks.
    private static final long NANOS_PER_TICK = 100;

    @Override
    public String getMemberSelect() {
        return ".";
    }

    @Override
    public String bool(boolean value) {
        return value ? "true" : "false";
    }

    @Override
    public String int32(int value) {
        return Integer.toString(value);
    }

    /**
     * Integral values are written without a fractional part, everything else with
     * up to 9 significant digits and a float suffix.
     */
    @Override
    public String float32(float value) {
        if (!Float.isFinite(value)) {
            throw new IllegalArgumentException("Cannot write non-finite float: " + value);
        }
        BigDecimal exact = new BigDecimal((double) value);
        if (Math.floor(value) == value) {
            return exact.toBigInteger().toString();
        }
        return exact.round(FLOAT_PRECISION).stripTrailingZeros().toPlainString() + "F";
    }

    @Override
    public String string(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    @Override
    public String timeSpan(Duration value) {
        return timeSpan(int64(ticks(value)));
    }

    public static long ticks(Duration value) {
        return value.toNanos() / NANOS_PER_TICK;
    }

    public String hex(int value) {
        return String.format(Locale.ROOT, "0x%02X", value);
    }
}
