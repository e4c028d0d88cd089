package work.robolab.sketch.shared;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Coercion helpers for loosely typed parameter values coming from JSON documents.
 */
public final class Values {
    private Values() {}

    /**
     * Interprets {@code raw} as an integer: integral numbers and trimmed decimal strings qualify,
     * booleans, fractions and blank strings do not.
     */
    public static OptionalInt asInt(Object raw) {
        if (raw == null || raw instanceof Boolean) {
            return OptionalInt.empty();
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            long value = ((Number) raw).longValue();
            return fitsInt(value) ? OptionalInt.of((int) value) : OptionalInt.empty();
        }
        if (raw instanceof Number num) {
            double value = num.doubleValue();
            if (Double.isFinite(value) && value == Math.rint(value) && fitsInt((long) value)) {
                return OptionalInt.of((int) value);
            }
            return OptionalInt.empty();
        }
        if (raw instanceof String str && !str.isBlank()) {
            try {
                return OptionalInt.of(Integer.parseInt(str.trim()));
            } catch (NumberFormatException ignored) {
                return OptionalInt.empty();
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Parses a digital pin reference such as {@code 13}, {@code "13"} or {@code "A0"}.
     * One leading analog-style {@code A} prefix is stripped before the integer parse.
     */
    public static OptionalInt asPin(Object raw) {
        if (raw instanceof String str) {
            String trimmed = str.trim();
            if (trimmed.toUpperCase(Locale.ROOT).startsWith("A")) {
                trimmed = trimmed.substring(1);
            }
            return asInt(trimmed);
        }
        return asInt(raw);
    }

    /**
     * Text form used when a value is substituted into generated source. Integral floating point
     * values lose their trailing {@code .0} so that {@code 13.0} from a JSON document prints as {@code 13}.
     */
    public static String asText(Object raw) {
        if (raw == null) {
            return "";
        }
        if (raw instanceof Double || raw instanceof Float) {
            double value = ((Number) raw).doubleValue();
            if (Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
                return Long.toString((long) value);
            }
            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }
        if (raw instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        return String.valueOf(raw);
    }

    public static String trimToNull(Object raw) {
        if (raw == null) return null;
        String str = String.valueOf(raw).trim();
        return str.isEmpty() ? null : str;
    }

    private static boolean fitsInt(long value) {
        return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
    }
}
