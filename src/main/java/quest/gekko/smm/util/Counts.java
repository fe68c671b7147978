package quest.gekko.smm.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.OptionalLong;

/** Parses follower-style counts such as {@code 12345}, {@code "1,234"}, {@code "1.2万"} or {@code "3亿"}. */
public final class Counts {

    private static final BigDecimal WAN = BigDecimal.valueOf(10_000L);
    private static final BigDecimal YI = BigDecimal.valueOf(100_000_000L);

    private Counts() {}

    public static OptionalLong parse(String text) {
        if (text == null) return OptionalLong.empty();
        String s = text.trim().replace(",", "").replace("+", "");
        if (s.isEmpty()) return OptionalLong.empty();

        BigDecimal multiplier = BigDecimal.ONE;
        if (s.endsWith("万") || s.endsWith("w") || s.endsWith("W")) {
            multiplier = WAN;
            s = s.substring(0, s.length() - 1).trim();
        } else if (s.endsWith("亿")) {
            multiplier = YI;
            s = s.substring(0, s.length() - 1).trim();
        }
        try {
            BigDecimal value = new BigDecimal(s).multiply(multiplier);
            if (value.signum() < 0) return OptionalLong.empty();
            // fractions of a follower are dropped; anything past Long.MAX_VALUE is not a count
            return OptionalLong.of(value.setScale(0, RoundingMode.DOWN).longValueExact());
        } catch (NumberFormatException | ArithmeticException e) {
            return OptionalLong.empty();
        }
    }

    /** Numeric nodes are taken as-is, textual nodes go through {@link #parse(String)}. */
    public static OptionalLong parse(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return OptionalLong.empty();
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) return OptionalLong.empty();
            long value = node.asLong();
            return value < 0 ? OptionalLong.empty() : OptionalLong.of(value);
        }
        if (node.isNumber()) return parse(node.decimalValue().toPlainString());
        if (node.isTextual()) return parse(node.asText());
        return OptionalLong.empty();
    }

    public static Long orNull(JsonNode node) {
        OptionalLong value = parse(node);
        return value.isPresent() ? value.getAsLong() : null;
    }
}
