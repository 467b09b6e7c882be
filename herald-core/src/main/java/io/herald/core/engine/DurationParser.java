package io.herald.core.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses compact duration strings such as {@code 30m}, {@code 2h}, {@code 1h30m} or {@code 1.5h}.
 * Accepted units are ns, us (or µs), ms, s, m and h; components may repeat and carry decimals.
 */
public final class DurationParser {
    private static final Pattern COMPONENT = Pattern.compile("(\\d+(?:\\.\\d*)?|\\.\\d+)(ns|us|µs|μs|ms|s|m|h)");
    private static final Map<String, Long> UNIT_NANOS = Map.of(
        "ns", 1L,
        "us", 1_000L,
        "µs", 1_000L,
        "μs", 1_000L,
        "ms", 1_000_000L,
        "s", 1_000_000_000L,
        "m", 60_000_000_000L,
        "h", 3_600_000_000_000L
    );

    private DurationParser() {
    }

    public static Duration parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw invalid(raw);
        }
        String value = raw.trim();
        if ("0".equals(value)) {
            return Duration.ZERO;
        }

        Matcher matcher = COMPONENT.matcher(value);
        BigDecimal totalNanos = BigDecimal.ZERO;
        int position = 0;
        while (position < value.length()) {
            matcher.region(position, value.length());
            if (!matcher.lookingAt()) {
                throw invalid(raw);
            }
            BigDecimal amount = new BigDecimal(normalize(matcher.group(1)));
            totalNanos = totalNanos.add(amount.multiply(BigDecimal.valueOf(UNIT_NANOS.get(matcher.group(2)))));
            position = matcher.end();
        }

        try {
            return Duration.ofNanos(totalNanos.setScale(0, RoundingMode.DOWN).longValueExact());
        } catch (ArithmeticException e) {
            throw new ScheduleSpecException(ScheduleSpecException.Field.DURATION, "Duration out of range: " + raw);
        }
    }

    private static String normalize(String number) {
        if (number.startsWith(".")) {
            return "0" + number;
        }
        if (number.endsWith(".")) {
            return number.substring(0, number.length() - 1);
        }
        return number;
    }

    private static ScheduleSpecException invalid(String raw) {
        return new ScheduleSpecException(
            ScheduleSpecException.Field.DURATION,
            "Invalid interval '" + raw + "'. Use values like 30m, 2h or 1h30m"
        );
    }
}
