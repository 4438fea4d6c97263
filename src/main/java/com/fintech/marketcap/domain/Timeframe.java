package com.fintech.marketcap.domain;

import java.io.Serializable;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Candle bucket width with epoch-aligned window calculations.
 * Labels follow chart conventions: "1m", "5m", "15m", "1h", "1d".
 *
 * @param millis Bucket width in milliseconds (positive)
 */
public record Timeframe(long millis) implements Comparable<Timeframe>, Serializable {

    private static final long SECOND = 1_000L;
    private static final long MINUTE = 60 * SECOND;
    private static final long HOUR = 60 * MINUTE;
    private static final long DAY = 24 * HOUR;
    private static final long WEEK = 7 * DAY;

    private static final Pattern LABEL = Pattern.compile("^(\\d+)([smhdw])$");

    public static final Timeframe M1 = new Timeframe(MINUTE);
    public static final Timeframe M5 = new Timeframe(5 * MINUTE);
    public static final Timeframe M15 = new Timeframe(15 * MINUTE);
    public static final Timeframe H1 = new Timeframe(HOUR);

    public Timeframe {
        if (millis <= 0) {
            throw new IllegalArgumentException("Timeframe must be positive, got " + millis + "ms");
        }
    }

    public static Timeframe ofMillis(long millis) {
        return new Timeframe(millis);
    }

    /**
     * Parses a label such as "1m", "15m", "4h", "1d" or "1w".
     *
     * @throws IllegalArgumentException on malformed labels or a zero amount
     */
    public static Timeframe parse(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Timeframe label cannot be null");
        }
        Matcher matcher = LABEL.matcher(label.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new IllegalArgumentException(
                "Unsupported timeframe: '" + label + "'. Expected <number><s|m|h|d|w>, e.g. 1m, 15m, 1h");
        }
        long amount = Long.parseLong(matcher.group(1));
        long unit = switch (matcher.group(2)) {
            case "s" -> SECOND;
            case "m" -> MINUTE;
            case "h" -> HOUR;
            case "d" -> DAY;
            case "w" -> WEEK;
            default -> throw new IllegalArgumentException("Unsupported timeframe unit in '" + label + "'");
        };
        return new Timeframe(Math.multiplyExact(amount, unit));
    }

    /**
     * Aligns timestamp to window start: floor(timestamp / millis) * millis.
     * Uses floor division so pre-epoch timestamps still align downwards.
     */
    public long alignTimestamp(long timestamp) {
        return Math.floorDiv(timestamp, millis) * millis;
    }

    /** Returns exclusive window end: windowStart + millis. */
    public long windowEnd(long windowStart) {
        return windowStart + millis;
    }

    /** Returns the chart label, using the largest whole unit ("60000ms" -> "1m"). */
    public String label() {
        if (millis % DAY == 0) {
            return millis / DAY + "d";
        }
        if (millis % HOUR == 0) {
            return millis / HOUR + "h";
        }
        if (millis % MINUTE == 0) {
            return millis / MINUTE + "m";
        }
        if (millis % SECOND == 0) {
            return millis / SECOND + "s";
        }
        return millis + "ms";
    }

    @Override
    public int compareTo(Timeframe other) {
        return Long.compare(millis, other.millis);
    }

    @Override
    public String toString() {
        return label();
    }
}
