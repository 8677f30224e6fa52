package gr.imsi.athenarc.uroflow.domain;

import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** Defines how raw samples are turned into chart points and how their labels read **/
public enum AggregationMode {
    RAW("raw", 0, "HH:mm:ss"),
    FIFTEEN_MINUTES("15min", 15, "yyyy-MM-dd HH:mm:ss"),
    HOURLY("hourly", 60, "HH' : 'yyyy-MM-dd"),
    DAILY("daily", 24 * 60, "yyyy-MM-dd");

    private final String name;
    private final int bucketMinutes;
    private final DateTimeFormatter labelFormatter;

    AggregationMode(String name, int bucketMinutes, String labelPattern) {
        this.name = name;
        this.bucketMinutes = bucketMinutes;
        this.labelFormatter = DateTimeFormatter.ofPattern(labelPattern, Locale.ROOT);
    }

    public String getName() {
        return name;
    }

    /**
     * @return the bucket width in minutes, 0 for {@link #RAW}
     */
    public int getBucketMinutes() {
        return bucketMinutes;
    }

    public boolean isBucketed() {
        return bucketMinutes > 0;
    }

    public DateTimeFormatter getLabelFormatter() {
        return labelFormatter;
    }

    /**
     * Resolves a mode from its name. Accepts the enum constant too, and "min15".
     */
    public static AggregationMode fromName(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("min15")) {
            return FIFTEEN_MINUTES;
        }
        for (AggregationMode mode : values()) {
            if (mode.name.equals(normalized) || mode.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported aggregation mode: " + value);
    }

    @Override
    public String toString() {
        return name;
    }
}
