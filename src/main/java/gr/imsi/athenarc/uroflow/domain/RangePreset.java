package gr.imsi.athenarc.uroflow.domain;

import java.time.LocalDate;
import java.util.Locale;

/**
 * Named date ranges offered by the range control surface.
 */
public enum RangePreset {
    TODAY("today"),
    YESTERDAY("yesterday"),
    LAST7("last7"),
    CUSTOM("custom");

    private final String name;

    RangePreset(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Computes the range this preset selects.
     *
     * @param today the current local date
     * @param current the range currently set, kept as is by {@link #CUSTOM}
     * @return the resolved range
     */
    public DateRange resolve(LocalDate today, DateRange current) {
        switch (this) {
            case TODAY:
                return DateRange.ofDay(today);
            case YESTERDAY:
                return DateRange.ofDay(today.minusDays(1));
            case LAST7:
                return DateRange.of(today.minusDays(6), today);
            case CUSTOM:
                return current;
            default:
                throw new IllegalStateException("Unknown preset " + this);
        }
    }

    public static RangePreset fromName(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RangePreset preset : values()) {
            if (preset.name.equals(normalized)) {
                return preset;
            }
        }
        throw new IllegalArgumentException("Unsupported range preset: " + value);
    }

    @Override
    public String toString() {
        return name;
    }
}
