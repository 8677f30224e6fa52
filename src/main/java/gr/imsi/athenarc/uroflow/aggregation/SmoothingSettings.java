package gr.imsi.athenarc.uroflow.aggregation;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.uroflow.domain.AggregatedPoint;

/**
 * Whether moving-average smoothing is applied, and with which window.
 */
public class SmoothingSettings {

    public static final int DEFAULT_WINDOW = 3;
    public static final SmoothingSettings DISABLED = new SmoothingSettings(false, DEFAULT_WINDOW);

    private final boolean enabled;
    private final int windowSize;

    private SmoothingSettings(boolean enabled, int windowSize) {
        this.enabled = enabled;
        this.windowSize = windowSize;
    }

    public static SmoothingSettings of(boolean enabled, int windowSize) {
        return new SmoothingSettings(enabled, windowSize);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getWindowSize() {
        return windowSize;
    }

    /**
     * Smooths the points when enabled, returns them unchanged otherwise.
     */
    public ImmutableList<AggregatedPoint> apply(List<AggregatedPoint> points) {
        if (!enabled) {
            return ImmutableList.copyOf(points);
        }
        return Smoother.smooth(points, windowSize);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SmoothingSettings)) return false;
        SmoothingSettings that = (SmoothingSettings) o;
        return enabled == that.enabled && windowSize == that.windowSize;
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, windowSize);
    }

    @Override
    public String toString() {
        return enabled ? "SmoothingSettings{window=" + windowSize + '}' : "SmoothingSettings{off}";
    }
}
