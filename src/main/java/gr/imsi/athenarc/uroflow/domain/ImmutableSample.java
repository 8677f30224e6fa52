package gr.imsi.athenarc.uroflow.domain;

import java.util.Objects;

/**
 * Represents an immutable flow-rate sample with a single value and a timestamp.
 */
public class ImmutableSample implements Sample {

    private final long timestamp;

    private final double value;

    public ImmutableSample(final long timestamp, final double value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImmutableSample)) return false;
        ImmutableSample that = (ImmutableSample) o;
        return timestamp == that.timestamp && Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "{" + timestamp + ", " + DateTimeUtil.formatIso(timestamp) +
                ", " + value +
                '}';
    }
}
