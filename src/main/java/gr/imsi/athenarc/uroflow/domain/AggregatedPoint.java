package gr.imsi.athenarc.uroflow.domain;

import java.util.Objects;

/**
 * A point of the aggregated series: the start of its bucket (or the sample timestamp
 * when unbucketed) and the aggregated value.
 */
public class AggregatedPoint {

    private final long bucketStart;

    private final double value;

    public AggregatedPoint(long bucketStart, double value) {
        this.bucketStart = bucketStart;
        this.value = value;
    }

    public long getBucketStart() {
        return bucketStart;
    }

    public double getValue() {
        return value;
    }

    /**
     * Returns a point at the same bucket start carrying {@code newValue}.
     */
    public AggregatedPoint withValue(double newValue) {
        return new AggregatedPoint(bucketStart, newValue);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregatedPoint)) return false;
        AggregatedPoint that = (AggregatedPoint) o;
        return bucketStart == that.bucketStart && Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(bucketStart, value);
    }

    @Override
    public String toString() {
        return "AggregatedPoint{" + DateTimeUtil.formatIso(bucketStart) + ", " + value + '}';
    }
}
