package gr.imsi.athenarc.uroflow.aggregation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.uroflow.domain.AggregatedPoint;
import gr.imsi.athenarc.uroflow.domain.AggregationMode;
import gr.imsi.athenarc.uroflow.domain.DateTimeUtil;
import gr.imsi.athenarc.uroflow.domain.Sample;

/**
 * Turns the flattened sample series into chart points, either one point per sample or
 * one averaged point per fixed-width time bucket.
 */
public class Aggregator {

    private static final Logger LOG = LoggerFactory.getLogger(Aggregator.class);

    private Aggregator() {}

    public static ImmutableList<AggregatedPoint> aggregate(List<? extends Sample> series, AggregationMode mode) {
        if (mode.isBucketed()) {
            return bucket(series, mode.getBucketMinutes());
        }
        return raw(series);
    }

    /**
     * One point per sample, stably sorted by timestamp, with the timestamp as bucket start.
     */
    public static ImmutableList<AggregatedPoint> raw(List<? extends Sample> series) {
        if (series.isEmpty()) {
            return ImmutableList.of();
        }
        List<Sample> sorted = new ArrayList<>(series);
        sorted.sort(Comparator.comparingLong(Sample::getTimestamp));
        ImmutableList.Builder<AggregatedPoint> points = ImmutableList.builderWithExpectedSize(sorted.size());
        for (Sample sample : sorted) {
            points.add(new AggregatedPoint(sample.getTimestamp(), sample.getValue()));
        }
        return points.build();
    }

    /**
     * Averages samples into contiguous buckets of {@code bucketMinutes}. The first bucket starts
     * at the earliest timestamp rounded down to a multiple of the width since the epoch, the
     * last one contains the latest timestamp. Buckets without samples are valued 0.
     *
     * @param series the samples, in any order
     * @param bucketMinutes bucket width in minutes; values below 1 are raised to 1
     * @return one point per bucket
     */
    public static ImmutableList<AggregatedPoint> bucket(List<? extends Sample> series, long bucketMinutes) {
        if (series.isEmpty()) {
            return ImmutableList.of();
        }
        long minutes = bucketMinutes;
        if (minutes < 1) {
            LOG.warn("Bucket width of {} minutes is not positive, using 1 minute", bucketMinutes);
            minutes = 1;
        }
        long width = TimeUnit.MINUTES.toMillis(minutes);
        long minTimestamp = Long.MAX_VALUE;
        long maxTimestamp = Long.MIN_VALUE;
        for (Sample sample : series) {
            minTimestamp = Math.min(minTimestamp, sample.getTimestamp());
            maxTimestamp = Math.max(maxTimestamp, sample.getTimestamp());
        }
        long min = DateTimeUtil.floorToInterval(minTimestamp, width);
        int bucketCount = Math.toIntExact((maxTimestamp - min) / width + 1);

        double[] sums = new double[bucketCount];
        int[] counts = new int[bucketCount];
        for (Sample sample : series) {
            int index = (int) ((sample.getTimestamp() - min) / width);
            sums[index] += sample.getValue();
            counts[index]++;
        }

        ImmutableList.Builder<AggregatedPoint> points = ImmutableList.builderWithExpectedSize(bucketCount);
        for (int i = 0; i < bucketCount; i++) {
            double value = counts[i] == 0 ? 0 : sums[i] / counts[i];
            points.add(new AggregatedPoint(min + i * width, value));
        }
        LOG.debug("Aggregated {} samples into {} buckets of {} ms", series.size(), bucketCount, width);
        return points.build();
    }
}
