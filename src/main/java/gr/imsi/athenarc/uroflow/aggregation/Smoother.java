package gr.imsi.athenarc.uroflow.aggregation;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.uroflow.domain.AggregatedPoint;

/**
 * Centered moving average over aggregated points.
 */
public class Smoother {

    private static final Logger LOG = LoggerFactory.getLogger(Smoother.class);

    private Smoother() {}

    /**
     * Replaces every value by the mean of the points within {@code windowSize / 2} positions
     * on either side. Windows are cut at the ends of the sequence, so boundary means use
     * fewer points. Bucket starts are kept.
     *
     * @param points the points to smooth
     * @param windowSize window size; values below 1 are raised to 1
     * @return smoothed points, as many as given
     */
    public static ImmutableList<AggregatedPoint> smooth(List<AggregatedPoint> points, int windowSize) {
        int window = windowSize;
        if (window < 1) {
            LOG.warn("Smoothing window {} is not positive, using 1", windowSize);
            window = 1;
        }
        int n = points.size();
        int half = window / 2;
        ImmutableList.Builder<AggregatedPoint> smoothed = ImmutableList.builderWithExpectedSize(n);
        for (int i = 0; i < n; i++) {
            int start = Math.max(0, i - half);
            int end = Math.min(n - 1, i + half);
            double sum = 0;
            for (int j = start; j <= end; j++) {
                sum += points.get(j).getValue();
            }
            smoothed.add(points.get(i).withValue(sum / (end - start + 1)));
        }
        return smoothed.build();
    }
}
