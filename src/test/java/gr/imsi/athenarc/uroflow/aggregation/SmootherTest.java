package gr.imsi.athenarc.uroflow.aggregation;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import gr.imsi.athenarc.uroflow.domain.AggregatedPoint;

public class SmootherTest {

    private static List<AggregatedPoint> points(double... values) {
        List<AggregatedPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(new AggregatedPoint(i * 1000L, values[i]));
        }
        return points;
    }

    private static double[] values(List<AggregatedPoint> points) {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }

    @Test
    public void testCenteredWindowIsTruncatedAtBoundaries() {
        List<AggregatedPoint> smoothed = Smoother.smooth(points(1, 2, 3, 4, 5), 3);

        assertArrayEquals(new double[]{1.5, 2, 3, 4, 4.5}, values(smoothed), 1e-12);
    }

    @Test
    public void testPreservesLengthAndTimestamps() {
        List<AggregatedPoint> input = points(5, 1, 7, 3, 9, 2);
        for (int window = 1; window <= 8; window++) {
            List<AggregatedPoint> smoothed = Smoother.smooth(input, window);
            assertEquals(input.size(), smoothed.size());
            for (int i = 0; i < input.size(); i++) {
                assertEquals(input.get(i).getBucketStart(), smoothed.get(i).getBucketStart());
            }
        }
    }

    @Test
    public void testWindowOfOneIsIdentity() {
        List<AggregatedPoint> input = points(5, 1, 7, 3);
        assertEquals(input, Smoother.smooth(input, 1));
    }

    @Test
    public void testNonPositiveWindowIsClampedToOne() {
        List<AggregatedPoint> input = points(5, 1, 7);
        assertEquals(input, Smoother.smooth(input, 0));
        assertEquals(input, Smoother.smooth(input, -4));
    }

    @Test
    public void testEvenWindowUsesHalfOnEachSide() {
        List<AggregatedPoint> smoothed = Smoother.smooth(points(1, 2, 3, 4, 5), 2);

        assertArrayEquals(new double[]{1.5, 2, 3, 4, 4.5}, values(smoothed), 1e-12);
    }

    @Test
    public void testEmptyInput() {
        assertTrue(Smoother.smooth(new ArrayList<>(), 3).isEmpty());
    }

    @Test
    public void testDisabledSettingsPassThrough() {
        List<AggregatedPoint> input = points(1, 2, 3, 4, 5);

        assertEquals(input, SmoothingSettings.DISABLED.apply(input));
        assertArrayEquals(new double[]{1.5, 2, 3, 4, 4.5}, values(SmoothingSettings.of(true, 3).apply(input)), 1e-12);
    }
}
