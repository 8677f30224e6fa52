package gr.imsi.athenarc.uroflow.projection;

import java.time.ZoneId;
import java.util.List;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.uroflow.domain.AggregatedPoint;
import gr.imsi.athenarc.uroflow.domain.AggregationMode;
import gr.imsi.athenarc.uroflow.domain.DateTimeUtil;

/**
 * Projects aggregated points into chart labels/values and into export rows.
 */
public class Projector {

    private final ZoneId zoneId;

    /**
     * @param zoneId zone in which chart labels are rendered
     */
    public Projector(ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    /**
     * Builds one label/value pair per point, in order. Labels are derived from the bucket
     * start: a date for daily buckets, hour and date for hourly ones, date and time for
     * 15-minute ones and the time of day for raw samples.
     */
    public ChartData chart(List<AggregatedPoint> points, AggregationMode mode) {
        ImmutableList.Builder<String> labels = ImmutableList.builderWithExpectedSize(points.size());
        ImmutableList.Builder<Double> values = ImmutableList.builderWithExpectedSize(points.size());
        for (AggregatedPoint point : points) {
            labels.add(label(point, mode));
            values.add(point.getValue());
        }
        return new ChartData(labels.build(), values.build());
    }

    public String label(AggregatedPoint point, AggregationMode mode) {
        return DateTimeUtil.format(point.getBucketStart(), mode.getLabelFormatter(), zoneId);
    }

    /**
     * Builds one row per point with the bucket start as a UTC ISO-8601 timestamp.
     */
    public ExportTable export(List<AggregatedPoint> points) {
        ImmutableList.Builder<ExportTable.Row> rows = ImmutableList.builderWithExpectedSize(points.size());
        for (AggregatedPoint point : points) {
            rows.add(new ExportTable.Row(DateTimeUtil.formatIso(point.getBucketStart()), point.getValue()));
        }
        return new ExportTable(rows.build());
    }

    public ZoneId getZoneId() {
        return zoneId;
    }
}
