package gr.imsi.athenarc.uroflow.manager;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import gr.imsi.athenarc.uroflow.aggregation.Aggregator;
import gr.imsi.athenarc.uroflow.aggregation.SmoothingSettings;
import gr.imsi.athenarc.uroflow.config.FlowMonitorConfiguration;
import gr.imsi.athenarc.uroflow.datasource.PartitionDataSource;
import gr.imsi.athenarc.uroflow.domain.AggregatedPoint;
import gr.imsi.athenarc.uroflow.domain.AggregationMode;
import gr.imsi.athenarc.uroflow.domain.DateRange;
import gr.imsi.athenarc.uroflow.domain.DateTimeUtil;
import gr.imsi.athenarc.uroflow.domain.PartitionKey;
import gr.imsi.athenarc.uroflow.domain.RangePreset;
import gr.imsi.athenarc.uroflow.domain.Sample;
import gr.imsi.athenarc.uroflow.projection.ChartData;
import gr.imsi.athenarc.uroflow.projection.ChartSink;
import gr.imsi.athenarc.uroflow.projection.ExportSink;
import gr.imsi.athenarc.uroflow.projection.ExportTable;
import gr.imsi.athenarc.uroflow.projection.LoggingChartSink;
import gr.imsi.athenarc.uroflow.projection.Projector;
import gr.imsi.athenarc.uroflow.store.SeriesStore;
import gr.imsi.athenarc.uroflow.subscription.SubscriptionException;
import gr.imsi.athenarc.uroflow.subscription.SubscriptionSet;
import gr.imsi.athenarc.uroflow.subscription.SubscriptionWarningListener;

/**
 * Drives the flow chart of one patient: holds the range and aggregation controls, keeps
 * the day subscriptions in line with the selected range and pushes a new chart projection
 * to the {@link ChartSink} whenever the series or a control changes.
 */
public class FlowChartManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(FlowChartManager.class);

    private final String patientId;
    private final ZoneId zoneId;
    private final Clock clock;
    private final SeriesStore store;
    private final SubscriptionSet subscriptions;
    private final Projector projector;
    private final ChartSink chartSink;

    private RangePreset preset;
    private DateRange range;
    private AggregationMode mode;
    private SmoothingSettings smoothing;
    private boolean started;
    private boolean closed;

    // inputs of the last computation, used to skip recomputing unchanged projections
    private long computedVersion = -1;
    private AggregationMode computedMode;
    private SmoothingSettings computedSmoothing;
    private int rawSampleCount;
    private ImmutableList<AggregatedPoint> points = ImmutableList.of();
    private ChartData chartData = ChartData.EMPTY;
    private boolean delivered;

    private FlowChartManager(Builder builder) {
        FlowMonitorConfiguration config = builder.configuration;
        this.patientId = builder.patientId;
        this.zoneId = config.getZoneId();
        this.clock = builder.clock;
        this.store = new SeriesStore();
        this.subscriptions = new SubscriptionSet(builder.dataSource, store);
        this.projector = new Projector(zoneId);
        this.chartSink = builder.chartSink;
        this.preset = config.getPreset();
        LocalDate today = today();
        this.range = preset.resolve(today, DateRange.ofDay(today));
        this.mode = config.getMode();
        this.smoothing = config.getSmoothing();

        subscriptions.addChangeListener(this::refresh);
        if (builder.warningListener != null) {
            subscriptions.addWarningListener(builder.warningListener);
        }
    }

    /**
     * Subscribes to the partitions of the initial range.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        LOG.info("Starting flow chart of patient {} with preset {} ({}), mode {}, {}",
                patientId, preset, range, mode, smoothing);
        subscriptions.update(range);
        refresh();
    }

    /**
     * Selects a custom range; both days are inclusive.
     */
    public synchronized void setRange(LocalDate start, LocalDate end) {
        preset = RangePreset.CUSTOM;
        applyRange(DateRange.of(start, end));
    }

    /**
     * Selects a preset. {@link RangePreset#CUSTOM} keeps the current range.
     */
    public synchronized void setPreset(RangePreset newPreset) {
        Preconditions.checkNotNull(newPreset, "preset");
        preset = newPreset;
        applyRange(newPreset.resolve(today(), range));
    }

    public synchronized void setMode(AggregationMode newMode) {
        Preconditions.checkNotNull(newMode, "mode");
        LOG.info("Aggregation mode of patient {} set to {}", patientId, newMode);
        mode = newMode;
        refresh();
    }

    public synchronized void setSmoothing(boolean enabled, int windowSize) {
        smoothing = SmoothingSettings.of(enabled, windowSize);
        LOG.info("Smoothing of patient {} set to {}", patientId, smoothing);
        refresh();
    }

    /**
     * Recomputes the chart projection if the series or a control changed since the last
     * computation and hands it to the chart sink if it differs from the last one delivered.
     */
    public synchronized void refresh() {
        if (closed || !started) {
            return;
        }
        long version = store.getVersion();
        if (version == computedVersion && mode == computedMode && smoothing.equals(computedSmoothing)) {
            return;
        }
        ImmutableList<Sample> series = store.snapshotSeries();
        points = smoothing.apply(Aggregator.aggregate(series, mode));
        rawSampleCount = series.size();
        computedVersion = version;
        computedMode = mode;
        computedSmoothing = smoothing;
        LOG.debug("Recomputed chart of patient {}: {} samples, {} points", patientId, rawSampleCount, points.size());

        ChartData next = projector.chart(points, mode);
        if (!delivered || !next.equals(chartData)) {
            delivered = true;
            chartData = next;
            chartSink.accept(next);
        }
    }

    /**
     * Hands the current points to an export sink under {@link #getSuggestedFilename()}.
     *
     * @throws IOException if the sink fails to write
     */
    public void export(ExportSink exportSink) throws IOException {
        String filename;
        ExportTable table;
        synchronized (this) {
            filename = getSuggestedFilename();
            table = projector.export(points);
        }
        exportSink.export(filename, table);
    }

    public synchronized ExportTable getExportTable() {
        return projector.export(points);
    }

    public synchronized String getSuggestedFilename() {
        return patientId + "_flow_" + DateTimeUtil.formatDate(range.getStart())
                + "_to_" + DateTimeUtil.formatDate(range.getEnd()) + ".csv";
    }

    /**
     * Cancels all subscriptions. The manager cannot be restarted.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        subscriptions.close();
        LOG.info("Closed flow chart of patient {}", patientId);
    }

    private void applyRange(DateRange newRange) {
        if (closed) {
            LOG.warn("Ignoring range change of closed flow chart of patient {}", patientId);
            return;
        }
        LOG.info("Range of patient {} set to {} (preset {})", patientId, newRange, preset);
        range = newRange;
        if (started) {
            subscriptions.update(newRange);
            refresh();
        }
    }

    private LocalDate today() {
        return clock.instant().atZone(zoneId).toLocalDate();
    }

    public String getPatientId() {
        return patientId;
    }

    public synchronized DateRange getRange() {
        return range;
    }

    public synchronized RangePreset getPreset() {
        return preset;
    }

    public synchronized AggregationMode getMode() {
        return mode;
    }

    public synchronized SmoothingSettings getSmoothing() {
        return smoothing;
    }

    public synchronized ChartData getChartData() {
        return chartData;
    }

    public synchronized ImmutableList<AggregatedPoint> getPoints() {
        return points;
    }

    public synchronized int getRawSampleCount() {
        return rawSampleCount;
    }

    public synchronized int getAggregatedPointCount() {
        return points.size();
    }

    public ImmutableList<PartitionKey> getSubscribedPartitions() {
        return subscriptions.getKeys();
    }

    public boolean isLoading() {
        return subscriptions.isLoading();
    }

    public ImmutableMap<PartitionKey, SubscriptionException> getSubscriptionErrors() {
        return subscriptions.getErrors();
    }

    /**
     * Creates a new builder for a patient's flow chart.
     *
     * @param dataSource the partitioned sample store
     * @param patientId the patient whose history is charted
     */
    public static Builder builder(PartitionDataSource dataSource, String patientId) {
        return new Builder(dataSource, patientId);
    }

    public static class Builder {
        private final PartitionDataSource dataSource;
        private final String patientId;
        private FlowMonitorConfiguration configuration = FlowMonitorConfiguration.defaults();
        private Clock clock = Clock.systemDefaultZone();
        private ChartSink chartSink = new LoggingChartSink();
        private SubscriptionWarningListener warningListener;

        public Builder(PartitionDataSource dataSource, String patientId) {
            this.dataSource = Preconditions.checkNotNull(dataSource, "dataSource");
            this.patientId = Preconditions.checkNotNull(patientId, "patientId");
        }

        public Builder withConfiguration(FlowMonitorConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withChartSink(ChartSink chartSink) {
            this.chartSink = chartSink;
            return this;
        }

        public Builder withWarningListener(SubscriptionWarningListener warningListener) {
            this.warningListener = warningListener;
            return this;
        }

        public FlowChartManager build() {
            return new FlowChartManager(this);
        }
    }
}
