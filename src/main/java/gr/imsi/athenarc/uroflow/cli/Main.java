package gr.imsi.athenarc.uroflow.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;

import gr.imsi.athenarc.uroflow.config.FlowMonitorConfiguration;
import gr.imsi.athenarc.uroflow.datasource.InMemoryPartitionDataSource;
import gr.imsi.athenarc.uroflow.datasource.json.JsonHistoryLoader;
import gr.imsi.athenarc.uroflow.domain.AggregationMode;
import gr.imsi.athenarc.uroflow.domain.RangePreset;
import gr.imsi.athenarc.uroflow.manager.FlowChartManager;
import gr.imsi.athenarc.uroflow.projection.CsvExportSink;
import gr.imsi.athenarc.uroflow.projection.LoggingChartSink;

/**
 * Command-line front end: charts a patient's flow history from a JSON export of the
 * sample store and writes the CSV export.
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    @Parameter(names = "-history", description = "Path of the JSON export holding history/{patient}/{yyyy}/{MM}/{dd}", required = true)
    private String history;

    @Parameter(names = "-patient", description = "Patient identifier", required = true)
    private String patient;

    @Parameter(names = "-preset", description = "Range preset (today, yesterday, last7, custom)")
    private String preset;

    @Parameter(names = "-start", converter = LocalDateConverter.class, description = "Custom range start (yyyy-MM-dd)")
    private LocalDate start;

    @Parameter(names = "-end", converter = LocalDateConverter.class, description = "Custom range end (yyyy-MM-dd)")
    private LocalDate end;

    @Parameter(names = "-mode", description = "Aggregation mode (raw, 15min, hourly, daily)")
    private String mode;

    @Parameter(names = "-smooth", description = "Apply a centered moving average")
    private Boolean smooth;

    @Parameter(names = "-window", description = "Moving average window size")
    private Integer window;

    @Parameter(names = "-zone", description = "Zone used for day partitions and labels")
    private String zone;

    @Parameter(names = "-out", description = "The output folder of the CSV export")
    private String outFolder;

    @Parameter(names = "--help", help = true, description = "Displays help")
    private boolean help;

    public static void main(String... args) {
        Main main = new Main();
        JCommander jCommander = new JCommander(main);
        try {
            jCommander.parse(args);
        } catch (ParameterException e) {
            LOG.error(e.getMessage());
            jCommander.usage();
            System.exit(2);
        }
        if (main.help) {
            jCommander.usage();
            return;
        }
        try {
            main.run();
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to chart flow history", e);
            System.exit(1);
        }
    }

    void run() throws IOException {
        FlowMonitorConfiguration config = configure(FlowMonitorConfiguration.load());
        Preconditions.checkArgument((start == null) == (end == null), "-start and -end must be given together");
        LOG.info("Running with {}", config);

        Stopwatch stopwatch = Stopwatch.createStarted();
        InMemoryPartitionDataSource dataSource = new InMemoryPartitionDataSource(history);
        new JsonHistoryLoader(config.getZoneId()).load(Paths.get(history), patient, dataSource);

        LoggingChartSink chartSink = new LoggingChartSink();
        try (FlowChartManager manager = FlowChartManager.builder(dataSource, patient)
                .withConfiguration(config)
                .withChartSink(chartSink)
                .build()) {
            if (start != null) {
                manager.setRange(start, end);
            }
            manager.start();
            LOG.info("Fetched points: {} - Aggregated points: {}",
                    manager.getRawSampleCount(), manager.getAggregatedPointCount());
            manager.export(new CsvExportSink(config.getExportDirectory()));
        }
        LOG.info("Done in {} ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));
    }

    private FlowMonitorConfiguration configure(FlowMonitorConfiguration loaded) {
        FlowMonitorConfiguration.Builder builder = FlowMonitorConfiguration.builder()
                .zoneId(zone != null ? ZoneId.of(zone) : loaded.getZoneId())
                .preset(preset != null ? RangePreset.fromName(preset) : loaded.getPreset())
                .mode(mode != null ? AggregationMode.fromName(mode) : loaded.getMode())
                .smoothingEnabled(smooth != null ? smooth : loaded.isSmoothingEnabled())
                .smoothingWindow(window != null ? window : loaded.getSmoothingWindow());
        Path exportDirectory = outFolder != null ? Paths.get(outFolder) : loaded.getExportDirectory();
        return builder.exportDirectory(exportDirectory).build();
    }
}
