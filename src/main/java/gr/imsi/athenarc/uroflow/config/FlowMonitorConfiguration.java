package gr.imsi.athenarc.uroflow.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneId;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.uroflow.aggregation.SmoothingSettings;
import gr.imsi.athenarc.uroflow.domain.AggregationMode;
import gr.imsi.athenarc.uroflow.domain.RangePreset;

/**
 * Settings of the flow chart: the zone days are partitioned in, the initial controls and
 * where exports go.
 */
public class FlowMonitorConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(FlowMonitorConfiguration.class);

    public static final String PROPERTIES_RESOURCE = "/application.properties";

    public static final String ZONE = "uroflow.zone";
    public static final String PRESET = "uroflow.preset";
    public static final String MODE = "uroflow.mode";
    public static final String SMOOTHING_ENABLED = "uroflow.smoothing.enabled";
    public static final String SMOOTHING_WINDOW = "uroflow.smoothing.window";
    public static final String EXPORT_DIR = "uroflow.export.dir";

    private ZoneId zoneId;
    private RangePreset preset;
    private AggregationMode mode;
    private boolean smoothingEnabled;
    private int smoothingWindow;
    private Path exportDirectory;

    private FlowMonitorConfiguration() {}

    public static Builder builder() {
        return new Builder();
    }

    public static FlowMonitorConfiguration defaults() {
        return builder().build();
    }

    /**
     * Reads the configuration from {@code application.properties} on the classpath, falling
     * back to the defaults when the resource is missing.
     *
     * @throws IOException if the resource exists but cannot be read
     */
    public static FlowMonitorConfiguration load() throws IOException {
        Properties properties = new Properties();
        try (InputStream input = FlowMonitorConfiguration.class.getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (input == null) {
                LOG.warn("Unable to find {} in resources, using defaults", PROPERTIES_RESOURCE);
                return defaults();
            }
            properties.load(input);
        }
        return fromProperties(properties);
    }

    /**
     * Builds a configuration from properties. Missing or blank keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be interpreted
     */
    public static FlowMonitorConfiguration fromProperties(Properties properties) {
        Builder builder = builder();
        String zone = trimmed(properties, ZONE);
        if (zone != null) {
            builder.zoneId(ZoneId.of(zone));
        }
        String preset = trimmed(properties, PRESET);
        if (preset != null) {
            builder.preset(RangePreset.fromName(preset));
        }
        String mode = trimmed(properties, MODE);
        if (mode != null) {
            builder.mode(AggregationMode.fromName(mode));
        }
        String smoothing = trimmed(properties, SMOOTHING_ENABLED);
        if (smoothing != null) {
            builder.smoothingEnabled(Boolean.parseBoolean(smoothing));
        }
        String window = trimmed(properties, SMOOTHING_WINDOW);
        if (window != null) {
            builder.smoothingWindow(Integer.parseInt(window));
        }
        String exportDir = trimmed(properties, EXPORT_DIR);
        if (exportDir != null) {
            builder.exportDirectory(Paths.get(exportDir));
        }
        return builder.build();
    }

    private static String trimmed(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    public static class Builder {
        private ZoneId zoneId = ZoneId.systemDefault();
        private RangePreset preset = RangePreset.TODAY;
        private AggregationMode mode = AggregationMode.HOURLY;
        private boolean smoothingEnabled = false;
        private int smoothingWindow = SmoothingSettings.DEFAULT_WINDOW;
        private Path exportDirectory = Paths.get("output");

        public Builder zoneId(ZoneId zoneId) {
            this.zoneId = zoneId;
            return this;
        }

        public Builder preset(RangePreset preset) {
            this.preset = preset;
            return this;
        }

        public Builder mode(AggregationMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder smoothingEnabled(boolean smoothingEnabled) {
            this.smoothingEnabled = smoothingEnabled;
            return this;
        }

        public Builder smoothingWindow(int smoothingWindow) {
            this.smoothingWindow = smoothingWindow;
            return this;
        }

        public Builder exportDirectory(Path exportDirectory) {
            this.exportDirectory = exportDirectory;
            return this;
        }

        public FlowMonitorConfiguration build() {
            FlowMonitorConfiguration config = new FlowMonitorConfiguration();
            config.zoneId = this.zoneId;
            config.preset = this.preset;
            config.mode = this.mode;
            config.smoothingEnabled = this.smoothingEnabled;
            config.smoothingWindow = this.smoothingWindow;
            config.exportDirectory = this.exportDirectory;
            return config;
        }
    }

    public ZoneId getZoneId() { return zoneId; }
    public RangePreset getPreset() { return preset; }
    public AggregationMode getMode() { return mode; }
    public boolean isSmoothingEnabled() { return smoothingEnabled; }
    public int getSmoothingWindow() { return smoothingWindow; }
    public Path getExportDirectory() { return exportDirectory; }

    public SmoothingSettings getSmoothing() {
        return SmoothingSettings.of(smoothingEnabled, smoothingWindow);
    }

    @Override
    public String toString() {
        return "FlowMonitorConfiguration{" +
                "zoneId=" + zoneId +
                ", preset=" + preset +
                ", mode=" + mode +
                ", smoothingEnabled=" + smoothingEnabled +
                ", smoothingWindow=" + smoothingWindow +
                ", exportDirectory=" + exportDirectory +
                '}';
    }
}
