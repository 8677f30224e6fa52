package gr.imsi.athenarc.uroflow.projection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every chart update to the log.
 */
public class LoggingChartSink implements ChartSink {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingChartSink.class);

    private ChartData last = ChartData.EMPTY;

    @Override
    public synchronized void accept(ChartData chartData) {
        last = chartData;
        LOG.info("Chart updated with {} points", chartData.size());
        for (int i = 0; i < chartData.size(); i++) {
            LOG.info("  {} -> {} ml/min", chartData.getLabels().get(i), String.format("%.2f", chartData.getValues().get(i)));
        }
    }

    public synchronized ChartData getLast() {
        return last;
    }
}
