package gr.imsi.athenarc.uroflow.projection;

/**
 * Consumer of the chart projection, called whenever it changes.
 */
public interface ChartSink {

    void accept(ChartData chartData);
}
