package gr.imsi.athenarc.uroflow.store;

/**
 * Notified after the flattened series of a {@link SeriesStore} changed.
 */
public interface SeriesChangeListener {

    void onSeriesChanged();
}
