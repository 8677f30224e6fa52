package gr.imsi.athenarc.uroflow.datasource;

/**
 * Receives the reports of a single partition subscription.
 */
public interface PartitionListener {

    /**
     * Called once promptly after subscribing and then whenever the partition changes.
     *
     * @param replacement the complete current content of the partition
     */
    void onReplacement(SamplesReplacement replacement);

    /**
     * Called when the data source fails to serve the partition.
     *
     * @param error the failure
     */
    void onError(Throwable error);
}
