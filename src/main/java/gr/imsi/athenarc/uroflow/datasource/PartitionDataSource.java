package gr.imsi.athenarc.uroflow.datasource;

import gr.imsi.athenarc.uroflow.domain.PartitionKey;

/**
 * Represents a store of sample history partitioned by calendar day, where each day is a
 * single node whose whole content is reported on every change.
 */
public interface PartitionDataSource {

    /**
     * Opens a live subscription on one day partition. The listener receives the current
     * content promptly (an empty replacement if the partition holds no data) and a full
     * replacement on every later change, until the returned subscription is cancelled.
     * Reports for the same key are delivered in order; reports for different keys may
     * arrive concurrently.
     *
     * @param key the partition to watch
     * @param listener receiver of replacements and errors
     * @return the cancellable subscription
     */
    Subscription subscribe(PartitionKey key, PartitionListener listener);

    /**
     * @return a human-readable description of the source
     */
    String getDescription();
}
