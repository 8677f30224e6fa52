package gr.imsi.athenarc.uroflow.datasource;

import gr.imsi.athenarc.uroflow.domain.PartitionKey;

/**
 * Handle of a live partition subscription.
 */
public interface Subscription {

    PartitionKey getKey();

    /**
     * Stops delivery to the listener. Calling it more than once has no further effect.
     */
    void cancel();

    boolean isCancelled();
}
