package gr.imsi.athenarc.uroflow.subscription;

import gr.imsi.athenarc.uroflow.domain.PartitionKey;

/**
 * Failure of the data source for a single partition. Never fatal: the partition keeps
 * its last snapshot and the other partitions are unaffected.
 */
public class SubscriptionException extends RuntimeException {

    private final PartitionKey key;

    public SubscriptionException(PartitionKey key, Throwable cause) {
        super("Subscription to partition " + key + " failed: " + cause.getMessage(), cause);
        this.key = key;
    }

    public PartitionKey getKey() {
        return key;
    }
}
