package gr.imsi.athenarc.uroflow.subscription;

/**
 * Receives the warnings raised when a partition subscription fails.
 */
public interface SubscriptionWarningListener {

    void onSubscriptionError(SubscriptionException error);
}
