package gr.imsi.athenarc.uroflow.subscription;

/** Lifecycle of one partition subscription **/
public enum SubscriptionState {
    CLOSED,   // no live subscription, or the last attempt to open one failed
    OPENING,  // requested from the data source, handle not yet returned
    OPEN,     // live and receiving replacements
    CLOSING,  // dropped from the desired set, cancellation in progress
}
