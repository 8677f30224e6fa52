package gr.imsi.athenarc.uroflow.domain;

/**
 * Represents a single flow-rate measurement with a value and a timestamp.
 */
public interface Sample {
    /**
     * Returns the timestamp(epoch time in milliseconds) of this sample.
     */
    long getTimestamp();

    /**
     * Returns the measured flow rate (ml/min) at {@code timestamp}.
     */
    double getValue();
}
