package com.tradepilot.oms;

/** Outcome of a single exchange submission attempt. */
public enum SubmissionStatus {
    ACKED,
    REJECTED,

    /** No acknowledgement within the ack timeout. Retryable. */
    TIMEOUT,

    /** The gateway failed before the exchange answered. Retryable. */
    TRANSPORT_ERROR;

    public boolean isRetryable() {
        return this == TIMEOUT || this == TRANSPORT_ERROR;
    }
}
