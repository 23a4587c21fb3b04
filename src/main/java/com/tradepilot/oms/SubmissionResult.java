package com.tradepilot.oms;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Result value of one submission attempt. The retry loop decides on these values
 * rather than on exceptions.
 */
@Getter
@ToString
@Builder
public class SubmissionResult {

    private final SubmissionStatus status;

    /** Set when ACKED. */
    private final String exchangeOrderId;

    /** Rejection reason or error description. Null when ACKED. */
    private final String detail;

    /** 1-based attempt that produced this result. */
    private final int attempt;

    public boolean isRetryable() {
        return status.isRetryable();
    }

    public static SubmissionResult acked(String exchangeOrderId, int attempt) {
        return SubmissionResult.builder()
                .status(SubmissionStatus.ACKED)
                .exchangeOrderId(exchangeOrderId)
                .attempt(attempt)
                .build();
    }

    public static SubmissionResult rejected(String reason, int attempt) {
        return SubmissionResult.builder()
                .status(SubmissionStatus.REJECTED)
                .detail(reason)
                .attempt(attempt)
                .build();
    }

    public static SubmissionResult timeout(int attempt) {
        return SubmissionResult.builder()
                .status(SubmissionStatus.TIMEOUT)
                .detail("No acknowledgement within timeout")
                .attempt(attempt)
                .build();
    }

    public static SubmissionResult transportError(String detail, int attempt) {
        return SubmissionResult.builder()
                .status(SubmissionStatus.TRANSPORT_ERROR)
                .detail(detail)
                .attempt(attempt)
                .build();
    }
}
