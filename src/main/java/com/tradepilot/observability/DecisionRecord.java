package com.tradepilot.observability;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** One entry of the operator-facing decision log. */
@Getter
@ToString
@Builder
public class DecisionRecord {

    private final Instant timestamp;

    /** SIGNAL, ORDER, RISK, ENGINE. */
    private final String category;

    /** Null for engine-wide decisions. */
    private final String instrumentId;

    private final String message;
    private final Map<String, Object> context;
}
