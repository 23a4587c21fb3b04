package com.tradepilot.event;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the engine makes a notable decision, for the audit trail.
 *
 * <p>Examples:
 * <ul>
 *   <li>"ENTER_LONG from rule trend-rsi-long at seq=42 suppressed: state=LONG"</li>
 *   <li>"Order submitted: BUY 0.001 BTC-USDT key=3f9a..."</li>
 *   <li>"Cycle skipped: insufficient history required=35 available=12"</li>
 * </ul>
 */
public class DecisionEvent extends ApplicationEvent {

    private final String category;
    private final String message;
    private final String instrumentId;
    private final Map<String, Object> context;
    private final Instant occurredAt;

    /**
     * @param source       the component that made the decision
     * @param category     classification ("SIGNAL", "ORDER", "RISK", "CYCLE", "SYSTEM")
     * @param message      human-readable description
     * @param instrumentId the related instrument, or null for system-wide decisions
     * @param context      additional structured data
     */
    public DecisionEvent(
            Object source, String category, String message, String instrumentId, Map<String, Object> context) {
        super(source);
        this.category = category;
        this.message = message;
        this.instrumentId = instrumentId;
        this.context = context != null ? new HashMap<>(context) : new HashMap<>();
        this.occurredAt = Instant.now();
    }

    public String getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }

    public String getInstrumentId() {
        return instrumentId;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
