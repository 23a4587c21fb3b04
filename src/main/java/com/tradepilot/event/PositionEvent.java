package com.tradepilot.event;

import com.tradepilot.domain.model.Position;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the {@link com.tradepilot.risk.PositionRiskTracker} after a fill
 * changed a position. Carries the snapshots before and after the fill.
 */
public class PositionEvent extends ApplicationEvent {

    private final Position previous;
    private final Position position;
    private final PositionEventType eventType;

    public PositionEvent(Object source, Position previous, Position position, PositionEventType eventType) {
        super(source);
        this.previous = previous;
        this.position = position;
        this.eventType = eventType;
    }

    public Position getPrevious() {
        return previous;
    }

    public Position getPosition() {
        return position;
    }

    public PositionEventType getEventType() {
        return eventType;
    }
}
