package com.tradepilot.event;

/** How a fill changed a position. */
public enum PositionEventType {
    OPENED,
    INCREASED,
    REDUCED,
    CLOSED,

    /** A fill larger than the open size closed it and opened the opposite side. */
    FLIPPED
}
