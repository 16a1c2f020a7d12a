package com.wickscan.engine.gate;

/**
 * Why a symbol did not pass the gate.
 */
public enum GateRejection {
    COOLDOWN,
    POSITION_LIMIT,
    INSUFFICIENT_HISTORY,
    /** Last bar still forming and not enough closed history, or the closed bar is too old. */
    STALE_BAR,
    PRICE_FLOOR,
    NON_FINITE,
    MICRO_BODY,
    NO_WICK,
    RANGE_FAILED,
    NOT_ENOUGH_TESTS
}
