package com.wickscan.execution.position;

/**
 * Something the lifecycle did to a position during one evaluation.
 *
 * @param price exit price for CLOSED, new stop for STOP_MOVED, fill price for DCA_STEP,
 *              trigger price for FROZEN
 */
public record LifecycleUpdate(Position position, Type type, double price) {

    public enum Type {
        STOP_MOVED,
        DCA_STEP,
        FROZEN,
        CLOSED
    }

    public boolean isClose() {
        return type == Type.CLOSED;
    }
}
