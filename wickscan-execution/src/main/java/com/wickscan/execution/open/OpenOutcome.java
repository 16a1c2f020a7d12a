package com.wickscan.execution.open;

import com.wickscan.execution.position.Position;

/**
 * Result of one open attempt.
 *
 * @param position the opened position, null unless {@code status == OPENED}
 */
public record OpenOutcome(String symbol, OpenStatus status, Position position, String detail) {

    public static OpenOutcome opened(Position position) {
        return new OpenOutcome(position.getSymbol(), OpenStatus.OPENED, position, null);
    }

    public static OpenOutcome rejected(String symbol, OpenStatus status, String detail) {
        return new OpenOutcome(symbol, status, null, detail);
    }

    public boolean isOpened() {
        return status == OpenStatus.OPENED;
    }
}
