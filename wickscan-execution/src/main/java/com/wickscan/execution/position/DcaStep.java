package com.wickscan.execution.position;

/**
 * One filled averaging step.
 *
 * @param index zero-based step number
 * @param retest true when this fill was the reserved re-entry after a breakout
 */
public record DcaStep(int index, double price, double margin, double quantity, long filledAt, boolean retest) {
}
