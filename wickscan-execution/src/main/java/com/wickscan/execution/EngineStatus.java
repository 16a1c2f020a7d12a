package com.wickscan.execution;

import com.wickscan.execution.open.OpenStatus;

import java.util.List;
import java.util.Map;

/**
 * Answer to the status query.
 *
 * @param thresholdShort current acceptance threshold
 * @param thresholdLong threshold including the long-side offset
 */
public record EngineStatus(
    boolean running,
    boolean enabled,
    String strategy,
    int activePositions,
    int maxPositions,
    int reserved,
    double thresholdShort,
    double thresholdLong,
    Map<String, Object> parameters,
    Map<OpenStatus, Long> openOutcomes,
    List<PositionView> positions,
    String lastScan
) {

    /**
     * One open position as reported to the operator.
     */
    public record PositionView(
        String id,
        String symbol,
        String side,
        double entryPrice,
        double avgPrice,
        double stopLoss,
        double takeProfit,
        double marginUsd,
        Integer stepsFilled,
        Double liquidationPrice,
        String openedAt
    ) {}
}
