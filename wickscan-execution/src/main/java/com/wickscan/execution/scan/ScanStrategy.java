package com.wickscan.execution.scan;

import java.util.Map;

/**
 * A scanning strategy driven by the scheduler.
 */
public interface ScanStrategy {

    String name();

    /**
     * Validate the strategy against the exchange before the first scan.
     *
     * @throws com.wickscan.core.SymbolResolutionException when a configured symbol does not exist
     */
    default void start() {
    }

    /**
     * One scan cycle. Runs on the scan thread and may be interrupted by a stop.
     */
    ScanReport scan() throws InterruptedException;

    /**
     * Evaluate open positions. Runs on the scheduler thread, concurrently with a scan.
     */
    void monitor();

    /**
     * Parameters reported by the status query.
     */
    Map<String, Object> parameters();
}
