package com.wickscan.execution.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.wickscan.core.model.Timeframe;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SchedulerSettings {

    public enum Strategy {
        WICK_SPIKE,
        RANGE_DCA
    }

    private Strategy strategy = Strategy.WICK_SPIKE;
    private long loopIntervalMs = 1000;
    private int scanIntervalSeconds = 30;
    private int monitorIntervalSeconds = 5;
    private int scanBudgetSeconds = 45;
    private int chunkSize = 40;
    private int maxOpensPerScan = 3;
    private int housekeepingMinutes = 5;
    private int heartbeatMinutes = 10;
    private int errorBackoffSeconds = 5;
    private int stopTimeoutSeconds = 30;
    private Timeframe entryTimeframe = Timeframe.M1;
    private int entryBars = 100;

    public Strategy getStrategy() { return strategy; }
    public void setStrategy(Strategy strategy) { this.strategy = strategy; }

    public long getLoopIntervalMs() { return loopIntervalMs; }
    public void setLoopIntervalMs(long loopIntervalMs) { this.loopIntervalMs = loopIntervalMs; }

    public int getScanIntervalSeconds() { return scanIntervalSeconds; }
    public void setScanIntervalSeconds(int v) { this.scanIntervalSeconds = v; }

    public int getMonitorIntervalSeconds() { return monitorIntervalSeconds; }
    public void setMonitorIntervalSeconds(int v) { this.monitorIntervalSeconds = v; }

    public int getScanBudgetSeconds() { return scanBudgetSeconds; }
    public void setScanBudgetSeconds(int v) { this.scanBudgetSeconds = v; }

    public int getChunkSize() { return chunkSize; }
    public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }

    public int getMaxOpensPerScan() { return maxOpensPerScan; }
    public void setMaxOpensPerScan(int v) { this.maxOpensPerScan = v; }

    public int getHousekeepingMinutes() { return housekeepingMinutes; }
    public void setHousekeepingMinutes(int v) { this.housekeepingMinutes = v; }

    public int getHeartbeatMinutes() { return heartbeatMinutes; }
    public void setHeartbeatMinutes(int v) { this.heartbeatMinutes = v; }

    public int getErrorBackoffSeconds() { return errorBackoffSeconds; }
    public void setErrorBackoffSeconds(int v) { this.errorBackoffSeconds = v; }

    public int getStopTimeoutSeconds() { return stopTimeoutSeconds; }
    public void setStopTimeoutSeconds(int v) { this.stopTimeoutSeconds = v; }

    public Timeframe getEntryTimeframe() { return entryTimeframe; }
    public void setEntryTimeframe(Timeframe entryTimeframe) { this.entryTimeframe = entryTimeframe; }

    public int getEntryBars() { return entryBars; }
    public void setEntryBars(int entryBars) { this.entryBars = entryBars; }
}
