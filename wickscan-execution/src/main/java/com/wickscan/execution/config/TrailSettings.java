package com.wickscan.execution.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One-shot break-even trail of fixed-bracket positions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrailSettings {

    private boolean enabled = true;
    private double triggerPct = 0.20;
    private double lockPct = 0.05;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public double getTriggerPct() { return triggerPct; }
    public void setTriggerPct(double triggerPct) { this.triggerPct = triggerPct; }

    public double getLockPct() { return lockPct; }
    public void setLockPct(double lockPct) { this.lockPct = lockPct; }
}
