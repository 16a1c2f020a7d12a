package com.wickscan.execution.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ControlSettings {

    private boolean enabled = true;
    private String host = "localhost";
    private int port = 7862;
    private boolean startEnabled = true;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }

    /**
     * Initial enabled flag when no persisted state exists.
     */
    public boolean isStartEnabled() { return startEnabled; }
    public void setStartEnabled(boolean startEnabled) { this.startEnabled = startEnabled; }
}
