package com.wickscan.execution.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.nio.file.Path;

@JsonIgnoreProperties(ignoreUnknown = true)
public class StorageSettings {

    private String dataDir = Path.of(System.getProperty("user.home"), ".wickscan").toString();
    private String stateFile = "state.json";
    private String tradeLogDir = "trades";

    public String getDataDir() { return dataDir; }
    public void setDataDir(String dataDir) { this.dataDir = dataDir; }

    public String getStateFile() { return stateFile; }
    public void setStateFile(String stateFile) { this.stateFile = stateFile; }

    public String getTradeLogDir() { return tradeLogDir; }
    public void setTradeLogDir(String tradeLogDir) { this.tradeLogDir = tradeLogDir; }

    public Path statePath() {
        return Path.of(dataDir).resolve(stateFile);
    }

    public Path tradeLogPath() {
        return Path.of(dataDir).resolve(tradeLogDir);
    }
}
