package com.wickscan.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.wickscan.engine.fetch.FetchSettings;
import com.wickscan.engine.gate.GateSettings;
import com.wickscan.engine.score.ScoreSettings;
import com.wickscan.engine.threshold.ThresholdSettings;
import com.wickscan.engine.universe.UniverseSettings;

/**
 * Everything the scan pipeline needs: fetch, universe, gate, score and threshold parameters.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScanConfig {

    private FetchSettings fetch = new FetchSettings();
    private UniverseSettings universe = new UniverseSettings();
    private GateSettings gate = new GateSettings();
    private ScoreSettings score = new ScoreSettings();
    private ThresholdSettings threshold = new ThresholdSettings();

    public FetchSettings getFetch() { return fetch; }
    public void setFetch(FetchSettings fetch) { this.fetch = fetch; }

    public UniverseSettings getUniverse() { return universe; }
    public void setUniverse(UniverseSettings universe) { this.universe = universe; }

    public GateSettings getGate() { return gate; }
    public void setGate(GateSettings gate) { this.gate = gate; }

    public ScoreSettings getScore() { return score; }
    public void setScore(ScoreSettings score) { this.score = score; }

    public ThresholdSettings getThreshold() { return threshold; }
    public void setThreshold(ThresholdSettings threshold) { this.threshold = threshold; }
}
