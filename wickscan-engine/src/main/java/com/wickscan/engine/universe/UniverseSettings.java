package com.wickscan.engine.universe;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class UniverseSettings {

    private String quoteAsset = "USDT";
    private double minQuoteVolume = 300_000;
    private double minPrice = 0.001;
    private List<String> excludedBases = List.of(
        "USDC", "FDUSD", "TUSD", "BUSD", "DAI", "USDP", "USDE", "PYUSD", "EURC", "USD1");
    private int marketsRefreshMinutes = 60;

    public String getQuoteAsset() { return quoteAsset; }
    public void setQuoteAsset(String quoteAsset) { this.quoteAsset = quoteAsset; }

    public double getMinQuoteVolume() { return minQuoteVolume; }
    public void setMinQuoteVolume(double v) { this.minQuoteVolume = v; }

    public double getMinPrice() { return minPrice; }
    public void setMinPrice(double minPrice) { this.minPrice = minPrice; }

    public List<String> getExcludedBases() { return excludedBases; }
    public void setExcludedBases(List<String> v) { this.excludedBases = v; }

    public int getMarketsRefreshMinutes() { return marketsRefreshMinutes; }
    public void setMarketsRefreshMinutes(int v) { this.marketsRefreshMinutes = v; }
}
