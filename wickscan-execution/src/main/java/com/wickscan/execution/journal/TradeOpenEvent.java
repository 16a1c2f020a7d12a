package com.wickscan.execution.journal;

import com.wickscan.core.model.Side;
import com.wickscan.execution.position.Position;

/**
 * A position was opened.
 */
public class TradeOpenEvent extends TradeEvent {

    private String strategy;
    private Side side;
    private String timeframe;
    private double entryPrice;
    private Double stopLoss;
    private Double takeProfit;
    private int leverage;
    private double marginUsd;
    private Double score;
    private Double threshold;

    // For Jackson
    public TradeOpenEvent() {}

    public TradeOpenEvent(String strategy, Position position) {
        super(position.getOpenedAt(), position.getId(), position.getSymbol());
        this.strategy = strategy;
        this.side = position.getSide();
        this.timeframe = position.getTimeframe() != null ? position.getTimeframe().code() : null;
        this.entryPrice = position.getEntryPrice();
        this.stopLoss = finiteOrNull(position.getStopLoss());
        this.takeProfit = finiteOrNull(position.getTakeProfit());
        this.leverage = position.getLeverage();
        this.marginUsd = position.getNotionalUsd();
        this.score = finiteOrNull(position.getScore());
        this.threshold = finiteOrNull(position.getThreshold());
    }

    static Double finiteOrNull(double v) {
        return Double.isFinite(v) ? v : null;
    }

    @Override
    public String getEventType() { return "open"; }

    @Override
    public String getEventKey() { return "open"; }

    @Override
    public String getSummary() {
        return String.format("[open] %s %s %s @ %s", getSignalId(), side, getSymbol(), entryPrice);
    }

    public String getStrategy() { return strategy; }
    public Side getSide() { return side; }
    public String getTimeframe() { return timeframe; }
    public double getEntryPrice() { return entryPrice; }
    public Double getStopLoss() { return stopLoss; }
    public Double getTakeProfit() { return takeProfit; }
    public int getLeverage() { return leverage; }
    public double getMarginUsd() { return marginUsd; }
    public Double getScore() { return score; }
    public Double getThreshold() { return threshold; }
}
