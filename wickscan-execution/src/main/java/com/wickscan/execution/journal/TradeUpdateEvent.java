package com.wickscan.execution.journal;

import com.wickscan.execution.position.LifecycleUpdate;
import com.wickscan.execution.position.Position;

import java.time.Instant;
import java.util.Locale;

/**
 * Stop move, averaging step or breakout freeze on an open position.
 */
public class TradeUpdateEvent extends TradeEvent {

    private String action;
    private double price;
    private Double stopLoss;
    private Double takeProfit;
    private Double avgPrice;
    private Integer stepsFilled;
    private Double marginUsd;

    // For Jackson
    public TradeUpdateEvent() {}

    public TradeUpdateEvent(LifecycleUpdate update, Instant at) {
        super(at, update.position().getId(), update.position().getSymbol());
        Position p = update.position();
        this.action = update.type().name().toLowerCase(Locale.ROOT);
        this.price = update.price();
        this.stopLoss = TradeOpenEvent.finiteOrNull(p.getStopLoss());
        this.takeProfit = TradeOpenEvent.finiteOrNull(p.getTakeProfit());
        if (p.getDca() != null) {
            this.avgPrice = p.getDca().getAvgPrice();
            this.stepsFilled = p.getDca().getStepsFilled();
            this.marginUsd = p.getDca().cumulativeMargin();
        }
    }

    @Override
    public String getEventType() { return "update"; }

    @Override
    public String getEventKey() {
        if (stepsFilled != null && "dca_step".equals(action)) {
            return action + ":" + stepsFilled;
        }
        return action + ":" + price;
    }

    @Override
    public String getSummary() {
        return String.format("[%s] %s %s @ %s", action, getSignalId(), getSymbol(), price);
    }

    public String getAction() { return action; }
    public double getPrice() { return price; }
    public Double getStopLoss() { return stopLoss; }
    public Double getTakeProfit() { return takeProfit; }
    public Double getAvgPrice() { return avgPrice; }
    public Integer getStepsFilled() { return stepsFilled; }
    public Double getMarginUsd() { return marginUsd; }
}
