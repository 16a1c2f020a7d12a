package com.wickscan.execution.journal;

import com.wickscan.execution.position.ExitReason;
import com.wickscan.execution.position.Position;

/**
 * A position was closed.
 */
public class TradeCloseEvent extends TradeEvent {

    private ExitReason exitReason;
    private double exitPrice;
    private double pnlUsd;
    private double pnlPct;
    private double mfePct;
    private double maePct;
    private long holdingSeconds;

    // For Jackson
    public TradeCloseEvent() {}

    public TradeCloseEvent(Position position) {
        super(position.getClosedAt(), position.getId(), position.getSymbol());
        this.exitReason = position.getExitReason();
        this.exitPrice = position.getExitPrice();
        this.pnlUsd = position.getRealizedPnlUsd();
        this.pnlPct = position.getRealizedPnlPct();
        this.mfePct = position.mfePct();
        this.maePct = position.maePct();
        this.holdingSeconds = position.holdingTime(position.getClosedAt()).getSeconds();
    }

    @Override
    public String getEventType() { return "close"; }

    @Override
    public String getEventKey() { return "close"; }

    @Override
    public String getSummary() {
        return String.format("[close] %s %s %s PnL=%.2f", getSignalId(), getSymbol(), exitReason, pnlUsd);
    }

    public ExitReason getExitReason() { return exitReason; }
    public double getExitPrice() { return exitPrice; }
    public double getPnlUsd() { return pnlUsd; }
    public double getPnlPct() { return pnlPct; }
    public double getMfePct() { return mfePct; }
    public double getMaePct() { return maePct; }
    public long getHoldingSeconds() { return holdingSeconds; }
}
