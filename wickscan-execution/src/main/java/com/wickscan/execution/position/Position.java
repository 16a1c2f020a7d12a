package com.wickscan.execution.position;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.wickscan.core.model.Side;
import com.wickscan.core.model.Timeframe;

import java.time.Duration;
import java.time.Instant;

/**
 * A virtual leveraged position tracked by the engine.
 *
 * Readable everywhere; written only by the lifecycle classes of this package. Fixed-bracket positions
 * carry entry/stop/target; averaging positions additionally carry a {@link DcaState}.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class Position {

    private String id;
    private String symbol;
    private Side side;
    private PositionStatus status = PositionStatus.ACTIVE;
    private Timeframe timeframe;

    private double entryPrice;
    private double stopLoss = Double.NaN;
    private double takeProfit = Double.NaN;
    private Instant openedAt;
    private long entryBarTimestamp;
    private long lastEvaluatedBarTs;

    private double mfePrice;
    private double maePrice;
    private boolean trailArmed;

    private int leverage;
    private double notionalUsd;
    private double score = Double.NaN;
    private double threshold = Double.NaN;

    private ExitReason exitReason;
    private double exitPrice = Double.NaN;
    private Instant closedAt;
    private double realizedPnlUsd;
    private double realizedPnlPct;

    private DcaState dca;

    private Position() {
    }

    private Position(String id, String symbol, Side side, Timeframe timeframe, double entryPrice,
                     Instant openedAt, long entryBarTimestamp, int leverage, double notionalUsd) {
        this.id = id;
        this.symbol = symbol;
        this.side = side;
        this.timeframe = timeframe;
        this.entryPrice = entryPrice;
        this.openedAt = openedAt;
        this.entryBarTimestamp = entryBarTimestamp;
        this.lastEvaluatedBarTs = entryBarTimestamp;
        this.mfePrice = entryPrice;
        this.maePrice = entryPrice;
        this.leverage = leverage;
        this.notionalUsd = notionalUsd;
    }

    /**
     * Fixed-bracket position.
     *
     * @param notionalUsd margin in USDT; P&L is price move times leverage times this amount
     */
    public static Position bracket(String id, String symbol, Side side, Timeframe timeframe,
                                   double entry, double stopLoss, double takeProfit,
                                   Instant openedAt, long entryBarTimestamp,
                                   int leverage, double notionalUsd, double score, double threshold) {
        Position p = new Position(id, symbol, side, timeframe, entry, openedAt, entryBarTimestamp,
            leverage, notionalUsd);
        p.stopLoss = stopLoss;
        p.takeProfit = takeProfit;
        p.score = score;
        p.threshold = threshold;
        return p;
    }

    /**
     * Averaging position. The first step is filled at {@code entry}.
     */
    public static Position averaging(String id, String symbol, Side side, Timeframe timeframe,
                                     double entry, Instant openedAt, long entryBarTimestamp,
                                     int leverage, DcaState dca, double score) {
        Position p = new Position(id, symbol, side, timeframe, entry, openedAt, entryBarTimestamp,
            leverage, 0);
        p.dca = dca;
        p.score = score;
        dca.fill(entry, dca.nextStepMargin(), leverage, openedAt.toEpochMilli(), false);
        p.notionalUsd = dca.cumulativeMargin();
        p.takeProfit = dca.takeProfitPrice(side);
        return p;
    }

    // ========== Read access ==========

    public String getId() { return id; }
    public String getSymbol() { return symbol; }
    public Side getSide() { return side; }
    public PositionStatus getStatus() { return status; }
    public Timeframe getTimeframe() { return timeframe; }
    public double getEntryPrice() { return entryPrice; }
    public double getStopLoss() { return stopLoss; }
    public double getTakeProfit() { return takeProfit; }
    public Instant getOpenedAt() { return openedAt; }
    public long getEntryBarTimestamp() { return entryBarTimestamp; }
    public long getLastEvaluatedBarTs() { return lastEvaluatedBarTs; }
    public double getMfePrice() { return mfePrice; }
    public double getMaePrice() { return maePrice; }
    public boolean isTrailArmed() { return trailArmed; }
    public int getLeverage() { return leverage; }
    public double getNotionalUsd() { return notionalUsd; }
    public double getScore() { return score; }
    public double getThreshold() { return threshold; }
    public ExitReason getExitReason() { return exitReason; }
    public double getExitPrice() { return exitPrice; }
    public Instant getClosedAt() { return closedAt; }
    public double getRealizedPnlUsd() { return realizedPnlUsd; }
    public double getRealizedPnlPct() { return realizedPnlPct; }
    public DcaState getDca() { return dca; }

    @JsonIgnore
    public boolean isActive() {
        return status == PositionStatus.ACTIVE;
    }

    @JsonIgnore
    public boolean isAveraging() {
        return dca != null;
    }

    /**
     * Price the P&L is measured from: the VWAP for averaging positions, the entry otherwise.
     */
    @JsonIgnore
    public double basePrice() {
        return dca != null ? dca.getAvgPrice() : entryPrice;
    }

    /**
     * Signed percent move from {@link #basePrice()} to {@code price}, positive when favorable.
     */
    public double movePct(double price) {
        double base = basePrice();
        return side.sign() * (price - base) / base * 100.0;
    }

    @JsonIgnore
    public double mfePct() {
        return movePct(mfePrice);
    }

    @JsonIgnore
    public double maePct() {
        return movePct(maePrice);
    }

    public Duration holdingTime(Instant now) {
        Instant end = closedAt != null ? closedAt : now;
        return Duration.between(openedAt, end);
    }

    // ========== Mutation (lifecycle only) ==========

    void trackExcursion(double high, double low) {
        if (side == Side.LONG) {
            mfePrice = Math.max(mfePrice, high);
            maePrice = Math.min(maePrice, low);
        } else {
            mfePrice = Math.min(mfePrice, low);
            maePrice = Math.max(maePrice, high);
        }
    }

    void setLastEvaluatedBarTs(long ts) {
        this.lastEvaluatedBarTs = ts;
    }

    void moveStop(double stopLoss) {
        this.stopLoss = stopLoss;
    }

    void armTrail(double stopLoss) {
        this.stopLoss = stopLoss;
        this.trailArmed = true;
    }

    void refreshAveraging() {
        notionalUsd = dca.cumulativeMargin();
        takeProfit = dca.takeProfitPrice(side);
    }

    /**
     * Close at {@code price}. Returns false (and changes nothing) when already closed.
     */
    boolean close(ExitReason reason, double price, Instant at) {
        if (status == PositionStatus.CLOSED) {
            return false;
        }
        double move = movePct(price);
        status = PositionStatus.CLOSED;
        exitReason = reason;
        exitPrice = price;
        closedAt = at;
        realizedPnlPct = move * leverage;
        realizedPnlUsd = notionalUsd * realizedPnlPct / 100.0;
        return true;
    }

    @Override
    public String toString() {
        return String.format("%s %s %s @ %.8g [%s]", id, side, symbol, basePrice(), status);
    }
}
