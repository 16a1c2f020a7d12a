package com.wickscan.execution.position;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.wickscan.core.model.Side;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Averaging state of a range-DCA position. Mutated only through the lifecycle classes of this package.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class DcaState {

    private List<Double> stepMargins = new ArrayList<>();
    private double growth;
    private List<Double> ladder = new ArrayList<>();
    private List<DcaStep> steps = new ArrayList<>();
    private double quantity;
    private double avgPrice;
    private double tpPct;
    private int trailStage;
    private boolean frozen;
    private boolean reservedFinalStep;
    private boolean retestFilled;
    private double breakoutExtreme = Double.NaN;
    private double liquidationPrice = Double.NaN;

    private DcaState() {
    }

    public DcaState(List<Double> stepMargins, double growth, List<Double> ladder, double tpPct) {
        this.stepMargins = new ArrayList<>(stepMargins);
        this.growth = growth;
        this.ladder = new ArrayList<>(ladder);
        this.tpPct = tpPct;
    }

    // ========== Read access ==========

    public List<Double> getStepMargins() {
        return Collections.unmodifiableList(stepMargins);
    }

    public double getGrowth() {
        return growth;
    }

    /**
     * Prices of steps 2..N, ordered toward the averaging direction.
     */
    public List<Double> getLadder() {
        return Collections.unmodifiableList(ladder);
    }

    public List<DcaStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public int getLevels() {
        return stepMargins.size();
    }

    public int getStepsFilled() {
        return steps.size();
    }

    public double getQuantity() {
        return quantity;
    }

    public double getAvgPrice() {
        return avgPrice;
    }

    public double getTpPct() {
        return tpPct;
    }

    public int getTrailStage() {
        return trailStage;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public boolean isReservedFinalStep() {
        return reservedFinalStep;
    }

    public boolean isRetestFilled() {
        return retestFilled;
    }

    public double getBreakoutExtreme() {
        return breakoutExtreme;
    }

    public double getLiquidationPrice() {
        return liquidationPrice;
    }

    /**
     * Margin committed by the filled steps.
     */
    @JsonIgnore
    public double cumulativeMargin() {
        return steps.stream().mapToDouble(DcaStep::margin).sum();
    }

    @JsonIgnore
    public int remainingSteps() {
        return Math.max(0, stepMargins.size() - steps.size());
    }

    /**
     * Price of the next ladder step, or NaN when frozen or fully filled.
     */
    @JsonIgnore
    public double nextLadderPrice() {
        int next = steps.size();
        if (frozen || next == 0 || next >= stepMargins.size() || next - 1 >= ladder.size()) {
            return Double.NaN;
        }
        return ladder.get(next - 1);
    }

    @JsonIgnore
    public double takeProfitPrice(Side side) {
        return avgPrice * (1 + side.sign() * tpPct / 100.0);
    }

    // ========== Mutation (lifecycle only) ==========

    DcaStep fill(double price, double margin, int leverage, long now, boolean retest) {
        double qty = margin * leverage / price;
        double newQty = quantity + qty;
        avgPrice = quantity > 0 ? (avgPrice * quantity + price * qty) / newQty : price;
        quantity = newQty;
        DcaStep step = new DcaStep(steps.size(), price, margin, qty, now, retest);
        steps.add(step);
        return step;
    }

    /**
     * Margin of the next ladder step.
     */
    double nextStepMargin() {
        return stepMargins.get(steps.size());
    }

    double finalStepMargin() {
        return stepMargins.get(stepMargins.size() - 1);
    }

    void freeze(boolean reserveFinalStep, double extreme) {
        frozen = true;
        reservedFinalStep = reserveFinalStep;
        breakoutExtreme = extreme;
    }

    void trackBreakoutExtreme(Side side, double price) {
        if (Double.isNaN(breakoutExtreme)
            || (side == Side.LONG ? price < breakoutExtreme : price > breakoutExtreme)) {
            breakoutExtreme = price;
        }
    }

    void consumeReservedStep() {
        reservedFinalStep = false;
        retestFilled = true;
    }

    void setTrailStage(int trailStage) {
        this.trailStage = trailStage;
    }

    void setLiquidationPrice(double liquidationPrice) {
        this.liquidationPrice = liquidationPrice;
    }
}
