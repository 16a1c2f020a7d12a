package com.wickscan.execution.dca;

import com.wickscan.core.model.Side;
import com.wickscan.execution.config.DcaSettings;

import java.util.List;
import java.util.Optional;

/**
 * Three-stage trailing stop for averaging positions.
 *
 * Progress is the covered fraction of the distance from the average price to the target. Once a
 * stage's {@code arm} is reached, the stop candidate is the more protective of the stage lock
 * ({@code avg + lock * (tp - avg)}) and a chandelier stop {@code price ∓ k·ATR}. The stop only
 * moves in the favorable direction and only by at least {@code minTrailTicks} ticks.
 */
public class TrailingStopRatchet {

    public record Move(int stage, double stop) {}

    private final DcaSettings settings;

    public TrailingStopRatchet(DcaSettings settings) {
        this.settings = settings;
    }

    /**
     * @param stage current stage, 0 when not armed
     * @param currentStop current stop, NaN when none
     * @return the new stage and stop, or empty when nothing changes
     */
    public Optional<Move> next(Side side, double avg, double target, double price, int stage,
                               double currentStop, double atr, double tickSize) {
        double distance = target - avg;
        if (distance == 0 || !Double.isFinite(distance)) {
            return Optional.empty();
        }
        double progress = (price - avg) / distance;

        List<DcaSettings.TrailStage> stages = settings.getTrailStages();
        int armed = 0;
        for (int i = 0; i < stages.size(); i++) {
            if (progress >= stages.get(i).getArm()) {
                armed = i + 1;
            }
        }
        int newStage = Math.max(stage, armed);
        if (newStage == 0) {
            return Optional.empty();
        }

        double lock = avg + stages.get(newStage - 1).getLock() * distance;
        double candidate = lock;
        if (Double.isFinite(atr) && atr > 0) {
            double chandelier = price - side.sign() * settings.getChandelierAtrMult() * atr;
            candidate = side == Side.LONG ? Math.max(lock, chandelier) : Math.min(lock, chandelier);
        }

        double minStep = Math.max(0, settings.getMinTrailTicks() * tickSize);
        boolean improves = Double.isNaN(currentStop)
            || side.sign() * (candidate - currentStop) >= Math.max(minStep, 1e-12);
        if (improves) {
            return Optional.of(new Move(newStage, candidate));
        }
        if (newStage > stage) {
            return Optional.of(new Move(newStage, currentStop));
        }
        return Optional.empty();
    }

    public static boolean isHit(Side side, double price, double stop) {
        return Double.isFinite(stop) && (side == Side.LONG ? price <= stop : price >= stop);
    }
}
