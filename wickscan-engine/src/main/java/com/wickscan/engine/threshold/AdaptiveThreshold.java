package com.wickscan.engine.threshold;

import com.wickscan.core.indicators.Quantiles;
import com.wickscan.core.model.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Self-calibrating acceptance threshold.
 *
 * Re-estimated at the end of every scan from that scan's scores: an empirical quantile plus a pad
 * becomes the target, the target is blended into the old value and the move is clipped to
 * {@code maxJump}. Small samples only allow a downward exploration step when nothing was opened
 * and few vetoes fired. The value never leaves {@code [scoreMin, scoreMax]}.
 */
public class AdaptiveThreshold {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveThreshold.class);
    private static final double EPS = 1e-9;

    private final ThresholdSettings settings;
    private volatile ThresholdState state;

    public AdaptiveThreshold(ThresholdSettings settings) {
        this.settings = settings;
        this.state = ThresholdState.initial(clamp(settings.getBase()));
    }

    public ThresholdSettings getSettings() {
        return settings;
    }

    public ThresholdState getState() {
        return state;
    }

    public double value() {
        return state.value();
    }

    /**
     * Threshold a candidate of {@code side} must reach. Longs carry a fixed offset.
     */
    public double thresholdFor(Side side) {
        double value = state.value();
        return side == Side.LONG ? value + settings.getLongOffset() : value;
    }

    /**
     * Restore a persisted state, pulling an out-of-range value back into bounds.
     */
    public synchronized void restore(ThresholdState restored) {
        if (restored == null || !Double.isFinite(restored.value())) {
            return;
        }
        state = new ThresholdState(clamp(restored.value()), restored.lastUpdate(), restored.lastDelta());
        log.info("Threshold restored at {}", String.format("%.2f", state.value()));
    }

    /**
     * End-of-scan update.
     */
    public synchronized ThresholdState update(ScanSample sample, long nowMs) {
        double old = state.value();
        double[] scores = sample.finiteScores();
        int n = scores.length;

        double proposed;
        String mode;
        if (n < settings.getMinSample()) {
            if (sample.earlyStop()) {
                proposed = old + settings.getEarlyStopBump();
                mode = "early-stop";
            } else if (sample.opened() == 0 && sample.vetoes() <= settings.getExplorationMaxVetoes()) {
                proposed = old - settings.getExplorationStep();
                mode = "explore";
            } else {
                proposed = old;
                mode = "hold";
            }
        } else {
            double level = settings.quantileLevel(n);
            double q = Quantiles.quantile(scores, level);
            double target = q + settings.getPad();
            if (sample.earlyStop()) {
                target += settings.getEarlyStopBump();
            }
            target = clamp(target);
            double s = settings.getSmoothing();
            proposed = (1 - s) * old + s * target;
            mode = String.format("q%.0f=%.3f target=%.3f", level * 100, q, target);
        }

        double next = bound(old, proposed);
        double rounded = bound(old, Math.round(next * 100.0) / 100.0);

        ThresholdState updated = new ThresholdState(rounded, nowMs, rounded - old);
        state = updated;
        log.info("Threshold {} -> {} (n={}, opened={}, vetoes={}, {})",
            String.format("%.2f", old), String.format("%.2f", rounded), n, sample.opened(), sample.vetoes(), mode);
        return updated;
    }

    private double bound(double old, double proposed) {
        double maxJump = settings.getMaxJump();
        double delta = proposed - old;
        if (delta > maxJump) {
            delta = maxJump;
        } else if (delta < -maxJump) {
            delta = -maxJump;
        }
        return clamp(old + delta);
    }

    private double clamp(double value) {
        return Math.max(settings.getScoreMin(), Math.min(settings.getScoreMax(), value));
    }

    /**
     * Whether {@code value} respects the configured bounds (with rounding tolerance).
     */
    public boolean inBounds(double value) {
        return value >= settings.getScoreMin() - EPS && value <= settings.getScoreMax() + EPS;
    }
}
