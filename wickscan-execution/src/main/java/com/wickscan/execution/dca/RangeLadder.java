package com.wickscan.execution.dca;

import com.wickscan.core.model.Side;
import com.wickscan.execution.config.DcaSettings;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the averaging ladder: price levels for steps 2..N, ordered in the averaging direction
 * (falling for longs, rising for shorts).
 *
 * Levels sit between the entry and the strategic border the position averages toward, so they can
 * fill before a breakout freezes the ladder. Each configured fraction yields one candidate offset
 * from the strategic horizon (a fraction of the room left to that border) and one from the tactical
 * horizon (a fraction of the tactical width, capped at the border). Candidates are merged, sorted,
 * thinned so neighbours are at least {@code ladderMinGapPct} apart, then spread evenly over the
 * step count. If that leaves too few levels the ladder is extended with ATR multiples beyond the
 * deepest level.
 */
public class RangeLadder {

    private final DcaSettings settings;

    public RangeLadder(DcaSettings settings) {
        this.settings = settings;
    }

    public List<Double> build(Side side, double entry, PriceRange tactical, PriceRange strategic,
                              double atr, int steps) {
        List<Double> ladder = new ArrayList<>();
        if (steps <= 0) {
            return ladder;
        }
        if (strategic != null) {
            double border = side == Side.LONG ? strategic.lower() : strategic.upper();
            double room = side.sign() * (entry - border);
            if (room > 0) {
                ladder.addAll(inside(side, entry, border, room, tactical, steps));
            }
        }
        extend(side, entry, atr, steps, ladder);
        return ladder;
    }

    private List<Double> inside(Side side, double entry, double border, double room, PriceRange tactical,
                                int steps) {
        int sign = side.sign();
        List<Double> offsets = new ArrayList<>();
        for (double fraction : settings.getLadderFractions()) {
            offsets.add(Math.min(fraction * room, room));
            if (tactical != null && tactical.width() > 0) {
                offsets.add(Math.min(fraction * tactical.width(), room));
            }
        }
        offsets.sort(Double::compare);

        List<Double> thinned = new ArrayList<>();
        double last = entry;
        for (double offset : offsets) {
            double level = entry - sign * offset;
            // Never past the breakout border
            level = side == Side.LONG ? Math.max(level, border) : Math.min(level, border);
            if (level > 0 && farEnough(side, last, level)) {
                thinned.add(level);
                last = level;
            }
        }
        if (thinned.size() <= steps) {
            return thinned;
        }
        List<Double> spread = new ArrayList<>(steps);
        for (int i = 0; i < steps; i++) {
            int index = (int) Math.round((i + 1) * (double) thinned.size() / steps) - 1;
            spread.add(thinned.get(Math.min(thinned.size() - 1, Math.max(0, index))));
        }
        return spread;
    }

    private void extend(Side side, double entry, double atr, int steps, List<Double> ladder) {
        int sign = side.sign();
        double unit = atr > 0 && Double.isFinite(atr) ? atr : entry * 0.005;
        double base = ladder.isEmpty() ? entry : ladder.get(ladder.size() - 1);
        double last = base;
        List<Double> multiples = settings.getFallbackAtrMultiples();
        double multiple = 0;
        int i = 0;
        int guard = 0;
        while (ladder.size() < steps && guard++ < steps * 50) {
            multiple = i < multiples.size() ? multiples.get(i) : multiple + 1;
            i++;
            double level = base - sign * multiple * unit;
            if (level <= 0) {
                break;
            }
            if (farEnough(side, last, level)) {
                ladder.add(level);
                last = level;
            }
        }
    }

    private boolean farEnough(Side side, double previous, double level) {
        double gap = side.sign() * (previous - level) / previous * 100.0;
        return gap >= settings.getLadderMinGapPct();
    }
}
