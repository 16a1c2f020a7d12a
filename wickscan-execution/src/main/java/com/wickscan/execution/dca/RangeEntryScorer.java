package com.wickscan.execution.dca;

import com.wickscan.core.indicators.ATR;
import com.wickscan.core.indicators.EMA;
import com.wickscan.core.indicators.RSI;
import com.wickscan.core.indicators.Supertrend;
import com.wickscan.core.indicators.VolumeStats;
import com.wickscan.core.model.CandleSeries;
import com.wickscan.core.model.Side;
import com.wickscan.execution.config.DcaSettings;

import java.util.Optional;

/**
 * Entry scoring for the range strategy. Each term lies in [0, 1]; the weighted sum is clamped
 * to [0, 1]. Terms that cannot be computed contribute nothing.
 */
public class RangeEntryScorer {

    private final DcaSettings settings;

    public RangeEntryScorer(DcaSettings settings) {
        this.settings = settings;
    }

    /**
     * Band entries are taken from: the tighter of both ranges on each side, so the averaging ladder
     * has room before the strategic border.
     */
    public static PriceRange entryRange(PriceRange tactical, PriceRange strategic) {
        if (tactical == null) {
            return strategic;
        }
        double lower = Math.max(tactical.lower(), strategic.lower());
        double upper = Math.min(tactical.upper(), strategic.upper());
        return upper > lower ? new PriceRange(lower, upper) : strategic;
    }

    /**
     * Side whose entry zone {@code price} sits in: near the lower border for LONG, near the upper
     * border for SHORT.
     */
    public Optional<Side> zoneSide(double price, PriceRange range) {
        double band = settings.getBorderBandPct() / 100.0;
        if (price <= range.lower() * (1 + band)) {
            return Optional.of(Side.LONG);
        }
        if (price >= range.upper() * (1 - band)) {
            return Optional.of(Side.SHORT);
        }
        return Optional.empty();
    }

    public double score(Side side, CandleSeries bars, PriceRange range, double price) {
        if (bars == null || bars.size() < 2) {
            return 0.0;
        }
        int last = bars.size() - 1;
        double[] closes = bars.closes();
        double close = closes[last];

        double border = borderTerm(side, price, range);

        double rsi = RSI.latest(closes, settings.getRsiPeriod());
        double rsiTerm = Double.isFinite(rsi) ? clamp(side.sign() * (50 - rsi) / 50) : 0;

        double ema = EMA.latest(closes, settings.getEmaPeriod());
        double atr = ATR.latest(bars.candles(), settings.getAtrPeriod());
        double emaDev = Double.isFinite(ema) && atr > 0 ? Math.min(Math.abs(close - ema) / atr / 2, 1) : 0;

        Supertrend.Result st = Supertrend.calculate(bars.candles(), settings.getSupertrendPeriod(),
            settings.getSupertrendMultiplier());
        double stTerm = st.flippedAt(last) && st.trendAt(last) == side.sign() ? 1 : 0;

        double volZ = VolumeStats.zScore(bars.volumes(), settings.getVolWindow(), last);
        double volTerm = Double.isFinite(volZ) ? clamp((volZ - 0.6) / 1.0) : 0;

        double total = settings.getWeightBorder() * border
            + settings.getWeightRsi() * rsiTerm
            + settings.getWeightEmaDev() * emaDev
            + settings.getWeightSupertrend() * stTerm
            + settings.getWeightVolume() * volTerm;
        return clamp(total);
    }

    /**
     * Whether the latest bars confirm a turn toward {@code side}: the Supertrend points that way.
     */
    public boolean reversalConfirmed(Side side, CandleSeries bars) {
        if (bars == null || bars.isEmpty()) {
            return false;
        }
        Supertrend.Result st = Supertrend.calculate(bars.candles(), settings.getSupertrendPeriod(),
            settings.getSupertrendMultiplier());
        return st.trendAt(bars.size() - 1) == side.sign();
    }

    static double borderTerm(Side side, double price, PriceRange range) {
        double span = 0.2 * range.width();
        if (!(span > 0)) {
            return 0;
        }
        double distance = side == Side.LONG ? price - range.lower() : range.upper() - price;
        return 1 - clamp(distance / span);
    }

    private static double clamp(double v) {
        return Math.max(0, Math.min(1, v));
    }
}
