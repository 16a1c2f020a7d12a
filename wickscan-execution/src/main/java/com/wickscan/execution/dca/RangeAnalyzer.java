package com.wickscan.execution.dca;

import com.wickscan.core.indicators.ATR;
import com.wickscan.core.indicators.EMA;
import com.wickscan.core.indicators.Quantiles;
import com.wickscan.core.model.CandleSeries;
import com.wickscan.execution.config.DcaSettings;

import java.util.Arrays;
import java.util.Optional;

/**
 * Derives the strategic (months) and tactical (days) trading ranges from range-timeframe bars.
 *
 * A range spans the lower/upper close quantiles of its lookback, widened to at least
 * EMA ± k·ATR so a very quiet market still gets a usable band.
 */
public class RangeAnalyzer {

    private final DcaSettings settings;

    public RangeAnalyzer(DcaSettings settings) {
        this.settings = settings;
    }

    /**
     * Number of range-timeframe bars to request for the strategic lookback.
     */
    public int strategicBars(long timeframeMs) {
        return Math.min(settings.getMaxRangeBars(), barsFor(settings.getStrategicLookbackHours(), timeframeMs));
    }

    public Optional<PriceRange> strategic(CandleSeries bars) {
        return range(bars, strategicBars(bars.timeframe().toMillis()));
    }

    public Optional<PriceRange> tactical(CandleSeries bars) {
        return range(bars, barsFor(settings.getTacticalLookbackHours(), bars.timeframe().toMillis()));
    }

    private Optional<PriceRange> range(CandleSeries bars, int lookback) {
        int minBars = Math.max(settings.getRangeEmaPeriod(), settings.getRangeAtrPeriod()) + 1;
        if (bars == null || bars.size() < minBars) {
            return Optional.empty();
        }
        double[] closes = bars.closes();
        int from = Math.max(0, closes.length - lookback);
        double[] window = Arrays.copyOfRange(closes, from, closes.length);

        double lower = Quantiles.quantile(window, settings.getQuantileLower());
        double upper = Quantiles.quantile(window, settings.getQuantileUpper());

        double ema = EMA.latest(closes, settings.getRangeEmaPeriod());
        double atr = ATR.latest(bars.candles(), settings.getRangeAtrPeriod());
        if (Double.isFinite(ema) && Double.isFinite(atr)) {
            double half = settings.getRangeMinAtrMult() * atr;
            lower = Math.min(lower, ema - half);
            upper = Math.max(upper, ema + half);
        }
        if (!Double.isFinite(lower) || !Double.isFinite(upper) || upper <= lower) {
            return Optional.empty();
        }
        return Optional.of(new PriceRange(Math.max(0.0, lower), upper));
    }

    private static int barsFor(int hours, long timeframeMs) {
        return (int) Math.max(1, hours * 3_600_000L / timeframeMs);
    }
}
