package com.wickscan.engine.universe;

import com.wickscan.engine.fetch.MarketDataFetcher;
import com.wickscan.exchange.exception.ExchangeException;
import com.wickscan.exchange.model.MarketInfo;
import com.wickscan.exchange.model.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the per-scan symbol universe from exchange listings and 24h tickers.
 */
public class UniverseBuilder {

    private static final Logger log = LoggerFactory.getLogger(UniverseBuilder.class);

    private final MarketDataFetcher fetcher;
    private final UniverseSettings settings;
    private final Clock clock;

    private Map<String, MarketInfo> markets = Map.of();
    private long marketsLoadedAt;

    public UniverseBuilder(MarketDataFetcher fetcher, UniverseSettings settings, Clock clock) {
        this.fetcher = fetcher;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Liquid perpetuals sorted by symbol and rotated by {@code offset}.
     */
    public synchronized SymbolUniverse build(int offset) throws ExchangeException {
        Map<String, MarketInfo> listed = markets();
        Map<String, Ticker> tickers = fetcher.fetchTickers();

        Set<String> excluded = settings.getExcludedBases().stream()
            .map(s -> s.toUpperCase(Locale.ROOT))
            .collect(Collectors.toSet());

        List<String> eligible = new ArrayList<>();
        Map<String, Ticker> kept = new HashMap<>();
        for (Ticker ticker : tickers.values()) {
            MarketInfo market = listed.get(ticker.symbol());
            if (market == null || !market.active() || !market.isPerpetual()) {
                continue;
            }
            if (!settings.getQuoteAsset().equalsIgnoreCase(market.quoteAsset())) {
                continue;
            }
            if (excluded.contains(market.baseAsset().toUpperCase(Locale.ROOT))) {
                continue;
            }
            if (!(ticker.quoteVolume() >= settings.getMinQuoteVolume())) {
                continue;
            }
            if (!(ticker.last() >= settings.getMinPrice())) {
                continue;
            }
            eligible.add(ticker.symbol());
            kept.put(ticker.symbol(), ticker);
        }

        Collections.sort(eligible);
        int start = eligible.isEmpty() ? 0 : Math.floorMod(offset, eligible.size());
        List<String> rotated = new ArrayList<>(eligible.size());
        rotated.addAll(eligible.subList(start, eligible.size()));
        rotated.addAll(eligible.subList(0, start));

        log.debug("Universe: {} of {} tickers eligible, starting at {}", rotated.size(), tickers.size(), start);
        return new SymbolUniverse(rotated, kept, start);
    }

    private Map<String, MarketInfo> markets() throws ExchangeException {
        long now = clock.millis();
        long maxAge = settings.getMarketsRefreshMinutes() * 60_000L;
        if (markets.isEmpty() || now - marketsLoadedAt > maxAge) {
            markets = fetcher.listMarkets();
            marketsLoadedAt = now;
            log.info("Loaded {} markets", markets.size());
        }
        return markets;
    }
}
