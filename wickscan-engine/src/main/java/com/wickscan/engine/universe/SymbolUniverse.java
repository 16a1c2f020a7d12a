package com.wickscan.engine.universe;

import com.wickscan.exchange.model.Ticker;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tradable symbols of one scan, already rotated so {@code symbols.get(0)} is where this scan starts.
 *
 * @param offset rotation offset applied to the sorted symbol list
 */
public record SymbolUniverse(List<String> symbols, Map<String, Ticker> tickers, int offset) {

    public SymbolUniverse {
        symbols = List.copyOf(symbols);
        tickers = Map.copyOf(tickers);
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    /**
     * Offset the next scan should start from after {@code processed} symbols of this one were scanned.
     */
    public int nextOffset(int processed) {
        if (symbols.isEmpty()) {
            return 0;
        }
        return Math.floorMod(offset + processed, symbols.size());
    }

    /**
     * Consecutive chunks of at most {@code chunkSize} symbols in scan order.
     */
    public List<List<String>> chunks(int chunkSize) {
        int size = Math.max(1, chunkSize);
        List<List<String>> out = new ArrayList<>();
        for (int i = 0; i < symbols.size(); i += size) {
            out.add(symbols.subList(i, Math.min(symbols.size(), i + size)));
        }
        return out;
    }
}
