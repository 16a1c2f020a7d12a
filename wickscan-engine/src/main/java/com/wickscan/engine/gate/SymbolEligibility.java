package com.wickscan.engine.gate;

/**
 * Engine-state checks the gate consults before looking at any bar.
 */
public interface SymbolEligibility {

    boolean isCoolingDown(String symbol, long nowMs);

    /**
     * True when the symbol already holds (or is opening) the maximum number of positions.
     */
    boolean isAtPositionLimit(String symbol, int maxPerSymbol);

    SymbolEligibility ALWAYS = new SymbolEligibility() {
        @Override
        public boolean isCoolingDown(String symbol, long nowMs) {
            return false;
        }

        @Override
        public boolean isAtPositionLimit(String symbol, int maxPerSymbol) {
            return false;
        }
    };
}
