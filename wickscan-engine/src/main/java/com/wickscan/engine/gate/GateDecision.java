package com.wickscan.engine.gate;

import java.util.Optional;

/**
 * Gate outcome for one symbol: a passing result, or a rejection reason with whatever
 * metrics were computed before the rejection.
 */
public record GateDecision(String symbol, GateResult result, GateRejection rejection) {

    public static GateDecision pass(GateResult result) {
        return new GateDecision(result.symbol(), result, null);
    }

    public static GateDecision reject(String symbol, GateRejection rejection) {
        return new GateDecision(symbol, null, rejection);
    }

    public static GateDecision reject(GateResult result, GateRejection rejection) {
        return new GateDecision(result.symbol(), result, rejection);
    }

    public boolean passed() {
        return rejection == null;
    }

    public Optional<GateResult> metrics() {
        return Optional.ofNullable(result);
    }
}
