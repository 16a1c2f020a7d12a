package com.wickscan.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kline intervals understood by the engine, named the way exchanges name them.
 */
public enum Timeframe {
    M1("1m", 60_000L),
    M3("3m", 3 * 60_000L),
    M5("5m", 5 * 60_000L),
    M15("15m", 15 * 60_000L),
    M30("30m", 30 * 60_000L),
    H1("1h", 3_600_000L),
    H4("4h", 4 * 3_600_000L),
    D1("1d", 86_400_000L);

    private final String code;
    private final long millis;

    Timeframe(String code, long millis) {
        this.code = code;
        this.millis = millis;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public long toMillis() {
        return millis;
    }

    /**
     * Resolve an exchange interval code such as "1m" or "4h".
     *
     * @throws IllegalArgumentException for unknown codes
     */
    @JsonCreator
    public static Timeframe fromCode(String code) {
        for (Timeframe tf : values()) {
            if (tf.code.equalsIgnoreCase(code)) {
                return tf;
            }
        }
        throw new IllegalArgumentException("Unknown timeframe: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
