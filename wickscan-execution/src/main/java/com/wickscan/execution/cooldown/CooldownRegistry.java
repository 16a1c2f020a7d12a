package com.wickscan.execution.cooldown;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Timed re-entry suppression per symbol. A symbol is cooling down while {@code now < until}.
 */
public class CooldownRegistry {

    private static final Logger log = LoggerFactory.getLogger(CooldownRegistry.class);

    // symbol -> expiry (epoch ms)
    private final Map<String, Long> until = new ConcurrentHashMap<>();

    /**
     * Start (or extend) a cooldown. An existing later expiry is kept.
     */
    public void start(String symbol, long untilMs) {
        until.merge(symbol, untilMs, Math::max);
    }

    public void startFor(String symbol, long durationMs, long nowMs) {
        start(symbol, nowMs + durationMs);
    }

    public boolean isActive(String symbol, long nowMs) {
        Long expiry = until.get(symbol);
        return expiry != null && nowMs < expiry;
    }

    /**
     * Remaining cooldown in ms, 0 when none.
     */
    public long remainingMs(String symbol, long nowMs) {
        Long expiry = until.get(symbol);
        return expiry == null ? 0 : Math.max(0, expiry - nowMs);
    }

    public int purgeExpired(long nowMs) {
        int before = until.size();
        until.entrySet().removeIf(e -> e.getValue() <= nowMs);
        int purged = before - until.size();
        if (purged > 0) {
            log.debug("Purged {} expired cooldowns", purged);
        }
        return purged;
    }

    public int size() {
        return until.size();
    }

    public Map<String, Long> snapshot() {
        return new HashMap<>(until);
    }

    public void restore(Map<String, Long> restored) {
        if (restored != null) {
            restored.forEach(this::start);
        }
    }

    public void clear() {
        until.clear();
    }
}
