package com.wickscan.execution.open;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Symbols with an open attempt in flight. The only guard against two concurrent opens on one symbol.
 */
public class ReservationSet {

    private static final Logger log = LoggerFactory.getLogger(ReservationSet.class);

    private final Set<String> symbols = ConcurrentHashMap.newKeySet();

    /**
     * Reserve {@code symbol}, or empty when it is already reserved.
     */
    public Optional<Reservation> tryReserve(String symbol) {
        if (!symbols.add(symbol)) {
            return Optional.empty();
        }
        return Optional.of(new Reservation(symbol));
    }

    public boolean isReserved(String symbol) {
        return symbols.contains(symbol);
    }

    public int size() {
        return symbols.size();
    }

    public Set<String> snapshot() {
        return new HashSet<>(symbols);
    }

    /**
     * Handle of one reservation. Releasing twice is a no-op.
     */
    public final class Reservation implements AutoCloseable {

        private final String symbol;
        private final AtomicBoolean released = new AtomicBoolean();

        private Reservation(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        public boolean isReleased() {
            return released.get();
        }

        /**
         * @return true for the call that actually released
         */
        public boolean release() {
            if (!released.compareAndSet(false, true)) {
                return false;
            }
            symbols.remove(symbol);
            log.debug("Released reservation {}", symbol);
            return true;
        }

        @Override
        public void close() {
            release();
        }
    }
}
