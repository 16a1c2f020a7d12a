package com.wickscan.execution.position;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Active positions keyed by signal id. Closed positions are removed.
 */
public class PositionBook {

    private static final Logger log = LoggerFactory.getLogger(PositionBook.class);

    private final Map<String, Position> positions = new ConcurrentHashMap<>();

    public void add(Position position) {
        positions.put(position.getId(), position);
    }

    /**
     * Remove a position from the active set.
     */
    public boolean remove(Position position) {
        return positions.remove(position.getId(), position);
    }

    public Optional<Position> get(String id) {
        return Optional.ofNullable(positions.get(id));
    }

    public List<Position> getActive() {
        return new ArrayList<>(positions.values());
    }

    public int size() {
        return positions.size();
    }

    public boolean hasSymbol(String symbol) {
        return countForSymbol(symbol) > 0;
    }

    public int countForSymbol(String symbol) {
        int count = 0;
        for (Position p : positions.values()) {
            if (p.getSymbol().equals(symbol)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Restore positions from persisted state (used on startup). Closed entries are skipped.
     */
    public void restore(Collection<Position> restored) {
        for (Position p : restored) {
            if (p.isActive()) {
                positions.put(p.getId(), p);
            }
        }
        log.info("Restored {} active positions", positions.size());
    }
}
