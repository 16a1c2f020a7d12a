package com.wickscan.execution.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.wickscan.engine.threshold.ThresholdState;
import com.wickscan.execution.position.Position;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to resume a session after a restart.
 *
 * @param cooldowns symbol to expiry (epoch ms)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineSnapshot(
    Instant savedAt,
    boolean enabled,
    ThresholdState threshold,
    List<Position> positions,
    Map<String, Long> cooldowns,
    int rotationOffset
) {
    public EngineSnapshot {
        positions = positions != null ? List.copyOf(positions) : List.of();
        cooldowns = cooldowns != null ? Map.copyOf(cooldowns) : Map.of();
    }
}
