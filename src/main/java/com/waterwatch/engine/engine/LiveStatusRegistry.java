package com.waterwatch.engine.engine;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-only snapshot of the latest status per threshold, written by the poll cycle.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Component
public class LiveStatusRegistry {

    private final Map<String, ThresholdStatus> statuses = new ConcurrentHashMap<>();

    public void update(ThresholdStatus status) {
        statuses.put(status.getRef(), status);
    }

    public Optional<ThresholdStatus> get(String ref) {
        return Optional.ofNullable(statuses.get(ref));
    }

    public List<ThresholdStatus> all() {
        return statuses.values().stream()
                .sorted(Comparator.comparing(ThresholdStatus::getRef))
                .toList();
    }
}
