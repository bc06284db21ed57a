package com.waterwatch.engine.delta;

import com.waterwatch.engine.model.CounterState;
import com.waterwatch.engine.support.KeyedLocks;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Per-tag counter state, guarded by one lock per tag.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Component
public class CounterStateStore {

    private final Map<String, CounterState> states = new ConcurrentHashMap<>();
    private final KeyedLocks locks = new KeyedLocks();

    public Optional<CounterState> get(String tagId) {
        return Optional.ofNullable(states.get(tagId));
    }

    /**
     * Run an action holding the tag's lock
     */
    public <T> T withTagLock(String tagId, Supplier<T> action) {
        return locks.withLock(tagId, action);
    }

    /**
     * Replace the state of a tag. Callers hold the tag lock.
     */
    void apply(CounterState state) {
        states.put(state.getTagId(), state);
    }

    public Map<String, CounterState> snapshot() {
        return Map.copyOf(states);
    }

    public void clear() {
        states.clear();
    }
}
