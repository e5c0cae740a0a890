package com.arbiter.core.value;

import java.util.Optional;

/**
 * Non-durable {@link ValueMemoryStore}: keeps the last saved snapshot in memory.
 */
public class InMemoryValueMemoryStore implements ValueMemoryStore {

    private ValueMemorySnapshot snapshot;

    @Override
    public Optional<ValueMemorySnapshot> load() {
        return Optional.ofNullable(snapshot);
    }

    @Override
    public void save(ValueMemorySnapshot snapshot) {
        this.snapshot = snapshot;
    }
}
