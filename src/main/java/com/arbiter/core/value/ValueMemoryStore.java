package com.arbiter.core.value;

import java.util.Optional;

/**
 * Load/save of the persisted global value state. Each call reads or writes
 * the entire record.
 */
public interface ValueMemoryStore {

    /**
     * @return the stored snapshot, or empty if nothing has been saved yet
     * @throws ValueMemoryStoreException if stored state exists but cannot be read
     */
    Optional<ValueMemorySnapshot> load();

    /**
     * @throws ValueMemoryStoreException if the snapshot cannot be written
     */
    void save(ValueMemorySnapshot snapshot);
}
