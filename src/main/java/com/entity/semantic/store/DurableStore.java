package com.entity.semantic.store;

import com.entity.semantic.core.model.IndexEntry;

import java.util.Iterator;

/**
 * External durable copy of the index entries. The vector index can be rebuilt by
 * replaying {@link #scan()} in any order.
 */
public interface DurableStore extends AutoCloseable {

    /**
     * Saves or replaces the entry for its identifier.
     *
     * @throws StoreException if the write fails
     */
    void save(IndexEntry entry);

    /**
     * @return true if an entry was removed
     * @throws StoreException if the write fails
     */
    boolean delete(String identifier);

    /**
     * Iterates over a snapshot of the stored entries.
     */
    Iterator<IndexEntry> scan();

    int size();

    /**
     * Name used in logs and health details.
     */
    String getName();

    @Override
    default void close() {
    }
}
