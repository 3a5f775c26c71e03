package com.entity.semantic.store;

import com.entity.semantic.core.model.IndexEntry;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store. Suitable for development and testing; contents are lost on restart.
 */
public class InMemoryDurableStore implements DurableStore {

    private final Map<String, IndexEntry> entries = new ConcurrentHashMap<>();

    @Override
    public void save(IndexEntry entry) {
        entries.put(entry.identifier(), entry);
    }

    @Override
    public boolean delete(String identifier) {
        return entries.remove(identifier) != null;
    }

    @Override
    public Iterator<IndexEntry> scan() {
        return new ArrayList<>(entries.values()).iterator();
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public String getName() {
        return "in-memory";
    }
}
