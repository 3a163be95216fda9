package com.stockforecast.backend.forecast.cache;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity least-recently-used cache. Entries leave only through capacity eviction,
 * {@link #remove} or {@link #clear}; nothing expires by time.
 * <p>
 * The cache keeps no statistics and does no logging: {@link #get} reports a hit through its
 * return value and {@link #put} returns the evicted key, so callers decide what to record.
 */
public class BoundedLruCache<K, V> {

    private final int capacity;
    private final LinkedHashMap<K, V> entries;
    private final ReentrantLock lock = new ReentrantLock();

    public BoundedLruCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Cache capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(capacity * 2, 0.75f, true);
    }

    public Optional<V> get(K key) {
        lock.lock();
        try {
            // access-ordered map: a successful get moves the key to the MRU end
            return Optional.ofNullable(entries.get(key));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts or replaces {@code key} as most recently used.
     *
     * @return the key evicted to make room, if the insertion breached capacity
     */
    public Optional<K> put(K key, V value) {
        lock.lock();
        try {
            if (entries.containsKey(key)) {
                entries.put(key, value);
                return Optional.empty();
            }
            K evicted = null;
            if (entries.size() >= capacity) {
                Iterator<Map.Entry<K, V>> eldest = entries.entrySet().iterator();
                evicted = eldest.next().getKey();
                eldest.remove();
            }
            entries.put(key, value);
            return Optional.ofNullable(evicted);
        } finally {
            lock.unlock();
        }
    }

    public Optional<V> remove(K key) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.remove(key));
        } finally {
            lock.unlock();
        }
    }

    public boolean containsKey(K key) {
        lock.lock();
        try {
            // containsKey does not touch access order
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    /** Keys ordered from least to most recently used. */
    public List<K> keys() {
        lock.lock();
        try {
            return new ArrayList<>(entries.keySet());
        } finally {
            lock.unlock();
        }
    }

    public Map<K, V> snapshot() {
        lock.lock();
        try {
            return new LinkedHashMap<>(entries);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }
}
