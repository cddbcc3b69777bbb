package com.z254.vigil.warden.support;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Size-bounded map with strict least-recently-used eviction.
 * <p>
 * Backed by an access-ordered {@link LinkedHashMap} under a single lock, so every read or write
 * of a key makes it the most recent and an overflow always evicts the least recently touched
 * entry. Remapping functions run under the lock and must not call back into the map.
 */
public class BoundedLruMap<K, V> {

    private final int maxEntries;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<K, V> entries;

    public BoundedLruMap(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > BoundedLruMap.this.maxEntries;
            }
        };
    }

    public V get(K key) {
        lock.lock();
        try {
            return entries.get(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Atomically remaps {@code key}; a {@code null} result removes the entry.
     */
    public V compute(K key, BiFunction<? super K, ? super V, ? extends V> remapping) {
        lock.lock();
        try {
            return entries.compute(key, remapping);
        } finally {
            lock.unlock();
        }
    }

    public V computeIfPresent(K key, BiFunction<? super K, ? super V, ? extends V> remapping) {
        lock.lock();
        try {
            return entries.computeIfPresent(key, remapping);
        } finally {
            lock.unlock();
        }
    }

    public V computeIfAbsent(K key, Function<? super K, ? extends V> mapping) {
        lock.lock();
        try {
            return entries.computeIfAbsent(key, mapping);
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
}
