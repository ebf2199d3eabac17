package com.docqa.rag.config;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One reentrant lock per key. An entry lives only while some thread holds or waits for it, so
 * keys supplied by callers do not accumulate.
 */
public final class KeyedLocks<K> {

    private final Map<K, Entry> entries = new ConcurrentHashMap<>();

    public Held acquire(K key) {
        Entry entry = entries.compute(key, (k, existing) -> {
            Entry claimed = existing == null ? new Entry() : existing;
            claimed.users++;
            return claimed;
        });
        entry.lock.lock();
        return () -> {
            entry.lock.unlock();
            entries.computeIfPresent(key, (k, existing) -> --existing.users == 0 ? null : existing);
        };
    }

    public int size() {
        return entries.size();
    }

    /**
     * Releases the lock when closed.
     */
    public interface Held extends AutoCloseable {

        @Override
        void close();
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }
}
