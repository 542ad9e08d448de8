package com.novoiceCluster.Realtime.services;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One exclusive lock per key ({@code voice:<channelId>}, {@code user:<userId>}).
 *
 * Mutation of a voice room or its playback session, and the broadcast it triggers, happen
 * inside one critical section, so every member observes broadcasts in mutation order.
 * Locks are reentrant: closing a room can discard its session while the room lock is held.
 *
 * An entry lives only while some thread holds or waits for it; the holder count is changed
 * inside {@code compute}, which is atomic per key.
 */
@Component
public class KeyedLocks {

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

    public static String voiceKey(String channelId) {
        return "voice:" + channelId;
    }

    public static String userKey(String userId) {
        return "user:" + userId;
    }

    public <T> T call(String key, Supplier<T> action) {
        Entry entry = locks.compute(key, (k, existing) -> {
            Entry claimed = existing == null ? new Entry() : existing;
            claimed.users++;
            return claimed;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, existing) -> --existing.users == 0 ? null : existing);
        }
    }

    public void run(String key, Runnable action) {
        call(key, () -> {
            action.run();
            return null;
        });
    }

    int size() {
        return locks.size();
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }
}
