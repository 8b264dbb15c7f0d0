package com.example.anchormud.world;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-room mutual exclusion. Every read-modify-write of a room's combat
 * session, room state or registry entries runs inside {@link #withRoom}.
 * Multi-room operations take their locks in sorted room-id order.
 *
 * Never perform network I/O while holding a room lock; collect messages in
 * an outbox and flush after returning.
 */
public class RoomLockManager {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    private ReentrantLock lockFor(String roomId) {
        return locks.computeIfAbsent(Objects.requireNonNull(roomId, "roomId"), k -> new ReentrantLock(true));
    }

    public <T> T withRoom(String roomId, Supplier<T> action) {
        ReentrantLock lock = lockFor(roomId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runInRoom(String roomId, Runnable action) {
        withRoom(roomId, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Run with several rooms locked. Nulls and duplicates are ignored.
     */
    public <T> T withRooms(Collection<String> roomIds, Supplier<T> action) {
        TreeSet<String> ordered = new TreeSet<>();
        for (String id : roomIds) {
            if (id != null) ordered.add(id);
        }
        List<ReentrantLock> held = new ArrayList<>(ordered.size());
        try {
            for (String id : ordered) {
                ReentrantLock lock = lockFor(id);
                lock.lock();
                held.add(lock);
            }
            return action.get();
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
        }
    }

    public boolean isHeldByCurrentThread(String roomId) {
        ReentrantLock lock = locks.get(roomId);
        return lock != null && lock.isHeldByCurrentThread();
    }
}
