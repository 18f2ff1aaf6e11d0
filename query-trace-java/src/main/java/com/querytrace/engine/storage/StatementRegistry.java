package com.querytrace.engine.storage;

import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity table mapping a session key to the statement that session is currently
 * executing, shared by every session so that storage-level I/O can be attributed to a statement.
 * The key is whatever identifies one session: a process id when each session is its own process,
 * a session id when many sessions share a JVM.
 *
 * Every operation takes the single lock, scans the slots linearly, mutates and releases. Nothing
 * blocking happens while the lock is held. Registration is best effort: when every slot is owned
 * by another session it returns false and the caller's I/O goes unattributed.
 */
public class StatementRegistry {

    public static final int DEFAULT_CAPACITY = 100;

    private final ReentrantLock lock = new ReentrantLock();
    private final long[] keys;
    private final long[] statementIds;
    private final boolean[] active;

    public StatementRegistry() {
        this(DEFAULT_CAPACITY);
    }

    public StatementRegistry(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (got " + capacity + ")");
        }
        this.keys = new long[capacity];
        this.statementIds = new long[capacity];
        this.active = new boolean[capacity];
    }

    public int capacity() {
        return keys.length;
    }

    /**
     * Records {@code statementId} as the active statement of {@code sessionKey}, reusing the slot
     * the session already owns or else the first free one.
     *
     * @return false when the table is full
     */
    public boolean register(long sessionKey, long statementId) {
        lock.lock();
        try {
            int free = -1;
            for (int i = 0; i < keys.length; i++) {
                if (active[i] && keys[i] == sessionKey) {
                    statementIds[i] = statementId;
                    return true;
                }
                if (!active[i] && free < 0) free = i;
            }
            if (free < 0) return false;
            keys[free] = sessionKey;
            statementIds[free] = statementId;
            active[free] = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Releases the slot owned by {@code sessionKey}, if any. */
    public void unregister(long sessionKey) {
        lock.lock();
        try {
            for (int i = 0; i < keys.length; i++) {
                if (active[i] && keys[i] == sessionKey) {
                    active[i] = false;
                    statementIds[i] = 0;
                    return;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public OptionalLong lookup(long sessionKey) {
        lock.lock();
        try {
            for (int i = 0; i < keys.length; i++) {
                if (active[i] && keys[i] == sessionKey) {
                    return OptionalLong.of(statementIds[i]);
                }
            }
            return OptionalLong.empty();
        } finally {
            lock.unlock();
        }
    }

    public int activeCount() {
        lock.lock();
        try {
            int n = 0;
            for (boolean a : active) {
                if (a) n++;
            }
            return n;
        } finally {
            lock.unlock();
        }
    }
}
