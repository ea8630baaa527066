package io.aegis.core.policy;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory evaluation log; the oldest entry is evicted once capacity is reached.
 */
public final class PolicyAuditLog {
    public static final int DEFAULT_CAPACITY = 10_000;

    private final int capacity;
    private final Deque<PolicyAuditEntry> entries = new ArrayDeque<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public PolicyAuditLog() {
        this(DEFAULT_CAPACITY);
    }

    public PolicyAuditLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    public void append(PolicyAuditEntry entry) {
        lock.writeLock().lock();
        try {
            entries.addLast(entry);
            while (entries.size() > capacity) {
                entries.removeFirst();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Oldest first.
     */
    public List<PolicyAuditEntry> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
