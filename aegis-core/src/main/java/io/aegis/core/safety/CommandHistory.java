package io.aegis.core.safety;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded FIFO of command records; the oldest record is evicted first.
 */
public final class CommandHistory {
    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Deque<CommandRecord> records = new ArrayDeque<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public CommandHistory() {
        this(DEFAULT_CAPACITY);
    }

    public CommandHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    public void append(CommandRecord record) {
        lock.writeLock().lock();
        try {
            records.addLast(record);
            while (records.size() > capacity) {
                records.removeFirst();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Newest first.
     */
    public List<CommandRecord> recent(int limit) {
        lock.readLock().lock();
        try {
            List<CommandRecord> out = new ArrayList<>(Math.min(Math.max(limit, 0), records.size()));
            Iterator<CommandRecord> it = records.descendingIterator();
            while (it.hasNext() && out.size() < limit) {
                out.add(it.next());
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Oldest first.
     */
    public List<CommandRecord> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(records);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int removeOlderThan(Instant cutoff) {
        lock.writeLock().lock();
        try {
            int before = records.size();
            records.removeIf(record -> !record.timestamp().isAfter(cutoff));
            return before - records.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
