package com.phillippitts.callpilot.service.consolidation;

import com.phillippitts.callpilot.domain.Booking;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded, insertion-ordered record of accepted bookings, newest last.
 *
 * <p>When full, appending evicts the oldest entry. Only the consolidator appends. Readers get
 * a copied snapshot taken under the read lock, so they never see a half-applied append.
 */
@Component
public class TelemetryHistory {

    public static final int DEFAULT_CAPACITY = 20;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Deque<Booking> entries;
    private final int capacity;

    public TelemetryHistory() {
        this(DEFAULT_CAPACITY);
    }

    TelemetryHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity + 1);
    }

    /**
     * Appends a booking, evicting the oldest one if the history is full.
     *
     * @return the evicted booking, or {@code null}
     */
    Booking append(Booking booking) {
        Objects.requireNonNull(booking, "booking must not be null");
        lock.writeLock().lock();
        try {
            entries.addLast(booking);
            return entries.size() > capacity ? entries.removeFirst() : null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return up to {@link #capacity()} bookings, oldest first
     */
    public List<Booking> snapshot() {
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

    public int capacity() {
        return capacity;
    }
}
