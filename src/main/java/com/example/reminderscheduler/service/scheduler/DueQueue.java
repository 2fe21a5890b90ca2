package com.example.reminderscheduler.service.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory due set of scheduled jobs, earliest first, plus the wake-up signal the
 * scheduler loop waits on.
 * <p>
 * Holds at most one entry per job id. Thread-safe.
 */
public class DueQueue {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final TreeSet<DueEntry> entries = new TreeSet<>();
    private final Map<String, DueEntry> byId = new HashMap<>();

    /**
     * Per id, the modification stamp of its last upsert or remove
     */
    private final Map<String, Long> touched = new HashMap<>();
    private long stamp;
    private boolean signalled;

    /**
     * Insert or move a job. Wakes the waiter only if the job became the new head.
     */
    public void upsert(String jobId, Instant dueAt) {
        lock.lock();
        try {
            touched.put(jobId, ++stamp);
            var previous = byId.remove(jobId);
            if (previous != null) {
                entries.remove(previous);
            }
            var entry = new DueEntry(jobId, dueAt);
            entries.add(entry);
            byId.put(jobId, entry);
            if (entries.first() == entry) {
                signal();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true if the job was queued
     */
    public boolean remove(String jobId) {
        lock.lock();
        try {
            touched.put(jobId, ++stamp);
            var previous = byId.remove(jobId);
            if (previous == null) {
                return false;
            }
            entries.remove(previous);
            signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove and return every entry due at or before {@code now}, in firing order
     */
    public List<DueEntry> pollDue(Instant now) {
        lock.lock();
        try {
            var due = new ArrayList<DueEntry>();
            while (!entries.isEmpty() && !entries.first().getDueAt().isAfter(now)) {
                var entry = entries.pollFirst();
                byId.remove(entry.getJobId());
                due.add(entry);
            }
            return due;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Instant> peekNextDueTime() {
        lock.lock();
        try {
            return entries.isEmpty() ? Optional.empty() : Optional.of(entries.first().getDueAt());
        } finally {
            lock.unlock();
        }
    }

    public Optional<Instant> dueTimeOf(String jobId) {
        lock.lock();
        try {
            return Optional.ofNullable(byId.get(jobId)).map(DueEntry::getDueAt);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current modification stamp; pass it to {@link #synchronize} together with a store
     * snapshot read after this call
     */
    public long stamp() {
        lock.lock();
        try {
            return stamp;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Align the queue with a store snapshot taken after {@code snapshotStamp}. Ids upserted
     * or removed since then keep their newer state; every other id takes the snapshot's.
     */
    public void synchronize(Collection<DueEntry> snapshot, long snapshotStamp) {
        lock.lock();
        try {
            var snapshotIds = new HashSet<String>();
            for (var entry : snapshot) {
                snapshotIds.add(entry.getJobId());
                if (touchedSince(entry.getJobId(), snapshotStamp)) {
                    continue;
                }
                var previous = byId.put(entry.getJobId(), entry);
                if (previous != null) {
                    entries.remove(previous);
                }
                entries.add(entry);
            }
            for (var entry : new ArrayList<>(entries)) {
                if (!snapshotIds.contains(entry.getJobId()) && !touchedSince(entry.getJobId(), snapshotStamp)) {
                    entries.remove(entry);
                    byId.remove(entry.getJobId());
                }
            }
            touched.values().removeIf(touchedAt -> touchedAt <= snapshotStamp);
            signal();
        } finally {
            lock.unlock();
        }
    }

    private boolean touchedSince(String jobId, long snapshotStamp) {
        var touchedAt = touched.get(jobId);
        return touchedAt != null && touchedAt > snapshotStamp;
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public void wakeUp() {
        lock.lock();
        try {
            signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until the head entry is due, a wake-up arrives or {@code maxWait} elapses,
     * whichever comes first. Returns immediately if a wake-up arrived since the last call.
     */
    public void awaitNext(Clock clock, Duration maxWait) throws InterruptedException {
        lock.lock();
        try {
            if (!signalled) {
                var waitMillis = maxWait.toMillis();
                if (!entries.isEmpty()) {
                    var untilHead = Duration.between(clock.instant(), entries.first().getDueAt()).toMillis();
                    waitMillis = Math.min(waitMillis, Math.max(0, untilHead));
                }
                if (waitMillis > 0) {
                    changed.await(waitMillis, TimeUnit.MILLISECONDS);
                }
            }
            signalled = false;
        } finally {
            lock.unlock();
        }
    }

    private void signal() {
        signalled = true;
        changed.signalAll();
    }
}
