package io.recur4j.engine;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped per-job mutual exclusion. Every mutation of a job's persisted state or armed trigger
 * happens while holding the stripe for its id. Locks are reentrant.
 */
public class JobLocks {

    static final int DEFAULT_STRIPES = 256;

    private final ReentrantLock[] stripes;

    public JobLocks() {
        this(DEFAULT_STRIPES);
    }

    public JobLocks(int stripes) {
        if (stripes <= 0) {
            throw new IllegalArgumentException("stripes must be positive");
        }
        this.stripes = new ReentrantLock[stripes];
        for (int i = 0; i < stripes; i++) {
            this.stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String jobId, Supplier<T> action) {
        ReentrantLock lock = lockFor(jobId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String jobId, Runnable action) {
        ReentrantLock lock = lockFor(jobId);
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeldByCurrentThread(String jobId) {
        return lockFor(jobId).isHeldByCurrentThread();
    }

    ReentrantLock lockFor(String jobId) {
        int h = jobId == null ? 0 : jobId.hashCode();
        h ^= (h >>> 16);
        return stripes[Math.floorMod(h, stripes.length)];
    }
}
