package com.example.canarycontroller.canary;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per deployment id. Operations on the same deployment run one at a time;
 * different deployments proceed in parallel.
 *
 * A lock exists only while some thread holds or waits for it, so finished deployments
 * leave nothing behind.
 */
@Component
public class DeploymentLockRegistry {

    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String deploymentId, Supplier<T> work) {
        LockEntry entry = locks.compute(deploymentId, (id, existing) -> {
            LockEntry e = existing != null ? existing : new LockEntry();
            e.users++;
            return e;
        });
        entry.lock.lock();
        try {
            return work.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(deploymentId, (id, e) -> --e.users == 0 ? null : e);
        }
    }

    int size() {
        return locks.size();
    }

    /** Users count is only read and written inside the map's compute functions */
    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
