package io.github.drompincen.opsledger.runtime.lock;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair lock per agent. Everything that must be serialized for a single agent
 * (budget commits, job claims, schedule cancellation, approval decisions) runs under
 * it; different agents never contend.
 */
@Component
public class AgentLockRegistry {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String agentId, Supplier<T> action) {
        ReentrantLock lock = lockFor(agentId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String agentId, Runnable action) {
        withLock(agentId, () -> {
            action.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread(String agentId) {
        ReentrantLock lock = locks.get(agentId);
        return lock != null && lock.isHeldByCurrentThread();
    }

    private ReentrantLock lockFor(String agentId) {
        return locks.computeIfAbsent(agentId, k -> new ReentrantLock(true));
    }
}
