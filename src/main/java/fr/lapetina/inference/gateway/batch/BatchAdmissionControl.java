package fr.lapetina.inference.gateway.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-user cap on active batches.
 *
 * A slot is taken with a compare-and-increment, so two concurrent submissions can never
 * both take the last slot. Requests over the cap are refused, never queued.
 */
public final class BatchAdmissionControl {

    private static final Logger log = LoggerFactory.getLogger(BatchAdmissionControl.class);

    private final Map<String, AtomicInteger> active = new ConcurrentHashMap<>();
    private volatile int maxActivePerUser;

    public BatchAdmissionControl(int maxActivePerUser) {
        this.maxActivePerUser = maxActivePerUser;
    }

    /**
     * Seeds the counters from stored jobs, e.g. after a restart.
     */
    public void initialize(Map<String, Integer> activeByUser) {
        active.clear();
        activeByUser.forEach((user, count) -> active.put(user, new AtomicInteger(count)));
        log.info("Batch admission initialized: users={}", activeByUser.size());
    }

    public boolean tryAcquire(String username) {
        AtomicInteger counter = active.computeIfAbsent(username, k -> new AtomicInteger());
        int limit = maxActivePerUser;
        while (true) {
            int current = counter.get();
            if (current >= limit) {
                log.info("Batch admission refused: username={}, active={}, limit={}", username, current, limit);
                return false;
            }
            if (counter.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public void release(String username) {
        AtomicInteger counter = active.get(username);
        if (counter == null) {
            return;
        }
        int remaining = counter.updateAndGet(c -> Math.max(0, c - 1));
        log.debug("Batch slot released: username={}, active={}", username, remaining);
    }

    public int activeFor(String username) {
        AtomicInteger counter = active.get(username);
        return counter != null ? counter.get() : 0;
    }

    public int totalActive() {
        return active.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    public int getMaxActivePerUser() {
        return maxActivePerUser;
    }

    public void setMaxActivePerUser(int maxActivePerUser) {
        this.maxActivePerUser = maxActivePerUser;
    }
}
