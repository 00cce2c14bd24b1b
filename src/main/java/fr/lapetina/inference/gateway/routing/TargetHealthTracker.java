package fr.lapetina.inference.gateway.routing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Remembers recent target failures so the router tries healthy targets first.
 *
 * A failed target enters a cooldown window. Targets in cooldown are not excluded,
 * only ordered after the others, so a request can still reach them when nothing
 * else works. A success clears the failure record.
 *
 * Thread-safe.
 */
public final class TargetHealthTracker {

    private static final Logger log = LoggerFactory.getLogger(TargetHealthTracker.class);

    private final Map<String, FailureRecord> failures = new ConcurrentHashMap<>();
    private final Clock clock;
    private volatile Duration cooldown;

    public TargetHealthTracker(Clock clock, Duration cooldown) {
        this.clock = clock;
        this.cooldown = cooldown;
    }

    public void recordFailure(String target) {
        Instant now = clock.instant();
        FailureRecord record = failures.computeIfAbsent(target, k -> new FailureRecord());
        int count = record.consecutiveFailures.incrementAndGet();
        record.lastFailureAt = now;
        log.info("Target entered cooldown: target={}, consecutiveFailures={}, cooldown={}",
                target, count, cooldown);
    }

    public void recordSuccess(String target) {
        FailureRecord removed = failures.remove(target);
        if (removed != null) {
            log.info("Target recovered: target={}, previousFailures={}",
                    target, removed.consecutiveFailures.get());
        }
    }

    public boolean isCoolingDown(String target) {
        FailureRecord record = failures.get(target);
        if (record == null || record.lastFailureAt == null) {
            return false;
        }
        return clock.instant().isBefore(record.lastFailureAt.plus(cooldown));
    }

    public int getConsecutiveFailures(String target) {
        FailureRecord record = failures.get(target);
        return record != null ? record.consecutiveFailures.get() : 0;
    }

    /**
     * Orders candidates for one request: targets outside their cooldown keep their
     * relative order and come first; targets in cooldown follow, least recently
     * failed first.
     */
    public <T> List<T> order(List<T> candidates, Function<T, String> keyOf) {
        List<T> ready = new ArrayList<>();
        List<T> cooling = new ArrayList<>();
        for (T candidate : candidates) {
            if (isCoolingDown(keyOf.apply(candidate))) {
                cooling.add(candidate);
            } else {
                ready.add(candidate);
            }
        }
        cooling.sort(Comparator.comparing(c -> lastFailureAt(keyOf.apply(c))));
        ready.addAll(cooling);
        return ready;
    }

    private Instant lastFailureAt(String target) {
        FailureRecord record = failures.get(target);
        return record != null && record.lastFailureAt != null ? record.lastFailureAt : Instant.MIN;
    }

    public void setCooldown(Duration cooldown) {
        this.cooldown = cooldown;
    }

    public Duration getCooldown() {
        return cooldown;
    }

    private static final class FailureRecord {
        private final AtomicInteger consecutiveFailures = new AtomicInteger();
        private volatile Instant lastFailureAt;
    }
}
