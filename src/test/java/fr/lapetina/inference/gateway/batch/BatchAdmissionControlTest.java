package fr.lapetina.inference.gateway.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class BatchAdmissionControlTest {

    @Test
    @DisplayName("should admit up to the limit per user")
    void shouldAdmitUpToLimit() {
        BatchAdmissionControl admission = new BatchAdmissionControl(2);

        assertThat(admission.tryAcquire("alice")).isTrue();
        assertThat(admission.tryAcquire("alice")).isTrue();
        assertThat(admission.tryAcquire("alice")).isFalse();
        assertThat(admission.tryAcquire("bob")).isTrue();
        assertThat(admission.totalActive()).isEqualTo(3);

        admission.release("alice");

        assertThat(admission.tryAcquire("alice")).isTrue();
    }

    @Test
    @DisplayName("should never go below zero on extra releases")
    void shouldIgnoreExtraReleases() {
        BatchAdmissionControl admission = new BatchAdmissionControl(1);
        admission.release("ghost");
        admission.tryAcquire("alice");
        admission.release("alice");
        admission.release("alice");

        assertThat(admission.activeFor("alice")).isZero();
        assertThat(admission.activeFor("ghost")).isZero();
    }

    @Test
    @DisplayName("should resume from stored counts")
    void shouldInitializeFromStore() {
        BatchAdmissionControl admission = new BatchAdmissionControl(2);

        admission.initialize(Map.of("alice", 2));

        assertThat(admission.tryAcquire("alice")).isFalse();
        admission.setMaxActivePerUser(3);
        assertThat(admission.tryAcquire("alice")).isTrue();
    }

    @Test
    @DisplayName("should not over admit under concurrent submissions")
    void shouldHoldLimitUnderConcurrency() throws Exception {
        BatchAdmissionControl admission = new BatchAdmissionControl(2);
        AtomicInteger admitted = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 50; i++) {
                executor.submit(() -> {
                    if (admission.tryAcquire("alice")) {
                        admitted.incrementAndGet();
                    }
                });
            }
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(admitted.get()).isEqualTo(2);
        assertThat(admission.activeFor("alice")).isEqualTo(2);
    }
}
