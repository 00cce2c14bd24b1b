package fr.lapetina.inference.gateway.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Batch job lifecycle: SUBMITTED -> PENDING -> RUNNING -> {COMPLETED | FAILED}.
 *
 * Transitions only move forward. A running batch never returns to pending and
 * terminal states are final.
 */
public enum BatchStatus {
    SUBMITTED(0),
    PENDING(1),
    RUNNING(2),
    COMPLETED(3),
    FAILED(3);

    private final int rank;

    BatchStatus(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(BatchStatus next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.rank > rank;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<BatchStatus> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
