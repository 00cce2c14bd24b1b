package fr.lapetina.inference.gateway.adaptor.fabric;

import java.util.Locale;
import java.util.Objects;

/**
 * Status of one task on the execution fabric.
 *
 * @param result raw function output, set when the task succeeded
 * @param error  remote exception text, set when the task failed
 */
public record FabricTask(String taskId, State state, String result, String error) {

    public enum State {
        PENDING,
        RUNNING,
        SUCCESS,
        FAILED,
        /** The fabric no longer knows the task. */
        UNKNOWN;

        public boolean isTerminal() {
            return this == SUCCESS || this == FAILED || this == UNKNOWN;
        }

        public static State fromWire(String value) {
            if (value == null) {
                return UNKNOWN;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "pending", "waiting-for-launch", "waiting-for-ep", "waiting-for-nodes", "received" -> PENDING;
                case "running", "running-ended", "exec-start" -> RUNNING;
                case "success", "succeeded", "exec-end", "result-received" -> SUCCESS;
                case "failed", "failure", "error" -> FAILED;
                default -> UNKNOWN;
            };
        }
    }

    public FabricTask {
        Objects.requireNonNull(taskId, "Task ID is required");
        Objects.requireNonNull(state, "State is required");
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /** Whether the task has left the queue. */
    public boolean hasStarted() {
        return state != State.PENDING;
    }
}
