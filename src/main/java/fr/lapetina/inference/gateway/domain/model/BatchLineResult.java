package fr.lapetina.inference.gateway.domain.model;

/**
 * Outcome of one input line of a batch: either a raw result or an error, never both.
 */
public record BatchLineResult(int line, String taskId, String result, GatewayError error) {

    public BatchLineResult {
        if ((result == null) == (error == null)) {
            throw new IllegalArgumentException("Line " + line + " must carry exactly one of result or error");
        }
    }

    public static BatchLineResult success(int line, String taskId, String result) {
        return new BatchLineResult(line, taskId, result, null);
    }

    public static BatchLineResult failure(int line, String taskId, GatewayError error) {
        return new BatchLineResult(line, taskId, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
