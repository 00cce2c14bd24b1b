package fr.lapetina.inference.gateway.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Totals computed once a batch completes.
 */
public record BatchMetrics(
        long totalTokens,
        int numResponses,
        int numErrors,
        double responseTimeSec,
        double throughputTokensPerSec
) {
    public static BatchMetrics compute(List<BatchLineResult> lines, Instant startedAt, Instant completedAt) {
        long tokens = 0;
        int responses = 0;
        int errors = 0;
        for (BatchLineResult line : lines) {
            if (line.isSuccess()) {
                responses++;
                Long lineTokens = UsageStats.parse(line.result()).totalTokens();
                if (lineTokens != null) {
                    tokens += lineTokens;
                }
            } else {
                errors++;
            }
        }
        double seconds = 0;
        if (startedAt != null && completedAt != null) {
            seconds = Duration.between(startedAt, completedAt).toMillis() / 1000.0;
        }
        double throughput = seconds > 0 ? tokens / seconds : 0;
        return new BatchMetrics(tokens, responses, errors, seconds, throughput);
    }
}
