package insights.model.domain;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of running one analysis stage: completed, skipped (precondition unmet)
 * or failed after its retries.
 */
public record ModuleOutcome(
    String module,
    ModuleStatus status,
    String error,
    String reason,
    boolean fallbackUsed,
    int attempts,
    Map<String, Object> metrics,
    List<Prediction> predictions,
    Instant finishedAt
) {
    public ModuleOutcome {
        metrics = metrics == null ? Map.of() : java.util.Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        predictions = predictions == null ? List.of() : List.copyOf(predictions);
        finishedAt = finishedAt == null ? Instant.now() : finishedAt;
    }

    public static ModuleOutcome completed(String module, int attempts, boolean fallbackUsed,
                                          Map<String, Object> metrics, List<Prediction> predictions) {
        return new ModuleOutcome(module, ModuleStatus.COMPLETED, null, null, fallbackUsed, attempts,
                metrics, predictions, Instant.now());
    }

    public static ModuleOutcome skipped(String module, String reason) {
        return new ModuleOutcome(module, ModuleStatus.SKIPPED, null, reason, false, 0,
                null, null, Instant.now());
    }

    public static ModuleOutcome failed(String module, int attempts, boolean fallbackUsed, String error) {
        return new ModuleOutcome(module, ModuleStatus.FAILED, error, null, fallbackUsed, attempts,
                null, null, Instant.now());
    }

    public Optional<String> errorMessage() { return Optional.ofNullable(error); }

    public Optional<String> skipReason() { return Optional.ofNullable(reason); }

    public boolean isCompleted() { return status == ModuleStatus.COMPLETED; }
}
