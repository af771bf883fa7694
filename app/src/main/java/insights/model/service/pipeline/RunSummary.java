package insights.model.service.pipeline;

import insights.model.domain.ModuleOutcome;
import insights.model.domain.ModuleStatus;
import insights.model.domain.PipelineRun;

import java.time.Duration;
import java.util.List;

public record RunSummary(
    String runId,
    String status,
    int modulesExecuted,
    int successful,
    int failed,
    int skipped,
    int recordsProcessed,
    double durationSeconds,
    int recoveryAttempts,
    String error,
    List<ModuleOutcome> outcomes
) {
    static RunSummary of(PipelineRun run) {
        Duration d = Duration.between(run.startedAt(), run.endedAt());
        return new RunSummary(
                run.id(),
                run.status().wireName(),
                run.outcomes().size(),
                (int) run.count(ModuleStatus.COMPLETED),
                (int) run.count(ModuleStatus.FAILED),
                (int) run.count(ModuleStatus.SKIPPED),
                run.recordsProcessed(),
                d.toMillis() / 1000.0,
                run.recoveryAttempts(),
                run.error(),
                List.copyOf(run.outcomes()));
    }
}
