package insights.model.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable record of one orchestrator run. Outcomes are appended as stages
 * finish; the run is persisted once at the end.
 */
public final class PipelineRun {
    private final String id;
    private final Instant startedAt;
    private final List<ModuleOutcome> outcomes = new ArrayList<>();
    private Instant endedAt;
    private RunStatus status;
    private int recoveryAttempts;
    private int recordsProcessed;
    private String error;

    public PipelineRun(String id, Instant startedAt) {
        this.id = id;
        this.startedAt = startedAt;
    }

    public String id() { return id; }
    public Instant startedAt() { return startedAt; }
    public Instant endedAt() { return endedAt; }
    public RunStatus status() { return status; }
    public int recoveryAttempts() { return recoveryAttempts; }
    public int recordsProcessed() { return recordsProcessed; }
    public String error() { return error; }
    public List<ModuleOutcome> outcomes() { return Collections.unmodifiableList(outcomes); }

    public void append(ModuleOutcome outcome) { outcomes.add(outcome); }

    public void recoveryAttempts(int n) { this.recoveryAttempts = n; }
    public void recordsProcessed(int n) { this.recordsProcessed = n; }

    public void finish(RunStatus status, Instant endedAt, String error) {
        this.status = status;
        this.endedAt = endedAt;
        this.error = error;
    }

    public long count(ModuleStatus s) {
        return outcomes.stream().filter(o -> o.status() == s).count();
    }
}
