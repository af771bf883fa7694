package insights.model.service.pipeline;

import insights.model.domain.CanonicalPost;
import insights.model.domain.ModuleOutcome;
import insights.model.domain.PipelineRun;
import insights.model.domain.PipelineState;
import insights.model.domain.Prediction;
import insights.model.domain.RunStatus;
import insights.model.repository.PredictionsRepo;
import insights.model.repository.RunsRepo;
import insights.model.service.preprocess.PreparedDataset;
import insights.model.service.preprocess.PreprocessService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Analysis run:
 *  1) load posts from the data source
 *  2) preprocess (ids, sampling)
 *  3) run every catalog stage through {@link ModuleRunner}
 *  4) persist run header, outcomes and predictions
 *
 * Failures in 1) and 2) restart the run from loading, up to
 * {@code maxRecoveryAttempts} times. Stage retries are counted separately by
 * the runner.
 */
public class PipelineService {
    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    public static final int DEFAULT_MAX_RECOVERY = 2;
    public static final Duration DEFAULT_RECOVERY_BASE = Duration.ofSeconds(5);

    private final PreprocessService preprocess;
    private final StageCatalog catalog;
    private final ModuleRunner runner;
    private final RunsRepo runsRepo;
    private final PredictionsRepo predictionsRepo;
    private final int maxRecoveryAttempts;
    private final Duration recoveryBase;
    private final Sleeper sleeper;

    private volatile PipelineState state = PipelineState.INIT;

    public PipelineService(PreprocessService preprocess,
                           StageCatalog catalog,
                           ModuleRunner runner,
                           RunsRepo runsRepo,
                           PredictionsRepo predictionsRepo,
                           int maxRecoveryAttempts,
                           Duration recoveryBase,
                           Sleeper sleeper) {
        this.preprocess = preprocess;
        this.catalog = catalog;
        this.runner = runner;
        this.runsRepo = runsRepo;
        this.predictionsRepo = predictionsRepo;
        this.maxRecoveryAttempts = Math.max(0, maxRecoveryAttempts);
        this.recoveryBase = recoveryBase;
        this.sleeper = sleeper;
    }

    public PipelineState state() { return state; }

    /** Upper bound on stage invocations for one call of {@link #execute}. */
    public long worstCaseAttempts(int retryAttempts) {
        return (long) (maxRecoveryAttempts + 1) * catalog.size() * Math.max(1, retryAttempts);
    }

    public RunSummary execute(DataSource source, int sampleSize, int retryAttempts) {
        PipelineRun run = new PipelineRun("run_" + UUID.randomUUID(), Instant.now());
        state = PipelineState.INIT;
        log.info("Run {} started: source={}, stages={}, worst case {} stage attempts",
                run.id(), source.describe(), catalog.names(), worstCaseAttempts(retryAttempts));

        PreparedDataset data = null;
        String fatal = null;
        int recovery = 0;
        while (true) {
            try {
                data = loadAndPrepare(source, sampleSize);
                break;
            } catch (PipelineException e) {
                fatal = e.getMessage();
                if (recovery >= maxRecoveryAttempts) {
                    log.error("Run {} giving up after {} recovery attempts: {}", run.id(), recovery, fatal);
                    break;
                }
                recovery++;
                run.recoveryAttempts(recovery);
                Duration wait = recoveryBase.multipliedBy(recovery);
                log.warn("Run {} {}; restarting from LOADING in {} (recovery {}/{})",
                        run.id(), fatal, wait, recovery, maxRecoveryAttempts);
                pause(wait);
            }
        }

        if (data == null) {
            run.finish(RunStatus.FAILED, Instant.now(), fatal);
            persist(run, sampleSize, retryAttempts);
            state = PipelineState.FAILED;
            return RunSummary.of(run);
        }

        run.recordsProcessed(data.size());
        state = PipelineState.RUNNING_MODULES;
        for (StageDefinition stage : catalog.stages()) {
            run.append(runner.run(stage, data, retryAttempts));
        }
        run.finish(RunStatus.COMPLETED, Instant.now(), null);

        persist(run, sampleSize, retryAttempts);
        state = PipelineState.DONE;

        RunSummary summary = RunSummary.of(run);
        log.info("Run {} done in {}s: {} completed, {} failed, {} skipped",
                run.id(), summary.durationSeconds(), summary.successful(), summary.failed(), summary.skipped());
        return summary;
    }

    private PreparedDataset loadAndPrepare(DataSource source, int sampleSize) {
        List<CanonicalPost> posts;
        state = PipelineState.LOADING;
        try {
            posts = source.load();
        } catch (RuntimeException e) {
            throw new PipelineException(PipelineState.LOADING, e);
        }
        state = PipelineState.PREPROCESSING;
        try {
            return preprocess.prepare(posts, sampleSize);
        } catch (RuntimeException e) {
            throw new PipelineException(PipelineState.PREPROCESSING, e);
        }
    }

    /** Best effort: a storage failure is logged and the in-memory summary stands. */
    private void persist(PipelineRun run, int sampleSize, int retryAttempts) {
        state = PipelineState.PERSISTING;
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("sampleSize", sampleSize);
        params.put("retryAttempts", retryAttempts);
        params.put("maxRecoveryAttempts", maxRecoveryAttempts);
        params.put("stages", catalog.names());
        try {
            runsRepo.saveRun(run, params);
        } catch (RuntimeException e) {
            log.error("Run {}: saving run results failed: {}", run.id(), e.getMessage());
        }

        List<Prediction> predictions = new ArrayList<>();
        for (ModuleOutcome o : run.outcomes()) {
            if (o.isCompleted()) predictions.addAll(o.predictions());
        }
        if (predictions.isEmpty()) return;
        try {
            predictionsRepo.saveAll(predictions);
        } catch (RuntimeException e) {
            log.error("Run {}: saving {} predictions failed: {}", run.id(), predictions.size(), e.getMessage());
        }
    }

    private void pause(Duration d) {
        try {
            sleeper.sleep(d);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Recovery backoff interrupted, continuing");
        }
    }
}
