package insights.model.service.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import insights.Fixtures;
import insights.model.domain.CanonicalPost;
import insights.model.domain.PipelineState;
import insights.model.repository.PredictionsRepo;
import insights.model.repository.RunsRepo;
import insights.model.repository.SQLite;
import insights.model.service.preprocess.DefaultPreprocessService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineServiceTest {

    @TempDir
    Path dir;

    private final ObjectMapper om = new ObjectMapper();
    private final List<Duration> sleeps = new ArrayList<>();
    private RunsRepo runs;
    private PredictionsRepo predictions;

    private final List<CanonicalPost> posts = List.of(
            Fixtures.post("a", "2025-01-06T10:00:00Z", 10),
            Fixtures.post("b", "2025-01-07T11:00:00Z", 20),
            Fixtures.post("c", "2025-01-08T12:00:00Z", 30));

    @BeforeEach
    void setUp() {
        SQLite db = new SQLite(dir.resolve("pipeline.db").toString());
        db.migrate();
        runs = new RunsRepo(db, om);
        predictions = new PredictionsRepo(db, om);
    }

    private static StageDefinition ok(String name) {
        return StageDefinition.of(name, d -> StageResult.metricsOnly(Map.of("rows", d.size())));
    }

    private PipelineService service(StageCatalog catalog, int maxRecovery) {
        return new PipelineService(
                new DefaultPreprocessService(),
                catalog,
                new ModuleRunner(Duration.ofSeconds(2), d -> {}, om),
                runs,
                predictions,
                maxRecovery,
                Duration.ofSeconds(5),
                sleeps::add);
    }

    @Test
    void oneFailingStageIsIsolatedFromItsSiblings() {
        StageCatalog catalog = StageCatalog.builder()
                .register(ok("first"))
                .register(StageDefinition.of("broken", d -> { throw new IllegalStateException("always"); }))
                .register(ok("third"))
                .build();
        PipelineService svc = service(catalog, 2);

        RunSummary s = svc.execute(() -> posts, 0, 3);

        assertThat(s.status()).isEqualTo("completed");
        assertThat(s.modulesExecuted()).isEqualTo(3);
        assertThat(s.successful()).isEqualTo(2);
        assertThat(s.failed()).isEqualTo(1);
        assertThat(s.skipped()).isZero();
        assertThat(s.recordsProcessed()).isEqualTo(3);
        assertThat(s.recoveryAttempts()).isZero();
        assertThat(svc.state()).isEqualTo(PipelineState.DONE);

        assertThat(runs.resultsFor(s.runId())).hasSize(3);
        assertThat(predictions.count()).isEqualTo(2);
        assertThat(runs.statusOf(s.runId())).isEqualTo("completed");
    }

    @Test
    void stageWithMissingLibraryDoesNotStopItsSibling() {
        StageCatalog catalog = StageCatalog.builder()
                .register(StageDefinition.of("forecast", d -> { throw new NoClassDefFoundError("org/ml/Forecaster"); }))
                .register(ok("sibling"))
                .build();
        PipelineService svc = service(catalog, 0);

        RunSummary s = svc.execute(() -> posts, 0, 1);

        assertThat(s.status()).isEqualTo("completed");
        assertThat(s.successful()).isEqualTo(1);
        assertThat(s.failed()).isEqualTo(1);
        assertThat(svc.state()).isEqualTo(PipelineState.DONE);
        assertThat(runs.resultsFor(s.runId())).extracting(RunsRepo.ResultRow::module)
                .containsExactly("forecast", "sibling");
    }

    @Test
    void loadingThatAlwaysFailsExhaustsRecovery() {
        PipelineService svc = service(StageCatalog.builder().register(ok("only")).build(), 2);
        AtomicInteger loads = new AtomicInteger();

        RunSummary s = svc.execute(() -> {
            loads.incrementAndGet();
            throw new IllegalStateException("database locked");
        }, 0, 3);

        assertThat(s.status()).isEqualTo("failed");
        assertThat(s.recoveryAttempts()).isEqualTo(2);
        assertThat(s.error()).contains("database locked");
        assertThat(s.modulesExecuted()).isZero();
        assertThat(loads.get()).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(5), Duration.ofSeconds(10));
        assertThat(svc.state()).isEqualTo(PipelineState.FAILED);
        assertThat(runs.statusOf(s.runId())).isEqualTo("failed");
    }

    @Test
    void transientLoadFailureRecovers() {
        PipelineService svc = service(StageCatalog.builder().register(ok("only")).build(), 2);
        AtomicInteger loads = new AtomicInteger();

        RunSummary s = svc.execute(() -> {
            if (loads.incrementAndGet() == 1) throw new IllegalStateException("busy");
            return posts;
        }, 0, 3);

        assertThat(s.status()).isEqualTo("completed");
        assertThat(s.recoveryAttempts()).isEqualTo(1);
        assertThat(s.successful()).isEqualTo(1);
        assertThat(s.error()).isNull();
    }

    @Test
    void emptyDatasetIsAFatalRunError() {
        PipelineService svc = service(StageCatalog.builder().register(ok("only")).build(), 1);

        RunSummary s = svc.execute(List::of, 0, 3);

        assertThat(s.status()).isEqualTo("failed");
        assertThat(s.recoveryAttempts()).isEqualTo(1);
        assertThat(s.error()).contains("PREPROCESSING");
    }

    @Test
    void worstCaseBoundCountsEveryLayer() {
        StageCatalog catalog = StageCatalog.builder().register(ok("a")).register(ok("b")).register(ok("c")).build();
        assertThat(service(catalog, 2).worstCaseAttempts(3)).isEqualTo(27);
    }
}
