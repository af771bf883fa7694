package insights.model.service.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import insights.Fixtures;
import insights.model.domain.ModuleOutcome;
import insights.model.domain.ModuleStatus;
import insights.model.service.preprocess.PreparedDataset;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ModuleRunnerTest {

    private final ObjectMapper om = new ObjectMapper();
    private final List<Duration> sleeps = new ArrayList<>();
    private final ModuleRunner runner = new ModuleRunner(Duration.ofSeconds(2), sleeps::add, om);

    private final PreparedDataset data = new PreparedDataset(
            List.of(Fixtures.post("p1", "2025-01-01T10:00:00Z", 5)), 1, false);

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private static StageFunction failingTimes(int failures, AtomicInteger calls) {
        return d -> {
            if (calls.incrementAndGet() <= failures) throw new IllegalStateException("attempt " + calls.get());
            return StageResult.metricsOnly(Map.of("ok", true));
        };
    }

    @Test
    void succeedsOnThirdAttemptAfterTwoBackoffs() {
        AtomicInteger calls = new AtomicInteger();
        ModuleOutcome o = runner.run(StageDefinition.of("flaky", failingTimes(2, calls)), data, 3);

        assertThat(o.status()).isEqualTo(ModuleStatus.COMPLETED);
        assertThat(o.fallbackUsed()).isFalse();
        assertThat(o.attempts()).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
    }

    @Test
    void exhaustedRetriesFailWithTheLastError() {
        AtomicInteger calls = new AtomicInteger();
        ModuleOutcome o = runner.run(StageDefinition.of("broken", failingTimes(99, calls)), data, 3);

        assertThat(o.status()).isEqualTo(ModuleStatus.FAILED);
        assertThat(o.errorMessage()).hasValueSatisfying(e -> assertThat(e).contains("attempt 3"));
        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeps).hasSize(2);
        assertThat(o.predictions()).isEmpty();
    }

    @Test
    void unmetPreconditionSkipsWithoutAttempting() {
        AtomicInteger calls = new AtomicInteger();
        StageDefinition stage = new StageDefinition("needs_history", failingTimes(0, calls), null,
                d -> Optional.of("insufficient history"));

        ModuleOutcome o = runner.run(stage, data, 3);

        assertThat(o.status()).isEqualTo(ModuleStatus.SKIPPED);
        assertThat(o.skipReason()).contains("insufficient history");
        assertThat(o.attempts()).isZero();
        assertThat(calls.get()).isZero();
        assertThat(sleeps).isEmpty();
    }

    @Test
    void preconditionThrownFromInsideTheStageIsASkip() {
        StageDefinition stage = StageDefinition.of("late_check", d -> {
            throw new StagePreconditionException("missing column reach");
        });

        ModuleOutcome o = runner.run(stage, data, 3);

        assertThat(o.status()).isEqualTo(ModuleStatus.SKIPPED);
        assertThat(o.skipReason()).contains("missing column reach");
        assertThat(sleeps).isEmpty();
    }

    @Test
    void fallbackRunsAfterPrimaryFails() {
        AtomicInteger primaryCalls = new AtomicInteger();
        AtomicInteger fallbackCalls = new AtomicInteger();
        StageDefinition stage = new StageDefinition("forecast",
                failingTimes(99, primaryCalls),
                failingTimes(0, fallbackCalls),
                null);

        ModuleOutcome o = runner.run(stage, data, 3);

        assertThat(o.status()).isEqualTo(ModuleStatus.COMPLETED);
        assertThat(o.fallbackUsed()).isTrue();
        assertThat(o.attempts()).isEqualTo(2);
        assertThat(primaryCalls.get()).isEqualTo(1);
        assertThat(fallbackCalls.get()).isEqualTo(1);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2));
    }

    @Test
    void failingFallbackReportsFallbackUsed() {
        StageDefinition stage = new StageDefinition("forecast",
                failingTimes(99, new AtomicInteger()),
                failingTimes(99, new AtomicInteger()),
                null);

        ModuleOutcome o = runner.run(stage, data, 2);

        assertThat(o.status()).isEqualTo(ModuleStatus.FAILED);
        assertThat(o.fallbackUsed()).isTrue();
    }

    @Test
    void stageWithoutPayloadGetsASummaryPrediction() {
        ModuleOutcome o = runner.run(StageDefinition.of("plain", failingTimes(0, new AtomicInteger())), data, 1);

        assertThat(o.predictions()).hasSize(1);
        assertThat(o.predictions().get(0).predictionType()).isEqualTo("plain_summary");
        assertThat(o.predictions().get(0).payload().get("ok").asBoolean()).isTrue();
    }

    @Test
    void interruptedBackoffStillContinues() {
        ModuleRunner interrupting = new ModuleRunner(Duration.ofSeconds(2), d -> {
            throw new InterruptedException();
        }, om);
        AtomicInteger calls = new AtomicInteger();

        ModuleOutcome o = interrupting.run(StageDefinition.of("flaky", failingTimes(1, calls)), data, 3);

        assertThat(o.status()).isEqualTo(ModuleStatus.COMPLETED);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void missingLibraryFailsTheStageInsteadOfEscaping() {
        AtomicInteger calls = new AtomicInteger();
        StageDefinition stage = StageDefinition.of("forecast", d -> {
            calls.incrementAndGet();
            throw new NoClassDefFoundError("org/ml/Forecaster");
        });

        ModuleOutcome o = runner.run(stage, data, 2);

        assertThat(o.status()).isEqualTo(ModuleStatus.FAILED);
        assertThat(o.errorMessage()).hasValueSatisfying(e -> assertThat(e).contains("org/ml/Forecaster"));
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void backoffGrowsExponentially() {
        assertThat(runner.backoffFor(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(runner.backoffFor(3)).isEqualTo(Duration.ofSeconds(8));
    }
}
