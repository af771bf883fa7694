package insights.model.service.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import insights.model.domain.ModuleOutcome;
import insights.model.domain.Prediction;
import insights.model.service.preprocess.PreparedDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs one stage with bounded retries. A failed attempt switches to the
 * stage's fallback, if it has one, for the remaining attempts. Never throws,
 * short of a {@link VirtualMachineError}.
 */
public class ModuleRunner {
    private static final Logger log = LoggerFactory.getLogger(ModuleRunner.class);

    public static final int DEFAULT_RETRY_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE = Duration.ofSeconds(2);

    private final Duration base;
    private final Sleeper sleeper;
    private final ObjectMapper om;

    public ModuleRunner(Duration base, Sleeper sleeper, ObjectMapper om) {
        this.base = base;
        this.sleeper = sleeper;
        this.om = om;
    }

    public ModuleRunner(ObjectMapper om) {
        this(DEFAULT_BASE, Sleeper.SYSTEM, om);
    }

    public ModuleOutcome run(StageDefinition stage, PreparedDataset data, int retryAttempts) {
        String name = stage.name();
        int max = Math.max(1, retryAttempts);

        Optional<String> unmet;
        try {
            unmet = stage.precondition().unmet(data);
        } catch (RuntimeException | LinkageError e) {
            unmet = Optional.of("precondition check failed: " + e.getMessage());
        }
        if (unmet.isPresent()) {
            log.info("Stage {} skipped: {}", name, unmet.get());
            return ModuleOutcome.skipped(name, unmet.get());
        }

        boolean onFallback = false;
        String lastError = null;
        for (int attempt = 1; attempt <= max; attempt++) {
            StageFunction fn = onFallback ? stage.fallback() : stage.primary();
            try {
                StageResult result = fn.apply(data);
                if (result == null) result = StageResult.metricsOnly(null);
                log.info("Stage {} completed on attempt {}{}", name, attempt, onFallback ? " (fallback)" : "");
                return ModuleOutcome.completed(name, attempt, onFallback, result.metrics(), predictions(name, result));
            } catch (StagePreconditionException e) {
                log.info("Stage {} skipped: {}", name, e.getMessage());
                return ModuleOutcome.skipped(name, e.getMessage());
            } catch (Exception | LinkageError | AssertionError e) {
                // a stage whose library is missing fails like any other stage
                lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
                log.warn("Stage {} attempt {}/{} failed: {}", name, attempt, max, lastError);
                if (!onFallback && stage.fallback() != null) onFallback = true;
                if (attempt < max) backoff(attempt);
            }
        }
        log.error("Stage {} failed after {} attempts: {}", name, max, lastError);
        return ModuleOutcome.failed(name, max, onFallback, lastError);
    }

    /** base^attempt seconds before the next attempt. */
    Duration backoffFor(int attempt) {
        double seconds = Math.pow(base.toMillis() / 1000.0, attempt);
        return Duration.ofMillis((long) (seconds * 1000));
    }

    private void backoff(int attempt) {
        Duration d = backoffFor(attempt);
        try {
            sleeper.sleep(d);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Backoff of {} interrupted, continuing", d);
        }
    }

    private List<Prediction> predictions(String module, StageResult result) {
        Instant now = Instant.now();
        List<Prediction> out = new ArrayList<>();
        for (StageResult.Payload p : result.payloads()) {
            out.add(new Prediction(module, p.predictionType(), p.body(), now));
        }
        if (out.isEmpty()) {
            JsonNode summary = om.valueToTree(result.metrics());
            out.add(new Prediction(module, module + "_summary", summary, now));
        }
        return out;
    }
}
