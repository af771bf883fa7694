package insights;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import insights.model.domain.ModuleOutcome;
import insights.model.repository.PostsRepo;
import insights.model.repository.PredictionsRepo;
import insights.model.repository.RunsRepo;
import insights.model.repository.SQLite;
import insights.model.service.analysis.AnalysisStages;
import insights.model.service.config.AppConfig;
import insights.model.service.ingest.IngestionReport;
import insights.model.service.ingest.IngestionService;
import insights.model.service.ingest.UnrecognizedFormatException;
import insights.model.service.pipeline.DataSource;
import insights.model.service.pipeline.ModuleRunner;
import insights.model.service.pipeline.PipelineService;
import insights.model.service.pipeline.RunSummary;
import insights.model.service.pipeline.Sleeper;
import insights.model.service.preprocess.DefaultPreprocessService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Usage:
 *   ingest &lt;file|dir&gt;
 *   run [--file path] [--sample N] [--retries N]
 *   history [--limit N]
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final SQLite db;

    Main(AppConfig cfg, ObjectMapper om) {
        this.cfg = cfg;
        this.om = om;
        this.db = new SQLite(cfg.db.path);
        db.migrate();
    }

    public static void main(String[] args) {
        if (args.length == 0) {
            System.err.println("usage: ingest <file|dir> | run [--file path] [--sample N] [--retries N] | history [--limit N]");
            System.exit(2);
        }
        ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        int code;
        try {
            Main app = new Main(AppConfig.load(), om);
            ObjectNode out = app.dispatch(args[0], args);
            System.out.println(om.writeValueAsString(out));
            code = out.path("ok").asBoolean(true) ? 0 : 1;
        } catch (Exception e) {
            log.debug("Command failed", e);
            System.out.println(errorJson(om, e).toPrettyString());
            code = 1;
        }
        System.exit(code);
    }

    static ObjectNode errorJson(ObjectMapper om, Exception e) {
        ObjectNode err = om.createObjectNode();
        err.put("ok", false);
        err.put("error", e.getMessage());
        if (e instanceof UnrecognizedFormatException) {
            ArrayNode cols = err.putArray("columns");
            ((UnrecognizedFormatException) e).columns().forEach(cols::add);
        }
        return err;
    }

    ObjectNode dispatch(String command, String[] args) {
        Map<String, String> m = parseArgs(args);
        return switch (command) {
            case "ingest" -> {
                if (args.length < 2) throw new IllegalArgumentException("ingest needs a file or directory");
                yield ingest(Path.of(args[1]));
            }
            case "run" -> run(m.get("--file"),
                    Integer.parseInt(m.getOrDefault("--sample", "0")),
                    Integer.parseInt(m.getOrDefault("--retries", String.valueOf(cfg.pipeline.retryAttempts))));
            case "history" -> history(Integer.parseInt(m.getOrDefault("--limit", "20")));
            default -> throw new IllegalArgumentException("Unknown command: " + command);
        };
    }

    ObjectNode ingest(Path target) {
        IngestionService ingestion = new IngestionService(new PostsRepo(db));
        ObjectNode out = om.createObjectNode();
        ArrayNode files = out.putArray("files");
        if (Files.isDirectory(target)) {
            IngestionService.DirectoryReport r = ingestion.ingestDirectory(target, cfg.ingest.pattern);
            r.ingested().forEach(rep -> files.add(report(rep)));
            ArrayNode failures = out.putArray("failures");
            r.failures().forEach(failures::add);
            out.put("ok", r.failures().isEmpty());
        } else {
            files.add(report(ingestion.ingest(target)));
            out.put("ok", true);
        }
        return out;
    }

    ObjectNode run(String file, int sample, int retries) {
        PostsRepo posts = new PostsRepo(db);
        DefaultPreprocessService preprocess =
                new DefaultPreprocessService(cfg.pipeline.sampleThreshold, cfg.pipeline.sampleSeed);
        PipelineService pipeline = new PipelineService(
                preprocess,
                AnalysisStages.enabled(om, cfg.stages),
                new ModuleRunner(cfg.pipeline.retryBase, Sleeper.SYSTEM, om),
                new RunsRepo(db, om),
                new PredictionsRepo(db, om),
                cfg.pipeline.maxRecoveryAttempts,
                cfg.pipeline.recoveryBase,
                Sleeper.SYSTEM);
        DataSource source = file == null
                ? DataSource.store(posts)
                : DataSource.file(Path.of(file), new IngestionService(posts));
        RunSummary s = pipeline.execute(source, sample, retries);
        ObjectNode out = summary(s);
        out.put("ok", "completed".equals(s.status()));
        return out;
    }

    ObjectNode history(int limit) {
        ObjectNode out = om.createObjectNode();
        ArrayNode rows = out.putArray("results");
        for (RunsRepo.ResultRow r : new RunsRepo(db, om).history(limit)) {
            ObjectNode n = rows.addObject();
            n.put("run_id", r.runId());
            n.put("module", r.module());
            n.put("status", r.status());
            n.put("error", r.error());
            n.put("timestamp", r.timestamp().toString());
        }
        out.put("ok", true);
        return out;
    }

    private ObjectNode report(IngestionReport r) {
        ObjectNode n = om.createObjectNode();
        n.put("source", r.source());
        n.put("variant", r.variant().name());
        n.put("rows_read", r.rowsRead());
        n.put("records_adapted", r.recordsAdapted());
        n.put("records_saved", r.recordsSaved());
        return n;
    }

    private ObjectNode summary(RunSummary s) {
        ObjectNode n = om.createObjectNode();
        n.put("run_id", s.runId());
        n.put("status", s.status());
        n.put("modules_executed", s.modulesExecuted());
        n.put("successful", s.successful());
        n.put("failed", s.failed());
        n.put("skipped", s.skipped());
        n.put("records_processed", s.recordsProcessed());
        n.put("duration_seconds", s.durationSeconds());
        n.put("recovery_attempts", s.recoveryAttempts());
        n.put("error", s.error());
        ArrayNode outcomes = n.putArray("outcomes");
        for (ModuleOutcome o : s.outcomes()) {
            ObjectNode on = outcomes.addObject();
            on.put("module", o.module());
            on.put("status", o.status().wireName());
            on.put("attempts", o.attempts());
            on.put("fallback_used", o.fallbackUsed());
            o.errorMessage().ifPresent(e -> on.put("error", e));
            o.skipReason().ifPresent(r -> on.put("reason", r));
            on.set("metrics", om.valueToTree(o.metrics()));
        }
        return n;
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String v = (i + 1 < args.length && !args[i + 1].startsWith("--")) ? args[++i] : "true";
                m.put(a, v);
            }
        }
        return m;
    }
}
