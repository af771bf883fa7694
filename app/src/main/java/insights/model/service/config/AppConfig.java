package insights.model.service.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.time.Duration;
import java.util.List;

public class AppConfig {
    public final Db db;
    public final Ingest ingest;
    public final Pipeline pipeline;
    public final List<String> stages;

    private AppConfig(Db db, Ingest ingest, Pipeline pipeline, List<String> stages) {
        this.db = db; this.ingest = ingest; this.pipeline = pipeline; this.stages = stages;
    }

    public static AppConfig load() {
        File f = new File("config/app.conf");
        Config root = f.exists() ? ConfigFactory.parseFile(f).withFallback(ConfigFactory.load()).resolve()
                                 : ConfigFactory.load(); // fallback classpath
        return from(root);
    }

    public static AppConfig from(Config root) {
        Config c = root.getConfig("insights");
        Config p = c.getConfig("pipeline");
        Config i = c.getConfig("ingest");
        return new AppConfig(
                new Db(c.getConfig("db").getString("path")),
                new Ingest(i.getString("directory"), i.getString("pattern")),
                new Pipeline(
                        p.getInt("retry-attempts"),
                        p.getDuration("retry-base"),
                        p.getInt("max-recovery-attempts"),
                        p.getDuration("recovery-base"),
                        p.getInt("sample-threshold"),
                        p.getLong("sample-seed")),
                c.getStringList("stages"));
    }

    public static class Db { public final String path; public Db(String p){ path = p; } }

    public static class Ingest {
        public final String directory, pattern;
        public Ingest(String d, String p){ directory = d; pattern = p; }
    }

    public static class Pipeline {
        public final int retryAttempts;
        public final Duration retryBase;
        public final int maxRecoveryAttempts;
        public final Duration recoveryBase;
        public final int sampleThreshold;
        public final long sampleSeed;
        public Pipeline(int retryAttempts, Duration retryBase, int maxRecoveryAttempts,
                        Duration recoveryBase, int sampleThreshold, long sampleSeed) {
            this.retryAttempts = retryAttempts; this.retryBase = retryBase;
            this.maxRecoveryAttempts = maxRecoveryAttempts; this.recoveryBase = recoveryBase;
            this.sampleThreshold = sampleThreshold; this.sampleSeed = sampleSeed;
        }
    }
}
