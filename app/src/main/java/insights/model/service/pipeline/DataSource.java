package insights.model.service.pipeline;

import insights.model.domain.CanonicalPost;
import insights.model.repository.CanonicalStore;
import insights.model.service.ingest.IngestionService;

import java.nio.file.Path;
import java.util.List;

/** Where a run's posts come from. */
@FunctionalInterface
public interface DataSource {
    List<CanonicalPost> load();

    default String describe() { return getClass().getSimpleName(); }

    static DataSource store(CanonicalStore store) {
        return new DataSource() {
            @Override public List<CanonicalPost> load() { return store.load(); }
            @Override public String describe() { return "store"; }
        };
    }

    /** Reads and canonicalizes a file on every load without storing it. */
    static DataSource file(Path file, IngestionService ingestion) {
        return new DataSource() {
            @Override public List<CanonicalPost> load() { return ingestion.canonicalize(file); }
            @Override public String describe() { return "file:" + file; }
        };
    }
}
