package insights.model.service.ingest;

import insights.model.domain.CanonicalPost;
import insights.model.domain.FormatVariant;
import insights.model.domain.RawImport;
import insights.model.repository.CanonicalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Ingestion path: read, classify by header, adapt to canonical posts and
 * store them. Nothing is written when classification or extraction fails.
 */
public class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final CsvImportReader reader;
    private final FormatClassifier classifier;
    private final SchemaAdapters adapters;
    private final CanonicalStore store;

    public IngestionService(CsvImportReader reader, FormatClassifier classifier,
                            SchemaAdapters adapters, CanonicalStore store) {
        this.reader = reader;
        this.classifier = classifier;
        this.adapters = adapters;
        this.store = store;
    }

    public IngestionService(CanonicalStore store) {
        this(new CsvImportReader(), new FormatClassifier(), SchemaAdapters.defaults(), store);
    }

    /** Reads and canonicalizes a file without storing it. */
    public List<CanonicalPost> canonicalize(Path file) {
        return canonicalize(reader.read(file));
    }

    public List<CanonicalPost> canonicalize(RawImport raw) {
        FormatVariant variant = classifier.requireKnown(raw);
        return adapters.forVariant(variant).adapt(raw);
    }

    public IngestionReport ingest(Path file) {
        RawImport raw = reader.read(file);
        FormatVariant variant = classifier.requireKnown(raw);
        log.info("{} classified as {} ({} rows)", file.getFileName(), variant, raw.size());

        List<CanonicalPost> posts = adapters.forVariant(variant).adapt(raw);
        int saved = store.save(posts);
        log.info("{}: {} records adapted, {} new", file.getFileName(), posts.size(), saved);
        return new IngestionReport(file.toString(), variant, raw.size(), posts.size(), saved);
    }

    public static record DirectoryReport(List<IngestionReport> ingested, List<String> failures) {
        public int recordsSaved() {
            return ingested.stream().mapToInt(IngestionReport::recordsSaved).sum();
        }
    }

    /** Every matching file in {@code dir}; a failing file is logged and the rest continue. */
    public DirectoryReport ingestDirectory(Path dir, String glob) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, glob)) {
            for (Path p : ds) if (Files.isRegularFile(p)) files.add(p);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + dir, e);
        }
        files.sort(null);

        List<IngestionReport> ok = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (Path f : files) {
            try {
                ok.add(ingest(f));
            } catch (RuntimeException e) {
                log.error("Skipping {}: {}", f.getFileName(), e.getMessage());
                failures.add(f.getFileName() + ": " + e.getMessage());
            }
        }
        log.info("Directory {}: {} files ingested, {} failed", dir, ok.size(), failures.size());
        return new DirectoryReport(ok, failures);
    }

    public DirectoryReport ingestDirectory(Path dir) {
        return ingestDirectory(dir, "*.csv");
    }
}
