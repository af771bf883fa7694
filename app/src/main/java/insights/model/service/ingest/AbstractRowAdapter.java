package insights.model.service.ingest;

import insights.model.domain.CanonicalPost;
import insights.model.domain.RawImport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Partial-success loop shared by the adapters: each row maps independently,
 * failures are logged and skipped, and only an empty result is fatal.
 */
abstract class AbstractRowAdapter implements SchemaAdapter {

    private static final Logger log = LoggerFactory.getLogger(AbstractRowAdapter.class);
    private static final int DETAILED_ERRORS = 5;

    static final Instant FOLLOWER_BASELINE = Instant.parse("2019-01-01T00:00:00Z");

    @Override
    public List<CanonicalPost> adapt(RawImport raw) {
        if (raw == null || raw.isEmpty()) {
            throw new NoValidRecordsException(variant(), 0);
        }
        RawImport data = prepare(raw);

        List<CanonicalPost> out = new ArrayList<>();
        int errors = 0;
        int dropped = 0;
        for (RawImport.Row row : data.rows()) {
            try {
                Optional<CanonicalPost> post = mapRow(row);
                if (post.isPresent()) out.add(post.get());
                else dropped++;
            } catch (RuntimeException e) {
                errors++;
                if (errors <= DETAILED_ERRORS) {
                    log.warn("{}: row {} skipped: {}", variant(), row.position(), e.getMessage());
                }
            }
        }
        if (errors > 0 || dropped > 0) {
            log.warn("{}: {} rows failed, {} rows dropped, {} records extracted",
                    variant(), errors, dropped, out.size());
        }
        if (out.isEmpty()) {
            throw new NoValidRecordsException(variant(), raw.size());
        }
        log.info("{}: converted {} rows to canonical posts", variant(), out.size());
        return out;
    }

    /** Hook for format-level cleanup before rows are mapped. */
    protected RawImport prepare(RawImport raw) { return raw; }

    /** Empty means the row carries no usable post (blank or undated). */
    protected abstract Optional<CanonicalPost> mapRow(RawImport.Row row);

    static long daysSinceBaseline(Instant ts) {
        return ChronoUnit.DAYS.between(FOLLOWER_BASELINE, ts);
    }

    static int clampToInt(long v) {
        if (v > Integer.MAX_VALUE) return Integer.MAX_VALUE;
        return (int) Math.max(0, v);
    }
}
