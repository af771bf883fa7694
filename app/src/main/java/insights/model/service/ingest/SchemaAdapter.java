package insights.model.service.ingest;

import insights.model.domain.CanonicalPost;
import insights.model.domain.FormatVariant;
import insights.model.domain.RawImport;

import java.util.List;

public interface SchemaAdapter {
    FormatVariant variant();

    /**
     * Maps rows to canonical posts. Bad rows are skipped; an empty result is
     * never returned, {@link NoValidRecordsException} is thrown instead.
     */
    List<CanonicalPost> adapt(RawImport raw);
}
