package insights.model.service.ingest;

import insights.model.domain.FormatVariant;

public record IngestionReport(String source, FormatVariant variant, int rowsRead, int recordsAdapted, int recordsSaved) {}
