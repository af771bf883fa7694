package insights.model.service.ingest;

import insights.model.domain.FormatVariant;

/** Every row of an import was empty or failed extraction. */
public class NoValidRecordsException extends RuntimeException {
    private final FormatVariant variant;
    private final int rowsSeen;

    public NoValidRecordsException(FormatVariant variant, int rowsSeen) {
        super("No valid records could be extracted from " + variant + " input (" + rowsSeen + " rows)");
        this.variant = variant;
        this.rowsSeen = rowsSeen;
    }

    public FormatVariant variant() { return variant; }
    public int rowsSeen() { return rowsSeen; }
}
