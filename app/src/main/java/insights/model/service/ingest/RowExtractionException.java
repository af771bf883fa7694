package insights.model.service.ingest;

/** One row could not be mapped. Adapters log it and move on. */
public class RowExtractionException extends RuntimeException {
    public RowExtractionException(String message) { super(message); }
}
