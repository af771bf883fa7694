package insights.model.service.ingest;

import java.util.List;

/** Header matched no known export shape. Carries the columns for manual mapping. */
public class UnrecognizedFormatException extends RuntimeException {
    private final List<String> columns;

    public UnrecognizedFormatException(List<String> columns) {
        super("Unrecognized export format, columns: " + columns);
        this.columns = List.copyOf(columns);
    }

    public List<String> columns() { return columns; }
}
