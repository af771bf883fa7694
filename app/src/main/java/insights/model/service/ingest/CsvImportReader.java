package insights.model.service.ingest;

import insights.model.domain.RawImport;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads a delimited export into a {@link RawImport}. Exports often carry a few
 * title lines above the real header, so the header line is located first.
 */
public class CsvImportReader {

    private static final Logger log = LoggerFactory.getLogger(CsvImportReader.class);

    private static final int HEADER_SCAN_LINES = 15;
    private static final List<String> HEADER_KEYWORDS = List.of(
            "row labels", "post id", "timestamp", "date", "permalink",
            "3-second video views", "impressions", "reach", "engagements");

    private final CSVFormat format = CSVFormat.DEFAULT.builder()
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .build();

    public RawImport read(Path file) {
        try {
            return parse(decode(Files.readAllBytes(file), file));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
    }

    public RawImport parse(String content) {
        String text = content.startsWith("\uFEFF") ? content.substring(1) : content;
        List<String> lines = text.lines().toList();
        int headerLine = findHeaderLine(lines.subList(0, Math.min(HEADER_SCAN_LINES, lines.size())));
        String body = String.join("\n", lines.subList(Math.min(headerLine, lines.size()), lines.size()));

        List<String> header = new ArrayList<>();
        List<List<String>> rows = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(new StringReader(body), format)) {
            for (CSVRecord rec : parser) {
                List<String> cells = new ArrayList<>(rec.size());
                rec.forEach(cells::add);
                if (header.isEmpty() && rows.isEmpty()) header.addAll(cells);
                else rows.add(cells);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed delimited input", e);
        }
        log.debug("Parsed {} rows with {} columns (header line {})", rows.size(), header.size(), headerLine);
        return new RawImport(header, rows);
    }

    /**
     * Index of the likely header line: one naming "row labels" or "post id",
     * or a wide line (more than 3 commas) with two header keywords. Defaults to 0.
     */
    static int findHeaderLine(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            String lower = lines.get(i).toLowerCase(Locale.ROOT);
            long matches = HEADER_KEYWORDS.stream().filter(lower::contains).count();
            if (matches == 0) continue;
            if (lower.contains("row labels") || lower.contains("post id")) return i;
            if (lines.get(i).chars().filter(c -> c == ',').count() > 3 && matches >= 2) return i;
        }
        return 0;
    }

    /** Strict UTF-8, falling back to ISO-8859-1 for legacy spreadsheet exports. */
    private static String decode(byte[] bytes, Path file) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            log.warn("{} is not valid UTF-8, reading as ISO-8859-1", file.getFileName());
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }
}
