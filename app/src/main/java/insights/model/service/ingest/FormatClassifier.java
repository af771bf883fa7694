package insights.model.service.ingest;

import insights.model.domain.FormatVariant;
import insights.model.domain.RawImport;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Decides the export shape from column names only. Rules are evaluated top to
 * bottom and the first match wins, so their order is part of the contract.
 */
public final class FormatClassifier {

    public record Rule(String description, Predicate<Set<String>> matches, FormatVariant variant) {}

    private static final Set<String> INSTAGRAM_MARKERS = Set.of("post id", "account username", "permalink");
    private static final String FACEBOOK_MARKER = "3-second video views";

    private static final List<Rule> RULES = List.of(
            new Rule("instagram post export markers",
                    cols -> cols.stream().anyMatch(INSTAGRAM_MARKERS::contains),
                    FormatVariant.INSTAGRAM_POST_EXPORT),
            new Rule("facebook 3-second video views column",
                    cols -> cols.stream().anyMatch(c -> c.contains(FACEBOOK_MARKER)),
                    FormatVariant.FACEBOOK_VIDEO_EXPORT),
            new Rule("post_id and timestamp columns",
                    cols -> cols.contains("post_id") && cols.contains("timestamp"),
                    FormatVariant.STANDARD_SCHEMA)
    );

    public List<Rule> rules() { return RULES; }

    public FormatVariant classify(List<String> columns) {
        Set<String> normalized = new LinkedHashSet<>();
        if (columns != null) {
            for (String c : columns) normalized.add(RawImport.normalize(c));
        }
        for (Rule r : RULES) {
            if (r.matches().test(normalized)) return r.variant();
        }
        return FormatVariant.UNKNOWN;
    }

    public FormatVariant classify(RawImport raw) {
        return classify(raw.columns());
    }

    /** Like {@link #classify(RawImport)} but an unknown header is a hard failure. */
    public FormatVariant requireKnown(RawImport raw) {
        FormatVariant v = classify(raw);
        if (v == FormatVariant.UNKNOWN) throw new UnrecognizedFormatException(raw.columns());
        return v;
    }
}
