package insights.util;

import insights.model.domain.CanonicalPost;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Silent substitutions shared by every adapter. None of these log: a default
 * applied here is expected, not an error.
 */
public final class Coercions {

    private static final Pattern HASHTAG = Pattern.compile("#\\w+", Pattern.UNICODE_CHARACTER_CLASS);
    public static final int MAX_HASHTAGS = 10;

    /** Fixed-width UTC instants, so stored values sort as text. */
    public static final DateTimeFormatter STORED_INSTANT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSSSSSX").withZone(ZoneOffset.UTC);

    /** Local date-time patterns tried in order after the caller's strict one. */
    private static final List<DateTimeFormatter> LENIENT_DATE_TIMES = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("M/d/yyyy H:mm"),
            DateTimeFormatter.ofPattern("M/d/yyyy H:mm:ss"),
            caseInsensitive("M/d/yyyy h:mm a"),
            caseInsensitive("MMM d, yyyy h:mm a")
    );

    private static final List<DateTimeFormatter> LENIENT_DATES = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("M/d/yyyy"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            caseInsensitive("MMM d, yyyy")
    );

    private Coercions() {}

    /**
     * Lenient integer: keeps digits, sign and decimal point, drops the rest
     * ("1,204" is 1204, "12.7" is 12). Blank, NaN and garbage become 0.
     */
    public static int safeInt(String value) {
        if (value == null) return 0;
        String s = value.trim();
        if (s.isEmpty() || s.equalsIgnoreCase("nan") || s.equalsIgnoreCase("null")) return 0;
        StringBuilder b = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isDigit(c) || c == '.' || c == '-') b.append(c);
        }
        if (b.length() == 0) return 0;
        try {
            double d = Double.parseDouble(b.toString());
            if (Double.isNaN(d) || Double.isInfinite(d)) return 0;
            if (d > Integer.MAX_VALUE) return Integer.MAX_VALUE;
            if (d < Integer.MIN_VALUE) return Integer.MIN_VALUE;
            return (int) d;
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /** {@link #safeInt} floored at zero. */
    public static int nonNegative(String value) {
        return Math.max(0, safeInt(value));
    }

    public static Optional<Instant> safeInstant(String value) {
        return safeInstant(value, null);
    }

    /**
     * Strict pattern first (may be null), then the lenient list. Local values
     * are read as UTC. Empty when nothing parses; callers drop the row.
     */
    public static Optional<Instant> safeInstant(String value, DateTimeFormatter strict) {
        String x = blankToNull(value);
        if (x == null || x.equalsIgnoreCase("nan")) return Optional.empty();

        if (strict != null) {
            Optional<Instant> hit = tryLocalDateTime(x, strict);
            if (hit.isPresent()) return hit;
        }

        if (x.matches("^\\d{13}$")) {
            try { return Optional.of(Instant.ofEpochMilli(Long.parseLong(x))); }
            catch (NumberFormatException ignore) { return Optional.empty(); }
        }
        if (x.matches("^\\d{10}$")) {
            try { return Optional.of(Instant.ofEpochSecond(Long.parseLong(x))); }
            catch (NumberFormatException ignore) { return Optional.empty(); }
        }

        try { return Optional.of(Instant.parse(x)); }
        catch (DateTimeParseException ignore) { /* next */ }
        try { return Optional.of(java.time.OffsetDateTime.parse(x).toInstant()); }
        catch (DateTimeParseException ignore) { /* next */ }

        for (DateTimeFormatter f : LENIENT_DATE_TIMES) {
            Optional<Instant> hit = tryLocalDateTime(x, f);
            if (hit.isPresent()) return hit;
        }
        for (DateTimeFormatter f : LENIENT_DATES) {
            try { return Optional.of(LocalDate.parse(x, f).atStartOfDay(ZoneOffset.UTC).toInstant()); }
            catch (DateTimeParseException ignore) { /* next */ }
        }
        return Optional.empty();
    }

    /** True when the text looks like a date the lenient parser would accept. */
    public static boolean isDateLike(String value) {
        return safeInstant(value).isPresent();
    }

    /**
     * "#token" words from the text, at most {@value #MAX_HASHTAGS}, space joined.
     * No tags gives {@link CanonicalPost#DEFAULT_HASHTAGS}.
     */
    public static String extractHashtags(String text) {
        if (text == null || text.isBlank()) return CanonicalPost.DEFAULT_HASHTAGS;
        List<String> tags = new ArrayList<>();
        Matcher m = HASHTAG.matcher(text);
        while (m.find() && tags.size() < MAX_HASHTAGS) tags.add(m.group());
        return tags.isEmpty() ? CanonicalPost.DEFAULT_HASHTAGS : String.join(" ", tags);
    }

    public static List<String> splitHashtags(String hashtags) {
        if (hashtags == null || hashtags.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        for (String t : hashtags.trim().split("\\s+")) {
            if (t.startsWith("#") && t.length() > 1) out.add(t.toLowerCase(Locale.ROOT));
        }
        return out;
    }

    public static String blankToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    /** First {@code max} code points; a surrogate pair is never split. */
    public static String truncate(String s, int max) {
        if (s == null) return "";
        if (s.codePointCount(0, s.length()) <= max) return s;
        return s.substring(0, s.offsetByCodePoints(0, max));
    }

    private static Optional<Instant> tryLocalDateTime(String x, DateTimeFormatter f) {
        try {
            return Optional.of(LocalDateTime.parse(x, f).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ignore) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter caseInsensitive(String pattern) {
        return new DateTimeFormatterBuilder().parseCaseInsensitive()
                .appendPattern(pattern).toFormatter(Locale.ENGLISH);
    }
}
