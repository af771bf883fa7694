package insights.model.service.ingest;

import insights.model.domain.CanonicalPost;
import insights.model.domain.FormatVariant;
import insights.model.domain.MediaType;
import insights.model.domain.RawImport;
import insights.util.Coercions;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Facebook/Instagram video pivot export: one row per day, "Sum of ..." metric
 * columns and demographic breakdown columns such as "(F, 25-34)".
 */
public class FacebookVideoAdapter extends AbstractRowAdapter {

    private static final DateTimeFormatter CAPTION_DATE =
            DateTimeFormatter.ofPattern("MMMM dd, yyyy 'at' hh:mm a", Locale.ENGLISH).withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter MONTH =
            DateTimeFormatter.ofPattern("MMMM", Locale.ENGLISH).withZone(ZoneOffset.UTC);

    private static final int BASE_FOLLOWERS = 8_000;
    private static final int HEADER_SCAN_ROWS = 5;
    private static final double DOMINANCE = 1.2;

    static final List<String> AGE_BUCKETS = List.of("18-24", "25-34", "35-44", "45-54", "55-64", "65+");
    static final String DEFAULT_AGE = "25-34";

    @Override public FormatVariant variant() { return FormatVariant.FACEBOOK_VIDEO_EXPORT; }

    /** Strips title rows above the first dated row, "Grand Total" rows and blank rows. */
    @Override
    protected RawImport prepare(RawImport raw) {
        RawImport data = raw;
        if (hasLabelRow(raw.row(0))) {
            int limit = Math.min(HEADER_SCAN_ROWS, raw.size());
            for (int i = 0; i < limit; i++) {
                String first = raw.row(i).get(0);
                if (first != null && !first.isBlank() && Coercions.isDateLike(first)) {
                    data = raw.dropLeadingRows(i);
                    break;
                }
            }
        }

        List<List<String>> kept = new ArrayList<>();
        for (RawImport.Row row : data.rows()) {
            if (row.isBlank()) continue;
            String first = row.get(0);
            if (first != null && first.toLowerCase(Locale.ROOT).contains("grand total")) continue;
            List<String> cells = new ArrayList<>();
            for (int i = 0; i < data.columns().size(); i++) cells.add(row.get(i));
            kept.add(cells);
        }
        if (kept.isEmpty()) throw new NoValidRecordsException(variant(), raw.size());
        return new RawImport(data.columns(), kept);
    }

    @Override
    protected Optional<CanonicalPost> mapRow(RawImport.Row row) {
        String date = Coercions.blankToNull(row.get(0));
        if (date == null) return Optional.empty();
        Optional<Instant> ts = Coercions.safeInstant(date);
        if (ts.isEmpty()) return Optional.empty();
        Instant timestamp = ts.get();

        int views3s = Coercions.nonNegative(metric(row, "3-second video views"));
        int views1m = Coercions.nonNegative(metric(row, "1-minute video views"));
        int reactions = Coercions.nonNegative(metric(row, "reactions"));
        int comments = Coercions.nonNegative(metric(row, "comments"));
        int shares = Coercions.nonNegative(metric(row, "shares"));

        int impressions = Math.max(views3s, 100);
        int reach = (int) (impressions * 0.75);
        MediaType media = (views1m > 0 || views3s > 20) ? MediaType.VIDEO : MediaType.IMAGE;
        long followers = BASE_FOLLOWERS + 2L * daysSinceBaseline(timestamp);

        return Optional.of(CanonicalPost.builder()
                .postId(String.format("fb_post_%04d", row.position()))
                .timestamp(timestamp)
                .caption("Post from " + CAPTION_DATE.format(timestamp))
                .likes(reactions)
                .comments(comments)
                .shares(shares)
                .saves(clampToInt((long) ((reactions + (long) comments + shares) * 0.1)))
                .impressions(impressions)
                .reach(reach)
                .followerCount(clampToInt(followers))
                .audienceGender(dominantGender(row))
                .audienceAge(dominantAge(row))
                .location(dominantLocation(row))
                .hashtags(generatedHashtags(media, timestamp))
                .mediaType(media)
                .build());
    }

    static String dominantGender(RawImport.Row row) {
        long male = sumColumns(row, "(M,");
        long female = sumColumns(row, "(F,");
        if (male > female * DOMINANCE) return "Male";
        if (female > male * DOMINANCE) return "Female";
        return CanonicalPost.DEFAULT_GENDER;
    }

    static String dominantAge(RawImport.Row row) {
        String best = null;
        long bestSum = 0;
        for (String bucket : AGE_BUCKETS) {
            long sum = sumColumns(row, bucket);
            if (sum > bestSum) {
                best = bucket;
                bestSum = sum;
            }
        }
        return best == null ? DEFAULT_AGE : best;
    }

    static String dominantLocation(RawImport.Row row) {
        Map<String, Long> byCountry = new LinkedHashMap<>();
        List<String> cols = row.columns();
        for (int i = 0; i < cols.size(); i++) {
            String name = cols.get(i) == null ? "" : cols.get(i);
            if (!name.toLowerCase(Locale.ROOT).contains("country")) continue;
            String country = null;
            if (name.contains("India") || name.contains("IN")) country = "India";
            else if (name.contains("US") || name.contains("United States")) country = "United States";
            if (country != null) byCountry.merge(country, (long) Coercions.nonNegative(row.get(i)), Long::sum);
        }
        return byCountry.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(CanonicalPost.DEFAULT_LOCATION);
    }

    static String generatedHashtags(MediaType media, Instant ts) {
        List<String> tags = new ArrayList<>(List.of("#socialmedia", "#digital", "#content"));
        switch (media) {
            case VIDEO -> tags.addAll(List.of("#video", "#reel", "#viral"));
            case CAROUSEL -> tags.addAll(List.of("#carousel", "#gallery"));
            default -> tags.addAll(List.of("#photo", "#instagram"));
        }
        tags.add("#" + MONTH.format(ts).toLowerCase(Locale.ROOT));
        return String.join(" ", tags.subList(0, Math.min(8, tags.size())));
    }

    /** Prefers the pivot's "Sum of X" column, then any column containing X. */
    private static String metric(RawImport.Row row, String marker) {
        String exact = row.find("sum of " + marker);
        return exact != null ? exact : row.find(marker);
    }

    private static long sumColumns(RawImport.Row row, String marker) {
        long sum = 0;
        List<String> cols = row.columns();
        for (int i = 0; i < cols.size(); i++) {
            String name = cols.get(i);
            if (name != null && name.contains(marker)) sum += Coercions.nonNegative(row.get(i));
        }
        return sum;
    }

    private static boolean hasLabelRow(RawImport.Row first) {
        for (int i = 0; i < first.columns().size(); i++) {
            String c = first.get(i);
            if (c == null) continue;
            String l = c.toLowerCase(Locale.ROOT);
            if (l.contains("title") || l.contains("row labels")) return true;
        }
        return false;
    }
}
