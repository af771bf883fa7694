package insights.model.service.ingest;

import insights.model.domain.CanonicalPost;
import insights.model.domain.FormatVariant;
import insights.model.domain.MediaType;
import insights.model.domain.RawImport;
import insights.util.Coercions;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Files already close to the canonical schema. Common column spellings are
 * mapped onto canonical names first ("Like Count" to likes, "Posted At" to
 * timestamp, ...).
 */
public class StandardSchemaAdapter extends AbstractRowAdapter {

    private static final Map<String, String> ALIASES = new LinkedHashMap<>();

    static {
        alias("timestamp", "date", "time", "publish_time", "created_at", "posted_at", "timestamp", "date_posted");
        alias("likes", "like", "likes", "like_count", "reactions", "favorites");
        alias("comments", "comment", "comments", "comment_count");
        alias("shares", "share", "shares", "share_count", "reshares");
        alias("impressions", "view", "views", "view_count", "impressions", "video_views");
        alias("reach", "reach", "people_reached", "unique_views");
        alias("follower_count", "follower", "followers", "follower_count", "follows", "subscribers");
        alias("saves", "save", "saves", "saved");
        alias("caption", "caption", "text", "description", "message", "copy", "content");
        alias("media_type", "type", "media_type", "post_type", "content_type", "asset_type");
        alias("post_id", "id", "post_id", "postid", "content_id");
        alias("permalink", "link", "permalink", "url", "post_link");
        alias("hashtags", "hashtags", "tags", "topics");
        alias("audience_gender", "audience_gender", "gender");
        alias("audience_age", "audience_age", "age", "age_group");
        alias("location", "location", "country", "city", "region");
    }

    private static void alias(String canonical, String... spellings) {
        for (String s : spellings) ALIASES.put(s, canonical);
    }

    /** Canonical name for a raw header, or the cleaned header itself when unmapped. */
    static String canonicalName(String header) {
        String clean = RawImport.normalize(header).replace(' ', '_').replace('-', '_');
        return ALIASES.getOrDefault(clean, clean);
    }

    @Override public FormatVariant variant() { return FormatVariant.STANDARD_SCHEMA; }

    /** Renames columns; the first column mapped to a canonical name wins. */
    @Override
    protected RawImport prepare(RawImport raw) {
        List<String> renamed = new ArrayList<>();
        List<String> seen = new ArrayList<>();
        for (String c : raw.columns()) {
            String name = canonicalName(c);
            renamed.add(seen.contains(name) ? c : name);
            seen.add(name);
        }
        List<List<String>> rows = new ArrayList<>();
        for (RawImport.Row r : raw.rows()) {
            List<String> cells = new ArrayList<>();
            for (int i = 0; i < renamed.size(); i++) cells.add(r.get(i));
            rows.add(cells);
        }
        return new RawImport(renamed, rows);
    }

    @Override
    protected Optional<CanonicalPost> mapRow(RawImport.Row row) {
        if (row.isBlank()) return Optional.empty();
        String stamp = Coercions.blankToNull(row.get("timestamp"));
        if (stamp == null) return Optional.empty();
        Instant ts = Coercions.safeInstant(stamp)
                .orElseThrow(() -> new RowExtractionException("unparseable timestamp '" + stamp + "'"));

        String postId = Coercions.blankToNull(row.get("post_id"));
        if (postId == null) postId = "post_" + row.position();

        String caption = Coercions.blankToNull(row.get("caption"));
        String hashtags = Coercions.blankToNull(row.get("hashtags"));
        if (hashtags == null || !hashtags.contains("#")) hashtags = Coercions.extractHashtags(caption);

        int impressions = Coercions.nonNegative(row.get("impressions"));
        int reach = Coercions.nonNegative(row.get("reach"));

        return Optional.of(CanonicalPost.builder()
                .postId(postId)
                .timestamp(ts)
                .caption(caption)
                .likes(Coercions.nonNegative(row.get("likes")))
                .comments(Coercions.nonNegative(row.get("comments")))
                .shares(Coercions.nonNegative(row.get("shares")))
                .saves(Coercions.nonNegative(row.get("saves")))
                .impressions(impressions)
                .reach(reach)
                .followerCount(Coercions.nonNegative(row.get("follower_count")))
                .audienceGender(row.get("audience_gender"))
                .audienceAge(row.get("audience_age"))
                .location(row.get("location"))
                .hashtags(hashtags)
                .mediaType(MediaType.fromLabel(row.get("media_type")))
                .build());
    }
}
