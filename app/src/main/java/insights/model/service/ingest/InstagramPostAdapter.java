package insights.model.service.ingest;

import insights.model.domain.CanonicalPost;
import insights.model.domain.FormatVariant;
import insights.model.domain.MediaType;
import insights.model.domain.RawImport;
import insights.util.Coercions;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;

/** Instagram post-level export ("Post ID", "Publish time", "Views", ...). */
public class InstagramPostAdapter extends AbstractRowAdapter {

    static final DateTimeFormatter PUBLISH_TIME = DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm");
    private static final DateTimeFormatter CAPTION_DATE =
            DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH).withZone(ZoneOffset.UTC);

    private static final int CAPTION_LIMIT = 200;
    private static final int BASE_FOLLOWERS = 10_000;

    @Override public FormatVariant variant() { return FormatVariant.INSTAGRAM_POST_EXPORT; }

    @Override
    protected Optional<CanonicalPost> mapRow(RawImport.Row row) {
        String postId = Coercions.blankToNull(row.get("Post ID"));
        if (postId == null || postId.equalsIgnoreCase("nan")) {
            postId = String.format("post_%04d", row.position());
        }

        String published = Coercions.blankToNull(row.get("Publish time"));
        if (published == null || published.equalsIgnoreCase("nan")) published = row.get("Date");
        if (Coercions.blankToNull(published) == null) return Optional.empty();
        String when = published;
        Instant timestamp = Coercions.safeInstant(when, PUBLISH_TIME)
                .orElseThrow(() -> new RowExtractionException("unparseable publish time '" + when + "'"));

        int views = Coercions.nonNegative(row.get("Views"));
        int reach = Coercions.nonNegative(row.get("Reach"));
        int likes = Coercions.nonNegative(row.get("Likes"));
        int comments = Coercions.nonNegative(row.get("Comments"));
        int shares = Coercions.nonNegative(row.get("Shares"));
        int follows = Coercions.nonNegative(row.get("Follows"));
        int saves = Coercions.nonNegative(row.get("Saves"));

        int impressions = views > 0 ? views : reach;
        if (impressions == 0) impressions = clampToInt(Math.max(likes * 10L, 100L));
        if (reach == 0) reach = clampToInt((long) (impressions * 0.75));

        String caption = Coercions.blankToNull(row.get("Description"));
        if (caption == null || caption.equalsIgnoreCase("nan")) caption = "";
        caption = Coercions.truncate(caption, CAPTION_LIMIT);
        String hashtags = Coercions.extractHashtags(caption);
        if (caption.isEmpty()) caption = "Post from " + CAPTION_DATE.format(timestamp);

        long followers = BASE_FOLLOWERS + 3L * daysSinceBaseline(timestamp) + 100L * follows;

        return Optional.of(CanonicalPost.builder()
                .postId(postId)
                .timestamp(timestamp)
                .caption(caption)
                .likes(likes)
                .comments(comments)
                .shares(shares)
                .saves(saves)
                .impressions(impressions)
                .reach(reach)
                .followerCount(clampToInt(followers))
                .audienceGender(CanonicalPost.DEFAULT_GENDER)
                .audienceAge(CanonicalPost.DEFAULT_AGE)
                .location(CanonicalPost.DEFAULT_LOCATION)
                .hashtags(hashtags)
                .mediaType(MediaType.fromPostType(row.get("Post type")))
                .build());
    }
}
