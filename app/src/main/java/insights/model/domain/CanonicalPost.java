package insights.model.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One post in the canonical schema every analysis stage reads.
 * Counters are clamped at zero and text fields are never null.
 */
public record CanonicalPost(
    String postId,
    Instant timestamp,
    String caption,
    int likes,
    int comments,
    int shares,
    int saves,
    int impressions,
    int reach,
    int followerCount,
    String audienceGender,
    String audienceAge,
    String location,
    String hashtags,
    MediaType mediaType
) {
    public static final String DEFAULT_HASHTAGS = "#socialmedia #content";
    public static final String DEFAULT_GENDER = "Mixed";
    public static final String DEFAULT_AGE = "18-24";
    public static final String DEFAULT_LOCATION = "India";

    public CanonicalPost {
        Objects.requireNonNull(timestamp, "timestamp");
        postId = postId == null ? "" : postId.trim();
        caption = caption == null ? "" : caption;
        likes = Math.max(0, likes);
        comments = Math.max(0, comments);
        shares = Math.max(0, shares);
        saves = Math.max(0, saves);
        impressions = Math.max(0, impressions);
        reach = Math.max(0, reach);
        followerCount = Math.max(0, followerCount);
        audienceGender = orDefault(audienceGender, DEFAULT_GENDER);
        audienceAge = orDefault(audienceAge, DEFAULT_AGE);
        location = orDefault(location, DEFAULT_LOCATION);
        hashtags = orDefault(hashtags, DEFAULT_HASHTAGS);
        mediaType = mediaType == null ? MediaType.IMAGE : mediaType;
    }

    public CanonicalPost withPostId(String newId) {
        return new CanonicalPost(newId, timestamp, caption, likes, comments, shares, saves,
                impressions, reach, followerCount, audienceGender, audienceAge, location,
                hashtags, mediaType);
    }

    public int engagement() { return likes + comments + shares + saves; }

    public static Builder builder() { return new Builder(); }

    private static String orDefault(String v, String def) {
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    public static final class Builder {
        private String postId;
        private Instant timestamp;
        private String caption;
        private int likes, comments, shares, saves, impressions, reach, followerCount;
        private String audienceGender, audienceAge, location, hashtags;
        private MediaType mediaType;

        private Builder() {}

        public Builder postId(String v) { this.postId = v; return this; }
        public Builder timestamp(Instant v) { this.timestamp = v; return this; }
        public Builder caption(String v) { this.caption = v; return this; }
        public Builder likes(int v) { this.likes = v; return this; }
        public Builder comments(int v) { this.comments = v; return this; }
        public Builder shares(int v) { this.shares = v; return this; }
        public Builder saves(int v) { this.saves = v; return this; }
        public Builder impressions(int v) { this.impressions = v; return this; }
        public Builder reach(int v) { this.reach = v; return this; }
        public Builder followerCount(int v) { this.followerCount = v; return this; }
        public Builder audienceGender(String v) { this.audienceGender = v; return this; }
        public Builder audienceAge(String v) { this.audienceAge = v; return this; }
        public Builder location(String v) { this.location = v; return this; }
        public Builder hashtags(String v) { this.hashtags = v; return this; }
        public Builder mediaType(MediaType v) { this.mediaType = v; return this; }

        public CanonicalPost build() {
            return new CanonicalPost(postId, timestamp, caption, likes, comments, shares, saves,
                    impressions, reach, followerCount, audienceGender, audienceAge, location,
                    hashtags, mediaType);
        }
    }
}
