package insights.model.domain;

import java.util.Locale;

public enum MediaType {
    IMAGE("Image"),
    VIDEO("Video"),
    CAROUSEL("Carousel");

    private final String label;

    MediaType(String label) { this.label = label; }

    public String label() { return label; }

    /**
     * Substring match on a free-text post type: "reel"/"video" mean video,
     * "carousel" means carousel, anything else is an image.
     */
    public static MediaType fromPostType(String postType) {
        if (postType == null) return IMAGE;
        String t = postType.toLowerCase(Locale.ROOT).trim();
        if (t.contains("reel") || t.contains("video")) return VIDEO;
        if (t.contains("carousel")) return CAROUSEL;
        return IMAGE;
    }

    /** Stored label back to enum; unknown labels fall back to {@link #fromPostType}. */
    public static MediaType fromLabel(String label) {
        if (label != null) {
            for (MediaType m : values()) {
                if (m.label.equalsIgnoreCase(label.trim())) return m;
            }
        }
        return fromPostType(label);
    }
}
