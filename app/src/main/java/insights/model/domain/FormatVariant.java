package insights.model.domain;

/** Shape of an uploaded export, decided from its header alone. */
public enum FormatVariant {
    INSTAGRAM_POST_EXPORT,
    FACEBOOK_VIDEO_EXPORT,
    STANDARD_SCHEMA,
    UNKNOWN
}
