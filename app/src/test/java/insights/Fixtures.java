package insights;

import insights.model.domain.CanonicalPost;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.time.Instant;

public final class Fixtures {
    private Fixtures() {}

    public static Path path(String name) {
        URL url = Fixtures.class.getResource("/fixtures/" + name);
        if (url == null) throw new IllegalArgumentException("missing fixture " + name);
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static CanonicalPost post(String id, String isoTime, int likes) {
        return CanonicalPost.builder()
                .postId(id)
                .timestamp(Instant.parse(isoTime))
                .likes(likes)
                .impressions(likes * 10)
                .build();
    }
}
