package insights.model.service.ingest;

import insights.Fixtures;
import insights.model.domain.CanonicalPost;
import insights.model.domain.MediaType;
import insights.model.domain.RawImport;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StandardSchemaAdapterTest {

    private final StandardSchemaAdapter adapter = new StandardSchemaAdapter();

    @Test
    void canonicalNamesForCommonSpellings() {
        assertThat(StandardSchemaAdapter.canonicalName("Posted At")).isEqualTo("timestamp");
        assertThat(StandardSchemaAdapter.canonicalName("Like Count")).isEqualTo("likes");
        assertThat(StandardSchemaAdapter.canonicalName(" Video-Views ")).isEqualTo("impressions");
        assertThat(StandardSchemaAdapter.canonicalName("Type")).isEqualTo("media_type");
        assertThat(StandardSchemaAdapter.canonicalName("Mood")).isEqualTo("mood");
    }

    @Test
    void readsStandardFileAndDropsUndatedRows() {
        RawImport raw = new CsvImportReader().read(Fixtures.path("standard_schema.csv"));
        List<CanonicalPost> posts = adapter.adapt(raw);

        assertThat(posts).extracting(CanonicalPost::postId).containsExactly("s1", "s2");
        CanonicalPost s1 = posts.get(0);
        assertThat(s1.hashtags()).isEqualTo("#new #product");
        assertThat(s1.mediaType()).isEqualTo(MediaType.VIDEO);
        assertThat(s1.followerCount()).isEqualTo(1200);
        assertThat(posts.get(1).timestamp()).isEqualTo(Instant.parse("2025-03-02T14:00:00Z"));
        assertThat(posts.get(1).mediaType()).isEqualTo(MediaType.CAROUSEL);
    }

    @Test
    void aliasedColumnsAndMissingIds() {
        RawImport raw = new RawImport(
                List.of("Posted At", "Like Count", "Type", "Caption", "Tags"),
                List.of(List.of("2025-03-01 09:30:00", "-4", "Reel", "Launch #new", "")));
        CanonicalPost p = adapter.adapt(raw).get(0);

        assertThat(p.postId()).isEqualTo("post_0");
        assertThat(p.likes()).isZero();
        assertThat(p.mediaType()).isEqualTo(MediaType.VIDEO);
        assertThat(p.hashtags()).isEqualTo("#new");
        assertThat(p.location()).isEqualTo(CanonicalPost.DEFAULT_LOCATION);
    }

    @Test
    void firstColumnMappedToANameWins() {
        RawImport raw = new RawImport(
                List.of("timestamp", "likes", "reactions"),
                List.of(List.of("2025-03-01", "3", "99")));
        assertThat(adapter.adapt(raw).get(0).likes()).isEqualTo(3);
    }
}
