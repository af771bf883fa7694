package insights.model.service.ingest;

import insights.Fixtures;
import insights.model.domain.CanonicalPost;
import insights.model.domain.FormatVariant;
import insights.model.domain.MediaType;
import insights.model.repository.CanonicalStore;
import insights.model.repository.PostsRepo;
import insights.model.repository.SQLite;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class IngestionServiceTest {

    @TempDir
    Path dir;

    private PostsRepo store;
    private IngestionService service;

    @BeforeEach
    void setUp() {
        SQLite db = new SQLite(dir.resolve("ingest.db").toString());
        db.migrate();
        store = new PostsRepo(db);
        service = new IngestionService(store);
    }

    @Test
    void instagramRowSurvivesAdaptSaveAndLoad() throws Exception {
        Path f = dir.resolve("ig.csv");
        Files.writeString(f,
                "Post ID,Publish time,Views,Likes,Comments,Shares,Description,Post type\n"
                + "ig1,01/15/2025 10:00,1000,150,12,5,Great day! #fun #campus,IG image\n");

        IngestionReport report = service.ingest(f);
        assertThat(report.variant()).isEqualTo(FormatVariant.INSTAGRAM_POST_EXPORT);
        assertThat(report.recordsSaved()).isEqualTo(1);

        List<CanonicalPost> loaded = store.load();
        assertThat(loaded).hasSize(1);
        CanonicalPost p = loaded.get(0);
        assertThat(p.postId()).isEqualTo("ig1");
        assertThat(p.timestamp()).isEqualTo(Instant.parse("2025-01-15T10:00:00Z"));
        assertThat(p.likes()).isEqualTo(150);
        assertThat(p.impressions()).isEqualTo(1000);
        assertThat(p.reach()).isEqualTo(750);
        assertThat(p.hashtags()).isEqualTo("#fun #campus");
        assertThat(p.mediaType()).isEqualTo(MediaType.IMAGE);
    }

    @Test
    void reingestingTheSameFileStoresNothingNew() {
        Path f = Fixtures.path("instagram_export.csv");
        assertThat(service.ingest(f).recordsSaved()).isEqualTo(2);

        IngestionReport again = service.ingest(f);
        assertThat(again.recordsAdapted()).isEqualTo(2);
        assertThat(again.recordsSaved()).isZero();
        assertThat(store.count()).isEqualTo(2);
    }

    @Test
    void headerOnlyFilePersistsNothing() {
        assertThatThrownBy(() -> service.ingest(Fixtures.path("header_only.csv")))
                .isInstanceOf(NoValidRecordsException.class);
        assertThat(store.count()).isZero();
    }

    @Test
    void fileWhereEveryRowFailsPersistsNothing() throws Exception {
        Path f = dir.resolve("bad.csv");
        Files.writeString(f, "post_id,timestamp,likes\na,not a date,1\nb,,2\n");

        assertThatThrownBy(() -> service.ingest(f)).isInstanceOf(NoValidRecordsException.class);
        assertThat(store.count()).isZero();
    }

    @Test
    void unknownFormatNeverReachesTheStore() {
        CanonicalStore mockStore = mock(CanonicalStore.class);
        IngestionService isolated = new IngestionService(mockStore);

        assertThatThrownBy(() -> isolated.ingest(Fixtures.path("unknown.csv")))
                .isInstanceOf(UnrecognizedFormatException.class)
                .hasMessageContaining("foo");
        verify(mockStore, never()).save(any());
    }

    @Test
    void directoryIngestIsolatesFailingFiles() throws Exception {
        Path in = Files.createDirectory(dir.resolve("in"));
        Files.copy(Fixtures.path("instagram_export.csv"), in.resolve("a_instagram.csv"));
        Files.copy(Fixtures.path("unknown.csv"), in.resolve("b_unknown.csv"));
        Files.copy(Fixtures.path("facebook_video_export.csv"), in.resolve("c_facebook.csv"));
        Files.writeString(in.resolve("notes.txt"), "ignored");

        IngestionService.DirectoryReport report = service.ingestDirectory(in);

        assertThat(report.ingested()).extracting(IngestionReport::variant)
                .containsExactly(FormatVariant.INSTAGRAM_POST_EXPORT, FormatVariant.FACEBOOK_VIDEO_EXPORT);
        assertThat(report.failures()).hasSize(1);
        assertThat(report.failures().get(0)).startsWith("b_unknown.csv");
        assertThat(report.recordsSaved()).isEqualTo(4);
        assertThat(store.count()).isEqualTo(4);
    }
}
