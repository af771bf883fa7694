package insights.model.service.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import insights.model.domain.CanonicalPost;
import insights.model.domain.MediaType;
import insights.model.domain.ModuleOutcome;
import insights.model.domain.ModuleStatus;
import insights.model.service.pipeline.ModuleRunner;
import insights.model.service.pipeline.StageCatalog;
import insights.model.service.pipeline.StageResult;
import insights.model.service.preprocess.PreparedDataset;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisStagesTest {

    private final ObjectMapper om = new ObjectMapper();

    private static CanonicalPost post(String id, String time, int likes, String hashtags, MediaType type, int impressions) {
        return CanonicalPost.builder()
                .postId(id)
                .timestamp(Instant.parse(time))
                .likes(likes)
                .hashtags(hashtags)
                .mediaType(type)
                .impressions(impressions)
                .build();
    }

    private static PreparedDataset data(CanonicalPost... posts) {
        return new PreparedDataset(List.of(posts), posts.length, false);
    }

    @Test
    void bestSlotNeedsRepeatedSlots() {
        PostingTimeStage stage = new PostingTimeStage(om);
        PreparedDataset d = data(
                post("a", "2025-01-06T10:00:00Z", 100, null, null, 0),
                post("b", "2025-01-13T10:30:00Z", 80, null, null, 0),
                post("c", "2025-01-07T15:00:00Z", 500, null, null, 0));

        StageResult r = stage.bestSlot(d);
        JsonNode body = r.payloads().get(0).body();

        assertThat(r.payloads().get(0).predictionType()).isEqualTo("optimal_posting_time");
        assertThat(body.get("day").asText()).isEqualTo("Monday");
        assertThat(body.get("hour").asInt()).isEqualTo(10);
        assertThat(body.get("mean_likes").asDouble()).isEqualTo(90.0);
        assertThat(body.get("samples").asInt()).isEqualTo(2);
    }

    @Test
    void postingTimeFallsBackToSeparateDayAndHour() {
        PostingTimeStage stage = new PostingTimeStage(om);
        PreparedDataset d = data(
                post("a", "2025-01-06T10:00:00Z", 100, null, null, 0),
                post("c", "2025-01-07T15:00:00Z", 500, null, null, 0));

        assertThatThrownBy(() -> stage.bestSlot(d)).isInstanceOf(IllegalStateException.class);

        ModuleOutcome o = new ModuleRunner(Duration.ZERO, x -> {}, om).run(stage.definition(), d, 3);
        assertThat(o.status()).isEqualTo(ModuleStatus.COMPLETED);
        assertThat(o.fallbackUsed()).isTrue();
        JsonNode body = o.predictions().get(0).payload();
        assertThat(o.predictions().get(0).predictionType()).isEqualTo("posting_time_statistics");
        assertThat(body.get("best_day").asText()).isEqualTo("Tuesday");
        assertThat(body.get("best_hour").asInt()).isEqualTo(15);
    }

    @Test
    void hashtagsRankedByMeanEngagement() {
        HashtagPerformanceStage stage = new HashtagPerformanceStage(om);
        PreparedDataset d = data(
                post("a", "2025-01-01T00:00:00Z", 10, "#fun #campus #content", null, 0),
                post("b", "2025-01-02T00:00:00Z", 30, "#Fun", null, 0),
                post("c", "2025-01-03T00:00:00Z", 100, "#campus #solo", null, 0));

        JsonNode top = stage.byEngagement(d).payloads().get(0).body().get("top");

        assertThat(top).hasSize(2);
        assertThat(top.get(0).get("hashtag").asText()).isEqualTo("#campus");
        assertThat(top.get(0).get("mean_engagement").asDouble()).isEqualTo(55.0);
        assertThat(top.get(1).get("hashtag").asText()).isEqualTo("#fun");
    }

    @Test
    void hashtagFallbackRanksByFrequency() {
        HashtagPerformanceStage stage = new HashtagPerformanceStage(om);
        PreparedDataset d = data(
                post("a", "2025-01-01T00:00:00Z", 10, "#one #two", null, 0),
                post("b", "2025-01-02T00:00:00Z", 30, "#two", null, 0));

        JsonNode top = stage.byFrequency(d).payloads().get(0).body().get("top");
        assertThat(top.get(0).get("hashtag").asText()).isEqualTo("#two");
        assertThat(top.get(0).get("uses").asInt()).isEqualTo(2);
    }

    @Test
    void onlyGenericHashtagsSkipTheStage() {
        HashtagPerformanceStage stage = new HashtagPerformanceStage(om);
        PreparedDataset d = data(post("a", "2025-01-01T00:00:00Z", 10, null, null, 0));

        ModuleOutcome o = new ModuleRunner(Duration.ZERO, x -> {}, om).run(stage.definition(), d, 3);
        assertThat(o.status()).isEqualTo(ModuleStatus.SKIPPED);
        assertThat(o.skipReason()).contains("only generic hashtags present");
    }

    @Test
    void engagementBrokenDownByMediaType() {
        EngagementSummaryStage stage = new EngagementSummaryStage(om);
        PreparedDataset d = data(
                post("a", "2025-01-01T00:00:00Z", 10, null, MediaType.IMAGE, 100),
                post("b", "2025-01-02T00:00:00Z", 30, null, MediaType.VIDEO, 100),
                post("c", "2025-01-03T00:00:00Z", 50, null, MediaType.VIDEO, 0));

        StageResult r = stage.breakdown(d);
        JsonNode body = r.payloads().get(0).body();

        assertThat(body.get("Image").get("mean_engagement_rate").asDouble()).isEqualTo(10.0);
        assertThat(body.get("Video").get("posts").asInt()).isEqualTo(2);
        assertThat(body.get("Video").get("mean_engagement_rate").asDouble()).isEqualTo(30.0);
        assertThat(r.metrics()).containsEntry("overall_engagement_rate", 45.0);
    }

    @Test
    void engagementSkippedWithoutImpressions() {
        EngagementSummaryStage stage = new EngagementSummaryStage(om);
        PreparedDataset d = data(post("a", "2025-01-01T00:00:00Z", 10, null, null, 0));

        assertThat(stage.definition().precondition().unmet(d)).contains("no impressions recorded");
    }

    @Test
    void enabledCatalogFollowsConfiguredNames() {
        StageCatalog c = AnalysisStages.enabled(om, List.of("engagement_summary", "posting_time"));
        assertThat(c.names()).containsExactly("engagement_summary", "posting_time");
        assertThat(AnalysisStages.all(om).names())
                .containsExactly("posting_time", "hashtag_performance", "engagement_summary");
    }
}
