package insights.model.service.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import insights.model.domain.CanonicalPost;
import insights.model.domain.MediaType;
import insights.model.service.pipeline.StageDefinition;
import insights.model.service.pipeline.StageResult;
import insights.model.service.preprocess.PreparedDataset;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Totals and mean engagement rate per media type. */
public class EngagementSummaryStage {
    public static final String NAME = "engagement_summary";

    private final ObjectMapper om;

    public EngagementSummaryStage(ObjectMapper om) { this.om = om; }

    public StageDefinition definition() {
        return new StageDefinition(NAME, this::breakdown, null,
                data -> data.posts().stream().anyMatch(p -> p.impressions() > 0)
                        ? Optional.empty()
                        : Optional.of("no impressions recorded"));
    }

    StageResult breakdown(PreparedDataset data) {
        Map<MediaType, Totals> byType = new EnumMap<>(MediaType.class);
        for (CanonicalPost p : data.posts()) {
            byType.computeIfAbsent(p.mediaType(), k -> new Totals()).add(p);
        }

        ObjectNode body = om.createObjectNode();
        long engagement = 0;
        long impressions = 0;
        for (Map.Entry<MediaType, Totals> e : byType.entrySet()) {
            Totals t = e.getValue();
            ObjectNode n = body.putObject(e.getKey().label());
            n.put("posts", t.posts);
            n.put("likes", t.likes);
            n.put("comments", t.comments);
            n.put("shares", t.shares);
            n.put("saves", t.saves);
            n.put("impressions", t.impressions);
            n.put("mean_engagement_rate", PostingTimeStage.round(t.meanRate()));
            engagement += t.likes + t.comments + t.shares + t.saves;
            impressions += t.impressions;
        }

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("posts_analyzed", data.size());
        metrics.put("media_types", byType.size());
        metrics.put("overall_engagement_rate",
                impressions == 0 ? 0.0 : PostingTimeStage.round(100.0 * engagement / impressions));
        return StageResult.of(metrics, "media_type_breakdown", body);
    }

    static final class Totals {
        int posts;
        long likes, comments, shares, saves, impressions;
        double rateSum;
        int rated;

        void add(CanonicalPost p) {
            posts++;
            likes += p.likes();
            comments += p.comments();
            shares += p.shares();
            saves += p.saves();
            impressions += p.impressions();
            if (p.impressions() > 0) {
                rateSum += 100.0 * p.engagement() / p.impressions();
                rated++;
            }
        }

        /** Percent, over posts that have impressions. */
        double meanRate() { return rated == 0 ? 0 : rateSum / rated; }
    }
}
