package insights.model.service.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import insights.model.domain.CanonicalPost;
import insights.model.service.pipeline.StageDefinition;
import insights.model.service.pipeline.StageResult;
import insights.model.service.preprocess.PreparedDataset;
import insights.util.Coercions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ranks hashtags by mean engagement of the posts carrying them. Tags the
 * adapters add by default carry no signal and are left out.
 */
public class HashtagPerformanceStage {
    public static final String NAME = "hashtag_performance";
    static final Set<String> GENERIC = Set.of("#socialmedia", "#content", "#digital");
    static final int TOP = 10;
    static final int MIN_USES = 2;

    private final ObjectMapper om;

    public HashtagPerformanceStage(ObjectMapper om) { this.om = om; }

    public StageDefinition definition() {
        return new StageDefinition(NAME, this::byEngagement, this::byFrequency, this::hasSpecificTags);
    }

    Optional<String> hasSpecificTags(PreparedDataset data) {
        for (CanonicalPost p : data.posts()) {
            for (String t : Coercions.splitHashtags(p.hashtags())) {
                if (!GENERIC.contains(t)) return Optional.empty();
            }
        }
        return Optional.of("only generic hashtags present");
    }

    StageResult byEngagement(PreparedDataset data) {
        Map<String, long[]> stats = collect(data);
        List<Map.Entry<String, long[]>> ranked = new ArrayList<>();
        for (Map.Entry<String, long[]> e : stats.entrySet()) {
            if (e.getValue()[0] >= MIN_USES) ranked.add(e);
        }
        if (ranked.isEmpty()) {
            throw new IllegalStateException("no hashtag used at least " + MIN_USES + " times");
        }
        ranked.sort(Comparator.<Map.Entry<String, long[]>>comparingDouble(e -> -mean(e.getValue()))
                .thenComparing(Map.Entry::getKey));

        ArrayNode top = om.createArrayNode();
        for (Map.Entry<String, long[]> e : ranked.subList(0, Math.min(TOP, ranked.size()))) {
            ObjectNode n = top.addObject();
            n.put("hashtag", e.getKey());
            n.put("uses", e.getValue()[0]);
            n.put("mean_engagement", PostingTimeStage.round(mean(e.getValue())));
        }
        ObjectNode body = om.createObjectNode();
        body.set("top", top);

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("distinct_hashtags", stats.size());
        metrics.put("ranked", ranked.size());
        return StageResult.of(metrics, "hashtag_ranking", body);
    }

    StageResult byFrequency(PreparedDataset data) {
        Map<String, long[]> stats = collect(data);
        List<Map.Entry<String, long[]>> ranked = new ArrayList<>(stats.entrySet());
        ranked.sort(Comparator.<Map.Entry<String, long[]>>comparingLong(e -> -e.getValue()[0])
                .thenComparing(Map.Entry::getKey));

        ArrayNode top = om.createArrayNode();
        for (Map.Entry<String, long[]> e : ranked.subList(0, Math.min(TOP, ranked.size()))) {
            ObjectNode n = top.addObject();
            n.put("hashtag", e.getKey());
            n.put("uses", e.getValue()[0]);
        }
        ObjectNode body = om.createObjectNode();
        body.set("top", top);

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("distinct_hashtags", stats.size());
        return StageResult.of(metrics, "hashtag_ranking", body);
    }

    /** tag -> [uses, total engagement] */
    private static Map<String, long[]> collect(PreparedDataset data) {
        Map<String, long[]> stats = new LinkedHashMap<>();
        for (CanonicalPost p : data.posts()) {
            for (String t : Coercions.splitHashtags(p.hashtags())) {
                if (GENERIC.contains(t)) continue;
                long[] s = stats.computeIfAbsent(t, k -> new long[2]);
                s[0]++;
                s[1] += p.engagement();
            }
        }
        return stats;
    }

    private static double mean(long[] s) { return s[0] == 0 ? 0 : (double) s[1] / s[0]; }
}
