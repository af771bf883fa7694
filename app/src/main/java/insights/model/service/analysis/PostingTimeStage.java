package insights.model.service.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import insights.model.domain.CanonicalPost;
import insights.model.service.pipeline.StageDefinition;
import insights.model.service.pipeline.StageResult;
import insights.model.service.preprocess.PreparedDataset;

import java.time.DayOfWeek;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/** Best time to post, by mean likes per weekday/hour slot (UTC). */
public class PostingTimeStage {
    public static final String NAME = "posting_time";
    static final int MIN_SLOT_SAMPLES = 2;

    private final ObjectMapper om;

    public PostingTimeStage(ObjectMapper om) { this.om = om; }

    public StageDefinition definition() {
        return new StageDefinition(NAME, this::bestSlot, this::popularDayAndHour,
                data -> data.size() == 0 ? Optional.of("no posts") : Optional.empty());
    }

    /** Needs at least one slot with {@value #MIN_SLOT_SAMPLES} posts. */
    StageResult bestSlot(PreparedDataset data) {
        Map<String, Mean> slots = new TreeMap<>();
        for (CanonicalPost p : data.posts()) {
            ZonedDateTime t = p.timestamp().atZone(ZoneOffset.UTC);
            slots.computeIfAbsent(t.getDayOfWeek().getValue() + "|" + t.getHour(), k -> new Mean()).add(p.likes());
        }
        String best = null;
        Mean bestMean = null;
        for (Map.Entry<String, Mean> e : slots.entrySet()) {
            Mean m = e.getValue();
            if (m.n < MIN_SLOT_SAMPLES) continue;
            if (bestMean == null || m.value() > bestMean.value()) {
                best = e.getKey();
                bestMean = m;
            }
        }
        if (best == null) {
            throw new IllegalStateException("no weekday/hour slot has " + MIN_SLOT_SAMPLES + " posts");
        }
        String[] parts = best.split("\\|");
        ObjectNode body = om.createObjectNode();
        body.put("day", dayName(Integer.parseInt(parts[0])));
        body.put("hour", Integer.parseInt(parts[1]));
        body.put("mean_likes", round(bestMean.value()));
        body.put("samples", bestMean.n);

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("posts_analyzed", data.size());
        metrics.put("slots_evaluated", slots.size());
        return StageResult.of(metrics, "optimal_posting_time", body);
    }

    /** Day and hour ranked independently. */
    StageResult popularDayAndHour(PreparedDataset data) {
        Map<Integer, Mean> byDay = new TreeMap<>();
        Map<Integer, Mean> byHour = new TreeMap<>();
        for (CanonicalPost p : data.posts()) {
            ZonedDateTime t = p.timestamp().atZone(ZoneOffset.UTC);
            byDay.computeIfAbsent(t.getDayOfWeek().getValue(), k -> new Mean()).add(p.likes());
            byHour.computeIfAbsent(t.getHour(), k -> new Mean()).add(p.likes());
        }
        int day = argMax(byDay);
        int hour = argMax(byHour);

        ObjectNode body = om.createObjectNode();
        body.put("best_day", dayName(day));
        body.put("best_day_mean_likes", round(byDay.get(day).value()));
        body.put("best_hour", hour);
        body.put("best_hour_mean_likes", round(byHour.get(hour).value()));

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("posts_analyzed", data.size());
        metrics.put("days_seen", byDay.size());
        metrics.put("hours_seen", byHour.size());
        return StageResult.of(metrics, "posting_time_statistics", body);
    }

    private static int argMax(Map<Integer, Mean> m) {
        int best = -1;
        double bestValue = -1;
        for (Map.Entry<Integer, Mean> e : m.entrySet()) {
            if (e.getValue().value() > bestValue) {
                best = e.getKey();
                bestValue = e.getValue().value();
            }
        }
        return best;
    }

    private static String dayName(int isoDay) {
        return DayOfWeek.of(isoDay).getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    static double round(double v) { return Math.round(v * 100.0) / 100.0; }

    static final class Mean {
        long sum;
        int n;
        void add(long v) { sum += v; n++; }
        double value() { return n == 0 ? 0 : (double) sum / n; }
    }
}
