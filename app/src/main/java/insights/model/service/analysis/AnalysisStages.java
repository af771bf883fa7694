package insights.model.service.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import insights.model.service.pipeline.StageCatalog;

import java.util.List;

public final class AnalysisStages {
    private AnalysisStages() {}

    public static StageCatalog all(ObjectMapper om) {
        return StageCatalog.builder()
                .register(new PostingTimeStage(om).definition())
                .register(new HashtagPerformanceStage(om).definition())
                .register(new EngagementSummaryStage(om).definition())
                .build();
    }

    /** Built-in stages restricted to {@code enabled}, in that order. */
    public static StageCatalog enabled(ObjectMapper om, List<String> enabled) {
        return all(om).select(enabled);
    }
}
