package insights.model.service.pipeline;

import insights.model.service.preprocess.PreparedDataset;

@FunctionalInterface
public interface StageFunction {
    StageResult apply(PreparedDataset data) throws Exception;
}
