package insights.model.domain;

public enum PipelineState {
    INIT, LOADING, PREPROCESSING, RUNNING_MODULES, PERSISTING, DONE, FAILED
}
