package insights.model.service.pipeline;

import insights.model.domain.PipelineState;

/** A loading or preprocessing failure; the run is restarted from loading. */
public class PipelineException extends RuntimeException {
    private final PipelineState state;

    public PipelineException(PipelineState state, Throwable cause) {
        super(state + " failed: " + cause.getMessage(), cause);
        this.state = state;
    }

    public PipelineState state() { return state; }
}
