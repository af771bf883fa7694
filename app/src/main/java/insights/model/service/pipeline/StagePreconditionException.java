package insights.model.service.pipeline;

/** Thrown from inside a stage to report a skip rather than a fault. */
public class StagePreconditionException extends RuntimeException {
    public StagePreconditionException(String reason) {
        super(reason);
    }
}
