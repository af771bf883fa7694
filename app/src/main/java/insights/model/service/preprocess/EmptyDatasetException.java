package insights.model.service.preprocess;

public class EmptyDatasetException extends RuntimeException {
    public EmptyDatasetException() {
        super("No posts available for analysis");
    }
}
