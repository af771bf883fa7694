package insights.model.service.preprocess;

import insights.model.domain.CanonicalPost;

import java.util.List;

public interface PreprocessService {
    PreparedDataset prepare(List<CanonicalPost> posts);

    /** {@code sampleSize <= 0} means the service default. */
    default PreparedDataset prepare(List<CanonicalPost> posts, int sampleSize) {
        return prepare(posts);
    }
}
