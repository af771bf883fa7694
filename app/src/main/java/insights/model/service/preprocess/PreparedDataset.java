package insights.model.service.preprocess;

import insights.model.domain.CanonicalPost;

import java.util.List;

/** Posts handed to the stages, plus how many there were before sampling. */
public record PreparedDataset(List<CanonicalPost> posts, int originalSize, boolean sampled) {
    public PreparedDataset {
        posts = List.copyOf(posts);
    }

    public int size() { return posts.size(); }
}
