package insights.model.service.preprocess;

import insights.model.domain.CanonicalPost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Fills blank ids and downsamples large datasets. Sampling is seeded, so the
 * same input and seed always give the same subset, kept in input order.
 */
public class DefaultPreprocessService implements PreprocessService {
    private static final Logger log = LoggerFactory.getLogger(DefaultPreprocessService.class);

    public static final int DEFAULT_THRESHOLD = 5_000;
    public static final long DEFAULT_SEED = 42L;

    private final int threshold;
    private final long seed;

    public DefaultPreprocessService(int threshold, long seed) {
        if (threshold <= 0) throw new IllegalArgumentException("threshold must be positive: " + threshold);
        this.threshold = threshold;
        this.seed = seed;
    }

    public DefaultPreprocessService() {
        this(DEFAULT_THRESHOLD, DEFAULT_SEED);
    }

    @Override
    public PreparedDataset prepare(List<CanonicalPost> posts) {
        if (posts == null || posts.isEmpty()) throw new EmptyDatasetException();

        List<CanonicalPost> filled = new ArrayList<>(posts.size());
        for (int i = 0; i < posts.size(); i++) {
            CanonicalPost p = posts.get(i);
            filled.add(p.postId().isBlank() ? p.withPostId("post_" + i) : p);
        }

        if (filled.size() <= threshold) {
            return new PreparedDataset(filled, posts.size(), false);
        }
        List<CanonicalPost> sample = sample(filled, threshold, seed);
        log.info("Sampled {} of {} posts (seed {})", sample.size(), filled.size(), seed);
        return new PreparedDataset(sample, posts.size(), true);
    }

    /** Applies a smaller cap requested for a single run. */
    @Override
    public PreparedDataset prepare(List<CanonicalPost> posts, int sampleSize) {
        if (sampleSize <= 0 || sampleSize >= threshold) return prepare(posts);
        return new DefaultPreprocessService(sampleSize, seed).prepare(posts);
    }

    static List<CanonicalPost> sample(List<CanonicalPost> posts, int size, long seed) {
        List<Integer> idx = IntStream.range(0, posts.size()).boxed().collect(Collectors.toList());
        Collections.shuffle(idx, new Random(seed));
        List<Integer> picked = new ArrayList<>(idx.subList(0, size));
        Collections.sort(picked);
        List<CanonicalPost> out = new ArrayList<>(size);
        for (int i : picked) out.add(posts.get(i));
        return out;
    }
}
