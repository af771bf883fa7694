package insights.model.repository;

import insights.model.domain.CanonicalPost;

import java.util.List;
import java.util.Set;

/**
 * Durable, post_id-keyed collection of canonical posts.
 *
 * <p>{@link #save} is insert-if-absent: a post whose id is already stored is
 * dropped, never merged. The id check and the insert are separate steps, so
 * the store assumes a single writer; concurrent savers must be serialized by
 * the caller.
 */
public interface CanonicalStore {

    /** Stores posts whose id is not present yet. Returns rows written, best effort. */
    int save(List<CanonicalPost> posts);

    /** Every stored post, oldest first. */
    List<CanonicalPost> load();

    Set<String> existingIds();

    int count();
}
