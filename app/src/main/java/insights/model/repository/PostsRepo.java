package insights.model.repository;

import insights.model.domain.CanonicalPost;
import insights.model.domain.MediaType;
import insights.util.Coercions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** SQLite-backed {@link CanonicalStore}. */
public class PostsRepo implements CanonicalStore {
    private static final Logger log = LoggerFactory.getLogger(PostsRepo.class);

    private static final int CHUNK = 500;

    private static final String INSERT =
            "INSERT INTO posts(post_id,timestamp,caption,likes,comments,shares,saves,impressions,reach," +
            "follower_count,audience_gender,audience_age,location,hashtags,media_type) " +
            "VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";

    private final SQLite db;

    public PostsRepo(SQLite db) { this.db = db; }

    /**
     * Read ids, then insert the absent ones in chunks. A chunk that fails is
     * rolled back and logged; chunks already committed stay and are counted.
     */
    @Override
    public int save(List<CanonicalPost> posts) {
        if (posts == null || posts.isEmpty()) {
            log.warn("save called with no posts");
            return 0;
        }

        Map<String, CanonicalPost> unique = new LinkedHashMap<>();
        for (CanonicalPost p : posts) {
            if (p.postId().isEmpty()) {
                log.warn("Dropping post without post_id at {}", p.timestamp());
                continue;
            }
            unique.putIfAbsent(p.postId(), p);
        }

        Set<String> existing;
        try {
            existing = existingIds();
        } catch (RuntimeException e) {
            log.warn("Could not read existing post ids, inserting all: {}", e.getMessage());
            existing = Set.of();
        }

        List<CanonicalPost> fresh = new ArrayList<>();
        for (CanonicalPost p : unique.values()) {
            if (!existing.contains(p.postId())) fresh.add(p);
        }
        int duplicates = unique.size() - fresh.size();
        if (fresh.isEmpty()) {
            log.info("No new posts to store ({} already present)", duplicates);
            return 0;
        }

        int written = 0;
        try (Connection con = db.connect()) {
            con.setAutoCommit(false);
            try (PreparedStatement ps = con.prepareStatement(INSERT)) {
                for (int from = 0; from < fresh.size(); from += CHUNK) {
                    List<CanonicalPost> chunk = fresh.subList(from, Math.min(from + CHUNK, fresh.size()));
                    try {
                        for (CanonicalPost p : chunk) {
                            bind(ps, p);
                            ps.addBatch();
                        }
                        ps.executeBatch();
                        con.commit();
                        written += chunk.size();
                    } catch (SQLException e) {
                        ps.clearBatch();
                        con.rollback();
                        log.error("Insert of {} posts failed, chunk rolled back: {}", chunk.size(), e.getMessage());
                    }
                }
            }
        } catch (SQLException | RuntimeException e) {
            log.error("Saving posts stopped after {} rows: {}", written, e.getMessage());
        }

        log.info("Stored {} new posts, skipped {} already present", written, duplicates);
        return written;
    }

    @Override
    public List<CanonicalPost> load() {
        String sql = "SELECT post_id,timestamp,caption,likes,comments,shares,saves,impressions,reach," +
                     "follower_count,audience_gender,audience_age,location,hashtags,media_type " +
                     "FROM posts ORDER BY timestamp, post_id";
        List<CanonicalPost> out = new ArrayList<>();
        int unreadable = 0;
        try (Connection con = db.connect();
             PreparedStatement ps = con.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                Optional<CanonicalPost> p = read(rs);
                if (p.isPresent()) out.add(p.get());
                else unreadable++;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Loading posts failed: " + e.getMessage(), e);
        }
        if (unreadable > 0) log.warn("Skipped {} stored posts with unreadable timestamps", unreadable);
        return out;
    }

    @Override
    public Set<String> existingIds() {
        Set<String> ids = new HashSet<>();
        try (Connection con = db.connect();
             PreparedStatement ps = con.prepareStatement("SELECT post_id FROM posts");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) ids.add(rs.getString(1));
        } catch (SQLException e) {
            throw new RuntimeException(e);
        }
        return ids;
    }

    @Override
    public int count() {
        try (Connection con = db.connect();
             PreparedStatement ps = con.prepareStatement("SELECT COUNT(*) FROM posts");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException(e);
        }
    }

    private static void bind(PreparedStatement ps, CanonicalPost p) throws SQLException {
        ps.setString(1, p.postId());
        ps.setString(2, Coercions.STORED_INSTANT.format(p.timestamp()));
        ps.setString(3, p.caption());
        ps.setInt(4, p.likes());
        ps.setInt(5, p.comments());
        ps.setInt(6, p.shares());
        ps.setInt(7, p.saves());
        ps.setInt(8, p.impressions());
        ps.setInt(9, p.reach());
        ps.setInt(10, p.followerCount());
        ps.setString(11, p.audienceGender());
        ps.setString(12, p.audienceAge());
        ps.setString(13, p.location());
        ps.setString(14, p.hashtags());
        ps.setString(15, p.mediaType().label());
    }

    private static Optional<CanonicalPost> read(ResultSet rs) throws SQLException {
        Optional<Instant> ts = Coercions.safeInstant(rs.getString(2));
        if (ts.isEmpty()) return Optional.empty();
        return Optional.of(CanonicalPost.builder()
                .postId(rs.getString(1))
                .timestamp(ts.get())
                .caption(rs.getString(3))
                .likes(Coercions.nonNegative(rs.getString(4)))
                .comments(Coercions.nonNegative(rs.getString(5)))
                .shares(Coercions.nonNegative(rs.getString(6)))
                .saves(Coercions.nonNegative(rs.getString(7)))
                .impressions(Coercions.nonNegative(rs.getString(8)))
                .reach(Coercions.nonNegative(rs.getString(9)))
                .followerCount(Coercions.nonNegative(rs.getString(10)))
                .audienceGender(rs.getString(11))
                .audienceAge(rs.getString(12))
                .location(rs.getString(13))
                .hashtags(rs.getString(14))
                .mediaType(MediaType.fromLabel(rs.getString(15)))
                .build());
    }
}
