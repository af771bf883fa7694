package insights.model.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import insights.model.domain.Prediction;
import insights.util.Coercions;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class PredictionsRepo {
    public static final int DEFAULT_LIMIT = 10;

    private final SQLite db;
    private final ObjectMapper om;

    public PredictionsRepo(SQLite db, ObjectMapper om) {
        this.db = db;
        this.om = om;
    }

    public int saveAll(List<Prediction> rows) {
        if (rows == null || rows.isEmpty()) return 0;
        String sql = "INSERT INTO predictions(module_name,prediction_type,payload,timestamp) VALUES(?,?,?,?)";
        try (Connection con = db.connect(); PreparedStatement ps = con.prepareStatement(sql)) {
            con.setAutoCommit(false);
            for (Prediction p : rows) {
                ps.setString(1, p.module());
                ps.setString(2, p.predictionType());
                ps.setString(3, om.writeValueAsString(p.payload()));
                ps.setString(4, Coercions.STORED_INSTANT.format(p.timestamp()));
                ps.addBatch();
            }
            ps.executeBatch();
            con.commit();
            return rows.size();
        } catch (SQLException | JsonProcessingException e) {
            throw new RuntimeException("Saving predictions failed: " + e.getMessage(), e);
        }
    }

    /** Newest first; null filters match everything. */
    public List<Prediction> recent(String module, String predictionType, int limit) {
        StringBuilder sql = new StringBuilder(
                "SELECT module_name,prediction_type,payload,timestamp FROM predictions WHERE 1=1");
        List<String> params = new ArrayList<>();
        if (module != null) { sql.append(" AND module_name = ?"); params.add(module); }
        if (predictionType != null) { sql.append(" AND prediction_type = ?"); params.add(predictionType); }
        sql.append(" ORDER BY timestamp DESC, id DESC LIMIT ?");

        List<Prediction> out = new ArrayList<>();
        try (Connection con = db.connect(); PreparedStatement ps = con.prepareStatement(sql.toString())) {
            int i = 1;
            for (String p : params) ps.setString(i++, p);
            ps.setInt(i, limit <= 0 ? DEFAULT_LIMIT : limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Prediction(rs.getString(1), rs.getString(2),
                            readPayload(rs.getString(3)), Instant.parse(rs.getString(4))));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException(e);
        }
        return out;
    }

    public int count() {
        try (Connection con = db.connect();
             PreparedStatement ps = con.prepareStatement("SELECT COUNT(*) FROM predictions");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException(e);
        }
    }

    private JsonNode readPayload(String json) {
        try {
            return json == null ? om.nullNode() : om.readTree(json);
        } catch (JsonProcessingException e) {
            return om.getNodeFactory().textNode(json);
        }
    }
}
