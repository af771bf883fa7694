package insights.model.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import insights.model.domain.ModuleOutcome;
import insights.model.domain.PipelineRun;
import insights.util.Coercions;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Run headers ({@code pipeline_runs}) and per-module outcome rows ({@code pipeline_results}). */
public class RunsRepo {
    private final SQLite db;
    private final ObjectMapper om;

    public RunsRepo(SQLite db, ObjectMapper om) {
        this.db = db;
        this.om = om;
    }

    public static record ResultRow(String runId, String module, String status, String error, Instant timestamp) {}

    /** Header plus one row per outcome, in one transaction. */
    public void saveRun(PipelineRun run, Map<String, Object> params) {
        String header = "INSERT OR REPLACE INTO pipeline_runs(run_id,started_at,ended_at,status,recovery_attempts," +
                        "records_processed,error,params_json) VALUES(?,?,?,?,?,?,?,?)";
        String result = "INSERT INTO pipeline_results(run_id,module_name,status,error,reason,fallback_used," +
                        "attempts,metrics_json,timestamp) VALUES(?,?,?,?,?,?,?,?,?)";
        try (Connection con = db.connect()) {
            con.setAutoCommit(false);
            try (PreparedStatement ph = con.prepareStatement(header);
                 PreparedStatement pr = con.prepareStatement(result)) {
                ph.setString(1, run.id());
                ph.setString(2, Coercions.STORED_INSTANT.format(run.startedAt()));
                ph.setString(3, run.endedAt() == null ? null : Coercions.STORED_INSTANT.format(run.endedAt()));
                ph.setString(4, run.status() == null ? null : run.status().wireName());
                ph.setInt(5, run.recoveryAttempts());
                ph.setInt(6, run.recordsProcessed());
                ph.setString(7, run.error());
                ph.setString(8, om.writeValueAsString(params == null ? Map.of() : params));
                ph.executeUpdate();

                for (ModuleOutcome o : run.outcomes()) {
                    pr.setString(1, run.id());
                    pr.setString(2, o.module());
                    pr.setString(3, o.status().wireName());
                    pr.setString(4, o.error());
                    pr.setString(5, o.reason());
                    pr.setInt(6, o.fallbackUsed() ? 1 : 0);
                    pr.setInt(7, o.attempts());
                    pr.setString(8, om.writeValueAsString(o.metrics()));
                    pr.setString(9, Coercions.STORED_INSTANT.format(o.finishedAt()));
                    pr.addBatch();
                }
                pr.executeBatch();
                con.commit();
            } catch (Exception e) {
                con.rollback();
                throw e;
            }
        } catch (Exception e) {
            throw new RuntimeException("saveRun failed for " + run.id() + ": " + e.getMessage(), e);
        }
    }

    public List<ResultRow> resultsFor(String runId) {
        return query("SELECT run_id,module_name,status,error,timestamp FROM pipeline_results " +
                     "WHERE run_id = ? ORDER BY id", runId, Integer.MAX_VALUE);
    }

    /** Most recent outcome rows across runs, newest first. */
    public List<ResultRow> history(int limit) {
        return query("SELECT run_id,module_name,status,error,timestamp FROM pipeline_results " +
                     "ORDER BY id DESC LIMIT ?", null, limit);
    }

    public String statusOf(String runId) {
        try (Connection con = db.connect();
             PreparedStatement ps = con.prepareStatement("SELECT status FROM pipeline_runs WHERE run_id = ?")) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        } catch (SQLException e) {
            throw new RuntimeException(e);
        }
    }

    private List<ResultRow> query(String sql, String runId, int limit) {
        List<ResultRow> out = new ArrayList<>();
        try (Connection con = db.connect(); PreparedStatement ps = con.prepareStatement(sql)) {
            if (runId != null) ps.setString(1, runId);
            else ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ResultRow(rs.getString(1), rs.getString(2), rs.getString(3),
                            rs.getString(4), Instant.parse(rs.getString(5))));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException(e);
        }
        return out;
    }
}
