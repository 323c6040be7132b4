package io.snapcheck.storage;

import io.snapcheck.model.Assertion;
import io.snapcheck.model.DecisionRecord;
import io.snapcheck.model.PatchOutcome;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * SQLite-backed decision history. Files are keyed by their absolute, normalized path.
 */
public final class DecisionHistoryStore implements DecisionHistory {
    private static final String COLUMNS =
            "file,line,test_name,group_id,stage,outcome,pattern,run_id,seq,decided_at_ms";

    private final Database database;
    private final String runId;

    public DecisionHistoryStore(Database database, String runId) {
        this.database = database;
        this.runId = runId;
    }

    @Override
    public List<DecisionRecord> recent(String file, String testName, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        String sql = "SELECT " + COLUMNS + " FROM decisions WHERE file=? AND test_name=? "
                + "ORDER BY decided_at_ms DESC, id DESC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key(file));
            ps.setString(2, testName);
            ps.setInt(3, limit);
            return readAll(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read decision history", e);
        }
    }

    /**
     * Every recorded decision for {@code file}, newest first.
     */
    public List<DecisionRecord> forFile(String file, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM decisions WHERE file=? "
                + "ORDER BY decided_at_ms DESC, id DESC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key(file));
            ps.setInt(2, Math.max(1, limit));
            return readAll(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read decision history", e);
        }
    }

    @Override
    public void record(PatchOutcome outcome, String pattern, long seq) {
        Assertion a = outcome.assertion();
        String sql = "INSERT INTO decisions(" + COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key(a.file()));
            ps.setInt(2, a.line());
            ps.setString(3, a.testName());
            ps.setString(4, a.groupId());
            ps.setString(5, a.stage().name().toLowerCase());
            ps.setString(6, outcome.label());
            ps.setString(7, pattern);
            ps.setString(8, runId);
            ps.setLong(9, seq);
            ps.setLong(10, System.currentTimeMillis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record decision", e);
        }
    }

    private static List<DecisionRecord> readAll(PreparedStatement ps) throws SQLException {
        List<DecisionRecord> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new DecisionRecord(
                        rs.getString("file"), rs.getInt("line"), rs.getString("test_name"),
                        rs.getString("group_id"), rs.getString("stage"), rs.getString("outcome"),
                        rs.getString("pattern"), rs.getString("run_id"), rs.getLong("seq"),
                        rs.getLong("decided_at_ms")
                ));
            }
        }
        return out;
    }

    static String key(String file) {
        return Path.of(file).toAbsolutePath().normalize().toString();
    }
}
