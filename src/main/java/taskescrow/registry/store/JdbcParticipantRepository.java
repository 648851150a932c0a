package taskescrow.registry.store;

import taskescrow.registry.repository.ParticipantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of ParticipantRepository.
 */
public class JdbcParticipantRepository implements ParticipantRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcParticipantRepository.class);

    private final Database db;

    public JdbcParticipantRepository(Database db) {
        this.db = db;
    }

    @Override
    public void appendTask(Connection conn, String identity, long taskId) throws SQLException {
        String nextSeqSql = "SELECT COALESCE(MAX(seq), -1) + 1 FROM user_tasks WHERE identity = ?";
        String insertSql = "INSERT INTO user_tasks (identity, seq, task_id) VALUES (?, ?, ?)";

        int seq;
        try (PreparedStatement ps = conn.prepareStatement(nextSeqSql)) {
            ps.setString(1, identity);
            try (ResultSet rs = ps.executeQuery()) {
                seq = rs.next() ? rs.getInt(1) : 0;
            }
        }

        try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
            ps.setString(1, identity);
            ps.setInt(2, seq);
            ps.setLong(3, taskId);
            ps.executeUpdate();
        }

        log.debug("Appended task {} to {} at position {}", taskId, identity, seq);
    }

    @Override
    public void incrementCompleted(Connection conn, String identity) throws SQLException {
        String updateSql = "UPDATE completed_task_counts SET completed_count = completed_count + 1 WHERE identity = ?";
        String insertSql = "INSERT INTO completed_task_counts (identity, completed_count) VALUES (?, 1)";

        try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
            ps.setString(1, identity);
            if (ps.executeUpdate() > 0) {
                return;
            }
        }

        try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
            ps.setString(1, identity);
            ps.executeUpdate();
        }
    }

    @Override
    public List<Long> findTaskIds(String identity) {
        String sql = "SELECT task_id FROM user_tasks WHERE identity = ? ORDER BY seq";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, identity);
            List<Long> ids = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getLong(1));
                }
            }
            conn.commit();
            return ids;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load tasks for: " + identity, e);
        }
    }

    @Override
    public long completedCount(String identity) {
        String sql = "SELECT completed_count FROM completed_task_counts WHERE identity = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, identity);
            try (ResultSet rs = ps.executeQuery()) {
                long count = rs.next() ? rs.getLong(1) : 0L;
                conn.commit();
                return count;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load completed count for: " + identity, e);
        }
    }
}
