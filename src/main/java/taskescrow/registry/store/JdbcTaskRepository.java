package taskescrow.registry.store;

import taskescrow.registry.model.Task;
import taskescrow.registry.model.TaskStatus;
import taskescrow.registry.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * JDBC implementation of TaskRepository.
 * Row locks taken by {@link #findForUpdate} serialize transitions on the same task.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public void insert(Connection conn, Task task) throws SQLException {
        String sql = """
                    INSERT INTO tasks (id, title, description, reward, client, freelancer, status, deadline,
                                       freelancer_submitted, client_approved)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, task.id());
            ps.setString(2, task.title());
            ps.setString(3, task.description());
            ps.setLong(4, task.reward());
            ps.setString(5, task.client());
            setStringOrNull(ps, 6, task.freelancer().orElse(null));
            ps.setString(7, task.status().name());
            setInstant(ps, 8, task.deadline());
            ps.setBoolean(9, task.freelancerSubmitted());
            ps.setBoolean(10, task.clientApproved());

            ps.executeUpdate();
            log.debug("Inserted task {}", task.id());
        }
    }

    @Override
    public Optional<Task> findForUpdate(Connection conn, long taskId) throws SQLException {
        String sql = "SELECT * FROM tasks WHERE id = ? FOR UPDATE";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        }
    }

    @Override
    public void update(Connection conn, Task task) throws SQLException {
        String sql = """
                    UPDATE tasks
                    SET freelancer = ?, status = ?, freelancer_submitted = ?, client_approved = ?
                    WHERE id = ?
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            setStringOrNull(ps, 1, task.freelancer().orElse(null));
            ps.setString(2, task.status().name());
            ps.setBoolean(3, task.freelancerSubmitted());
            ps.setBoolean(4, task.clientApproved());
            ps.setLong(5, task.id());

            int updated = ps.executeUpdate();
            if (updated != 1) {
                throw new SQLException("Task update failed: task " + task.id() + " updated " + updated + " rows");
            }
            log.debug("Task {} now {} (submitted={}, approved={})",
                    task.id(), task.status(), task.freelancerSubmitted(), task.clientApproved());
        }
    }

    @Override
    public Optional<Task> findById(long taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                Optional<Task> found = rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
                conn.commit();
                return found;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public int countByStatus(TaskStatus status) {
        String sql = "SELECT COUNT(*) FROM tasks WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                int count = rs.next() ? rs.getInt(1) : 0;
                conn.commit();
                return count;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tasks by status: " + status, e);
        }
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        return Task.builder()
                .id(rs.getLong("id"))
                .title(rs.getString("title"))
                .description(rs.getString("description"))
                .reward(rs.getLong("reward"))
                .client(rs.getString("client"))
                .freelancer(rs.getString("freelancer"))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .deadline(getInstant(rs, "deadline"))
                .freelancerSubmitted(rs.getBoolean("freelancer_submitted"))
                .clientApproved(rs.getBoolean("client_approved"))
                .build();
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    private static void setInstant(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setObject(index, OffsetDateTime.ofInstant(instant, ZoneOffset.UTC));
        } else {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        }
    }

    private static void setStringOrNull(PreparedStatement ps, int index, String value) throws SQLException {
        if (value != null) {
            ps.setString(index, value);
        } else {
            ps.setNull(index, Types.VARCHAR);
        }
    }
}
