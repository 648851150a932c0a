package taskescrow.registry.store;

import taskescrow.registry.model.PlatformState;
import taskescrow.registry.repository.PlatformRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * JDBC implementation of PlatformRepository.
 * Locking the single state row serializes every registry mutation at the database level.
 */
public class JdbcPlatformRepository implements PlatformRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcPlatformRepository.class);
    private static final int STATE_ROW_ID = 1;

    private final Database db;

    public JdbcPlatformRepository(Database db) {
        this.db = db;
    }

    @Override
    public PlatformState initialize(String owner, int feePercentage) {
        return db.inTransaction(conn -> {
            PlatformState existing = find(conn, true);
            if (existing != null) {
                if (!existing.owner().equals(owner)) {
                    log.warn("Registry already owned by '{}', ignoring configured owner '{}'",
                            existing.owner(), owner);
                }
                return existing;
            }

            String sql = """
                        INSERT INTO registry_state (id, owner, platform_fee_percentage, task_counter, held_balance)
                        VALUES (?, ?, ?, 0, 0)
                    """;
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setInt(1, STATE_ROW_ID);
                ps.setString(2, owner);
                ps.setInt(3, feePercentage);
                ps.executeUpdate();
            }
            log.info("Registry initialized: owner={}, fee={}%", owner, feePercentage);
            return new PlatformState(owner, feePercentage, 0L, 0L);
        });
    }

    @Override
    public PlatformState loadForUpdate(Connection conn) throws SQLException {
        PlatformState state = find(conn, true);
        if (state == null) {
            throw new SQLException("Registry state row missing; initialize() was never called");
        }
        return state;
    }

    @Override
    public void save(Connection conn, PlatformState state) throws SQLException {
        String sql = """
                    UPDATE registry_state
                    SET platform_fee_percentage = ?, task_counter = ?, held_balance = ?
                    WHERE id = ?
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, state.platformFeePercentage());
            ps.setLong(2, state.taskCounter());
            ps.setLong(3, state.heldBalance());
            ps.setInt(4, STATE_ROW_ID);

            int updated = ps.executeUpdate();
            if (updated != 1) {
                throw new SQLException("Registry state update failed: updated " + updated + " rows");
            }
        }
    }

    @Override
    public PlatformState load() {
        return db.inTransaction(conn -> {
            PlatformState state = find(conn, false);
            if (state == null) {
                throw new SQLException("Registry state row missing; initialize() was never called");
            }
            return state;
        });
    }

    private PlatformState find(Connection conn, boolean forUpdate) throws SQLException {
        String sql = "SELECT owner, platform_fee_percentage, task_counter, held_balance FROM registry_state WHERE id = ?"
                + (forUpdate ? " FOR UPDATE" : "");

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, STATE_ROW_ID);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return new PlatformState(
                        rs.getString("owner"),
                        rs.getInt("platform_fee_percentage"),
                        rs.getLong("task_counter"),
                        rs.getLong("held_balance"));
            }
        }
    }
}
