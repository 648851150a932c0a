package taskescrow.registry.repository;

import taskescrow.registry.model.PlatformState;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Repository for the single registry-wide state row.
 */
public interface PlatformRepository {

    /**
     * Create the state row if it does not exist yet. An existing row is left untouched,
     * so the owner stays the one recorded at first initialization.
     *
     * @param owner         owner identity for a fresh registry
     * @param feePercentage initial platform fee for a fresh registry
     * @return the stored state
     */
    PlatformState initialize(String owner, int feePercentage);

    /**
     * Load the state and lock it until the transaction ends.
     *
     * @param conn transaction connection
     * @return current state
     */
    PlatformState loadForUpdate(Connection conn) throws SQLException;

    /**
     * Persist fee, counter and held balance. The owner column is never rewritten.
     *
     * @param conn  transaction connection
     * @param state new state
     */
    void save(Connection conn, PlatformState state) throws SQLException;

    /**
     * Load the committed state outside any transaction.
     *
     * @return current state
     */
    PlatformState load();
}
