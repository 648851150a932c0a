package taskescrow.registry.repository;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Per-identity bookkeeping: task lists and completion counters.
 */
public interface ParticipantRepository {

    /**
     * Append a task id to an identity's task list. Lists are never pruned.
     *
     * @param conn     transaction connection
     * @param identity client or freelancer identity
     * @param taskId   the task ID
     */
    void appendTask(Connection conn, String identity, long taskId) throws SQLException;

    /**
     * Increment the completed-task counter of an identity by one.
     *
     * @param conn     transaction connection
     * @param identity client or freelancer identity
     */
    void incrementCompleted(Connection conn, String identity) throws SQLException;

    /**
     * Task ids an identity has been client or freelancer for, in the order they were added.
     *
     * @param identity the identity
     * @return task ids, empty if the identity never took part in a task
     */
    List<Long> findTaskIds(String identity);

    /**
     * Number of completed tasks an identity took part in.
     *
     * @param identity the identity
     * @return count, zero if unknown
     */
    long completedCount(String identity);
}
