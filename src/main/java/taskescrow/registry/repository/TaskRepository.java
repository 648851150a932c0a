package taskescrow.registry.repository;

import taskescrow.registry.model.Task;
import taskescrow.registry.model.TaskStatus;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Repository interface for Task persistence.
 * Methods taking a {@link Connection} participate in the caller's transaction.
 */
public interface TaskRepository {

    /**
     * Insert a newly created task.
     *
     * @param conn transaction connection
     * @param task the task to insert
     */
    void insert(Connection conn, Task task) throws SQLException;

    /**
     * Find a task and lock its row until the transaction ends.
     *
     * @param conn   transaction connection
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findForUpdate(Connection conn, long taskId) throws SQLException;

    /**
     * Persist the mutable parts of a task: freelancer, status and confirmation flags.
     *
     * @param conn transaction connection
     * @param task the updated task
     */
    void update(Connection conn, Task task) throws SQLException;

    /**
     * Find a task by ID outside any transaction.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(long taskId);

    /**
     * Count tasks in a status.
     *
     * @param status the status
     * @return count
     */
    int countByStatus(TaskStatus status);
}
