package taskescrow.registry.model;

/**
 * Notifications emitted by the registry, in the order they happen within an operation.
 */
public interface TaskEvent {

    long taskId();

    /** Emitted by createTask */
    record TaskCreated(long taskId, String client, String title, long reward) implements TaskEvent {
    }

    /** Emitted by acceptTask */
    record TaskAssigned(long taskId, String freelancer) implements TaskEvent {
    }

    /** Emitted when the second confirmation completes the task, before {@link PaymentReleased} */
    record TaskCompleted(long taskId, String freelancer, String client) implements TaskEvent {
    }

    /** Emitted by cancelTask */
    record TaskCancelled(long taskId, String client) implements TaskEvent {
    }

    /** Amount paid to the freelancer, net of the platform fee */
    record PaymentReleased(long taskId, String freelancer, long amount) implements TaskEvent {
    }
}
