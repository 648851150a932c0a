package taskescrow.registry.model;

/**
 * Escrowed task lifecycle status.
 */
public enum TaskStatus {
    /** Task created and funded, waiting for a freelancer */
    OPEN,
    /** Task accepted by a freelancer, waiting for both confirmations */
    ASSIGNED,
    /** Both parties confirmed, reward paid out */
    COMPLETED,
    /** Reserved. No operation moves a task into or out of this state */
    DISPUTED,
    /** Cancelled by the client before assignment, reward refunded */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
