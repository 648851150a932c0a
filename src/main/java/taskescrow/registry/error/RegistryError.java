package taskescrow.registry.error;

/**
 * Rejection reasons surfaced by the registry.
 */
public enum RegistryError {
    /** Referenced task id does not exist */
    NOT_FOUND("task_not_found"),

    /** Caller lacks the required role (owner, client or freelancer) */
    UNAUTHORIZED("unauthorized"),

    /** Transition is illegal from the task's current status */
    INVALID_STATE("invalid_state"),

    /** Caller-supplied value violates a precondition */
    INVALID_INPUT("invalid_input"),

    /** Funds could not be delivered; the whole operation was rolled back */
    TRANSFER_FAILURE("transfer_failed");

    private final String code;

    RegistryError(String code) {
        this.code = code;
    }

    /** Stable wire code used in API responses */
    public String code() {
        return code;
    }
}
