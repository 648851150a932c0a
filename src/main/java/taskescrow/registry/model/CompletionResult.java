package taskescrow.registry.model;

/**
 * Outcome of a successful completeTask call.
 */
public enum CompletionResult {
    /** Freelancer submission recorded (or re-recorded), client approval still pending */
    SUBMITTED,

    /** Client approval completed the pair: task is COMPLETED and the reward was paid out */
    COMPLETED
}
