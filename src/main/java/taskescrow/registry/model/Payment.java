package taskescrow.registry.model;

import java.util.Objects;

/**
 * A single outgoing value transfer from the registry's custody.
 */
public record Payment(String recipient, long amount) {

    public Payment {
        Objects.requireNonNull(recipient, "recipient is required");
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
    }
}
