package taskescrow.registry.funds;

/**
 * Thrown when a payment batch could not be delivered.
 */
public class TransferFailedException extends Exception {

    private final String recipient;

    public TransferFailedException(String recipient, String message) {
        super(message);
        this.recipient = recipient;
    }

    public String recipient() {
        return recipient;
    }
}
