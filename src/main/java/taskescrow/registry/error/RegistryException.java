package taskescrow.registry.error;

/**
 * Synchronous rejection of a registry operation. No state was changed.
 */
public class RegistryException extends RuntimeException {

    private final RegistryError error;

    public RegistryException(RegistryError error, String message) {
        super(message);
        this.error = error;
    }

    public RegistryException(RegistryError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public RegistryError error() {
        return error;
    }

    public static RegistryException notFound(long taskId) {
        return new RegistryException(RegistryError.NOT_FOUND, "task " + taskId + " does not exist");
    }

    public static RegistryException unauthorized(String message) {
        return new RegistryException(RegistryError.UNAUTHORIZED, message);
    }

    public static RegistryException invalidState(String message) {
        return new RegistryException(RegistryError.INVALID_STATE, message);
    }

    public static RegistryException invalidInput(String message) {
        return new RegistryException(RegistryError.INVALID_INPUT, message);
    }

    public static RegistryException transferFailed(String message, Throwable cause) {
        return new RegistryException(RegistryError.TRANSFER_FAILURE, message, cause);
    }
}
