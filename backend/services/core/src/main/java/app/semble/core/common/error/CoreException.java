package app.semble.core.common.error;

/**
 * Root of the typed failures raised by the core. Each subclass is a distinct
 * category that callers are expected to handle differently.
 */
public abstract class CoreException extends RuntimeException {

    protected CoreException(String message) {
        super(message);
    }

    protected CoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
