package app.semble.core.common.error;

public class UnexpectedException extends CoreException {

    public UnexpectedException(String message, Throwable cause) {
        super(message, cause);
    }

    public UnexpectedException(String message) {
        super(message);
    }
}
