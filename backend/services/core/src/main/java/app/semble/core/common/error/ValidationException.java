package app.semble.core.common.error;

public class ValidationException extends CoreException {

    public ValidationException(String message) {
        super(message);
    }
}
