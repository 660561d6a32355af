package app.semble.core.common.error;

public class PublisherAuthenticationException extends CoreException {

    public PublisherAuthenticationException(String message) {
        super(message);
    }

    public PublisherAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
