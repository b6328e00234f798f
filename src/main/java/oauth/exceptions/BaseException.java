package oauth.exceptions;

/**
 * Misuse of the client admin API. The error code ends up in the {@code error} field of the JSON error body, the
 * HTTP status comes from the {@code @ResponseStatus} of the subclass.
 */
public abstract class BaseException extends RuntimeException {

    private final String errorCode;

    protected BaseException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    //caused by the caller, a stack trace adds nothing to the log
    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }

    @Override
    public String toString() {
        return String.format("%s %s: %s", getClass().getSimpleName(), errorCode, getMessage());
    }
}
