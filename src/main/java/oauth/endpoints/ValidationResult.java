package oauth.endpoints;

import lombok.Getter;

import java.util.function.Function;

/**
 * Outcome of one validation step: either a value or an error with a description meant for the client developer.
 */
@Getter
public class ValidationResult<T> {

    private final T value;
    private final ErrorKind error;
    private final String description;

    private ValidationResult(T value, ErrorKind error, String description) {
        this.value = value;
        this.error = error;
        this.description = description;
    }

    public static <T> ValidationResult<T> ok(T value) {
        return new ValidationResult<>(value, null, null);
    }

    public static <T> ValidationResult<T> error(ErrorKind error, String description) {
        return new ValidationResult<>(null, error, description);
    }

    public boolean isValid() {
        return error == null;
    }

    /**
     * Carries the error of this result over to a result of another type.
     */
    public <R> ValidationResult<R> propagate() {
        if (isValid()) {
            throw new IllegalStateException("A valid result has no error to propagate");
        }
        return new ValidationResult<>(null, error, description);
    }

    public <R> ValidationResult<R> flatMap(Function<T, ValidationResult<R>> next) {
        return isValid() ? next.apply(value) : propagate();
    }

    public <R> ValidationResult<R> map(Function<T, R> mapper) {
        return isValid() ? ok(mapper.apply(value)) : propagate();
    }
}
