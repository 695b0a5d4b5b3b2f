package com.fileprovider.provider;

/**
 * Failure of a provider operation.
 *
 * <p>The message is meant for the caller and always names the alias, file or
 * key involved where one is known.</p>
 */
public class ProviderException extends RuntimeException {

    private final ErrorKind kind;

    public ProviderException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProviderException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ProviderException invalidInput(String message) {
        return new ProviderException(ErrorKind.INVALID_INPUT, message);
    }

    public static ProviderException notFound(String message) {
        return new ProviderException(ErrorKind.NOT_FOUND, message);
    }

    public static ProviderException conflict(String message) {
        return new ProviderException(ErrorKind.CONFLICT, message);
    }

    public static ProviderException failedPrecondition(String message) {
        return new ProviderException(ErrorKind.FAILED_PRECONDITION, message);
    }

    public static ProviderException internal(String message, Throwable cause) {
        return new ProviderException(ErrorKind.INTERNAL, message, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Copy of this exception with a suffix appended to the message, keeping kind and cause.
     */
    public ProviderException withSuffix(String suffix) {
        ProviderException copy = new ProviderException(kind, getMessage() + suffix, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
