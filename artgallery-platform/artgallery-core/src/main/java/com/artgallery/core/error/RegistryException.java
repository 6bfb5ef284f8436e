package com.artgallery.core.error;

/**
 * Raised by the registry when an operation cannot be completed.
 * The kind identifies the failure for callers; the message is the human-readable reason.
 */
public class RegistryException extends RuntimeException {

    private final ErrorKind kind;

    public RegistryException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RegistryException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static RegistryException invalidArgument(String message) {
        return new RegistryException(ErrorKind.INVALID_ARGUMENT, message);
    }

    public static RegistryException notFound(String message) {
        return new RegistryException(ErrorKind.NOT_FOUND, message);
    }

    public static RegistryException unauthorized(String message) {
        return new RegistryException(ErrorKind.UNAUTHORIZED, message);
    }

    /**
     * Fails with {@link ErrorKind#INVALID_ARGUMENT} when the value is null or blank.
     */
    public static String requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw invalidArgument(message);
        }
        return value;
    }
}
