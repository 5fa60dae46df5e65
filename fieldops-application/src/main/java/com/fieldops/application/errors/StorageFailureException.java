package com.fieldops.application.errors;

/**
 * Opaque storage failure. The message is safe to show; engine detail lives only in the cause.
 */
public class StorageFailureException extends RuntimeException {

    public static final String GENERIC_MESSAGE = "The operation could not be completed";

    public StorageFailureException(Throwable cause) {
        super(GENERIC_MESSAGE, cause);
    }

    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
