package dev.pagestack.exception;

/**
 * Wraps unexpected failures of version store operations with the operation that failed.
 */
public class VersionOperationException extends RuntimeException {

    public VersionOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
