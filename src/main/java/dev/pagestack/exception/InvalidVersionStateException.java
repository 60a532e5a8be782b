package dev.pagestack.exception;

import lombok.Getter;

/**
 * The requested version operation conflicts with the current state of the page,
 * e.g. deleting the published version or publishing a version of another page.
 */
@Getter
public class InvalidVersionStateException extends RuntimeException {

    private final String messageKey;

    public InvalidVersionStateException(String messageKey, String message) {
        super(message);
        this.messageKey = messageKey;
    }
}
