package dev.pagestack.exception;

import lombok.Getter;

/**
 * A page or page version does not exist. {@code messageKey} is resolved against the
 * message bundle for the response; the detail message is for logs.
 */
@Getter
public class ResourceNotFoundException extends RuntimeException {

    private final String messageKey;

    public ResourceNotFoundException(String messageKey, String message) {
        super(message);
        this.messageKey = messageKey;
    }

    public static ResourceNotFoundException page(Long pageId) {
        return new ResourceNotFoundException("error.page_not_found", "Page not found: " + pageId);
    }

    public static ResourceNotFoundException version(Long versionId) {
        return new ResourceNotFoundException("error.version_not_found", "Page version not found: " + versionId);
    }
}
