package dev.pagestack.engine.model;

/**
 * Result of one data-source declaration: either the shaped value for {@code scope}
 * or the error that prevented it.
 */
public record RetrievalResult(String scope, Object value, Throwable error) {

    public static RetrievalResult success(String scope, Object value) {
        return new RetrievalResult(scope, value, null);
    }

    public static RetrievalResult failure(String scope, Throwable error) {
        return new RetrievalResult(scope, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
