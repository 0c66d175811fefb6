package eu.virtualparadox.ragqa.rag.index;

/**
 * Raised when the chunk store cannot be reached or fails to execute a query.
 */
public class SearchBackendException extends RuntimeException {

    public SearchBackendException(final String message) {
        super(message);
    }

    public SearchBackendException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
