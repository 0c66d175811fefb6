package eu.virtualparadox.ragqa.rag.retriever;

import eu.virtualparadox.ragqa.rag.ErrorKind;
import lombok.Getter;

/**
 * Retrieval failed as a whole; no partial results are returned.
 */
@Getter
public class RetrievalException extends RuntimeException {

    private final ErrorKind kind;

    public RetrievalException(final ErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
