package eu.virtualparadox.ragqa.rag.rerank.service;

import eu.virtualparadox.ragqa.rag.ErrorKind;

/**
 * Every judge call of a rerank pass failed. Callers may keep the fused order instead.
 */
public class RerankUnavailableException extends RuntimeException {

    public RerankUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ErrorKind getKind() {
        return ErrorKind.RERANK_UNAVAILABLE;
    }
}
