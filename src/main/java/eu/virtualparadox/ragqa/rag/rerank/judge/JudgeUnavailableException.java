package eu.virtualparadox.ragqa.rag.rerank.judge;

/**
 * Service-level failure of one judge call (network, provider error).
 */
public class JudgeUnavailableException extends RuntimeException {

    public JudgeUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
