package eu.virtualparadox.ragqa.rag.eval;

public class EvaluationException extends RuntimeException {

    public EvaluationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
