package eu.virtualparadox.ragqa.rag.embed;

public class EmbeddingException extends RuntimeException {

    public EmbeddingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
