package eu.virtualparadox.ragqa.rag.answer;

import eu.virtualparadox.ragqa.rag.ErrorKind;
import lombok.Getter;

@Getter
public class GenerationException extends RuntimeException {

    private final ErrorKind kind;

    public GenerationException(final ErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
