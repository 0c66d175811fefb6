package eu.virtualparadox.ragqa.rag.eval;

/**
 * Verdict of comparing a generated answer with the expected one.
 *
 * @param result    the model's verdict, starting with {@code true} or {@code false}
 * @param same      true when the verdict starts with the word {@code true}
 * @param reasoning the model's explanation, may be {@code null}
 */
public record EvaluationResult(String result, boolean same, String reasoning) {
}
