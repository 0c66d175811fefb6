package eu.virtualparadox.ragqa.rag.retriever.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * The question of one pipeline run and, once encoded, its embedding.
 *
 * @param text   question text
 * @param vector question embedding, {@code null} until encoded or for keyword-only runs
 */
public record Query(String text, float[] vector) {

    public Query {
        Objects.requireNonNull(text, "text must not be null");
    }

    public static Query of(final String text) {
        return new Query(text, null);
    }

    public Query withVector(final float[] embedding) {
        return new Query(text, embedding);
    }

    public boolean isEncoded() {
        return vector != null && vector.length > 0;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof Query other)) return false;
        return text.equals(other.text) && Arrays.equals(vector, other.vector);
    }

    @Override
    public int hashCode() {
        return 31 * text.hashCode() + Arrays.hashCode(vector);
    }

    @Override
    public String toString() {
        return "Query[text=" + text + ", dims=" + (vector == null ? 0 : vector.length) + "]";
    }
}
