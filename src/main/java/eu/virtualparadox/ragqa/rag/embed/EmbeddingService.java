package eu.virtualparadox.ragqa.rag.embed;

/**
 * Computes dense vector embeddings for question text.
 * <p>
 * Implementations must be deterministic for a fixed model and version, since the
 * stored chunk vectors were produced by the same model.
 */
public interface EmbeddingService {

    /**
     * Embeds a single query string into dense vector space.
     *
     * @param text the query string (non-null, non-blank)
     * @return a dense vector representation of the query
     * @throws EmbeddingException if the embedding model cannot be reached
     */
    float[] embedQuery(String text);
}
