package eu.virtualparadox.ragqa.rag.rerank.model;

import eu.virtualparadox.ragqa.rag.index.model.Chunk;

/**
 * @param chunkId        identifier of the chunk
 * @param relevanceScore judge score, {@link #UNSCORED} when the judge gave no usable score
 * @param chunk          the chunk itself
 */
public record RerankResult(String chunkId, double relevanceScore, Chunk chunk) {

    /** Score of candidates the judge could not score; they keep their retrieval order. */
    public static final double UNSCORED = Double.NEGATIVE_INFINITY;

    public static RerankResult unscored(final Chunk chunk) {
        return new RerankResult(chunk.chunkId(), UNSCORED, chunk);
    }

    public boolean isScored() {
        return relevanceScore != UNSCORED;
    }
}
