package eu.virtualparadox.ragqa.rag.retriever.model;

/**
 * One hit of one retrieval leg.
 *
 * @param chunkId    matched chunk
 * @param score      backend score within the leg
 * @param rank       1-based position within the leg
 * @param sourceMode leg that produced the hit
 */
public record RetrievalCandidate(String chunkId, double score, int rank, SourceMode sourceMode) {

}
