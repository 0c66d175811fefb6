package eu.virtualparadox.ragqa.web;

import eu.virtualparadox.ragqa.rag.index.model.Chunk;

/**
 * A chunk and its embedding as delivered by the ingestion pipeline.
 */
public record IndexedChunk(Chunk chunk, float[] vector) {
}
