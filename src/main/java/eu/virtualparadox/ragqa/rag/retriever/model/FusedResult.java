package eu.virtualparadox.ragqa.rag.retriever.model;

import eu.virtualparadox.ragqa.rag.index.model.Chunk;

/**
 * @param chunkId    identifier of the chunk, unique within one result list
 * @param fusedScore RRF score in fusion mode, backend score otherwise
 * @param chunk      the resolved chunk
 */
public record FusedResult(String chunkId, double fusedScore, Chunk chunk) {

}
