package eu.virtualparadox.ragqa.rag.index.model;

/**
 * @param chunkId identifier of the matched chunk
 * @param score   backend score (higher = better); only comparable within one result list
 */
public record SearchHit(String chunkId, float score) {

}
