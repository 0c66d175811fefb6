package eu.virtualparadox.ragqa.rag.index;

import eu.virtualparadox.ragqa.rag.index.model.Chunk;
import eu.virtualparadox.ragqa.rag.index.model.SearchFilter;
import eu.virtualparadox.ragqa.rag.index.model.SearchHit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the chunk store: vector kNN, lexical and combined queries.
 * <p>
 * All search methods return hits ordered by score, best first, with at most {@code topK}
 * entries. Implementations must be safe for concurrent use.
 * Any failure to reach the store is reported as {@link SearchBackendException}.
 */
public interface SearchBackend {

    /**
     * k-nearest-neighbour search over chunk embeddings.
     *
     * @param vector query embedding
     * @param topK   maximum number of hits
     * @param filter restriction, never null
     * @return hits ordered by similarity, descending
     */
    List<SearchHit> vectorSearch(float[] vector, int topK, SearchFilter filter);

    /**
     * BM25 search over the given text properties.
     *
     * @param text       raw question text
     * @param properties indexed properties to search
     * @param topK       maximum number of hits
     * @param filter     restriction, never null
     * @return hits ordered by lexical score, descending
     */
    List<SearchHit> keywordSearch(String text, List<String> properties, int topK, SearchFilter filter);

    /**
     * Native combined vector + keyword search.
     *
     * @param text       raw question text
     * @param vector     query embedding
     * @param properties indexed properties the keyword side searches
     * @param topK       maximum number of hits
     * @param alpha      weight of the vector side in [0,1]; 1 means pure vector
     * @param filter     restriction, never null
     * @return hits ordered by combined score, descending
     * @throws UnsupportedOperationException if {@link #supportsHybrid()} is false
     */
    List<SearchHit> hybridSearch(String text, float[] vector, List<String> properties, int topK, double alpha, SearchFilter filter);

    /**
     * @return whether {@link #hybridSearch} is available
     */
    boolean supportsHybrid();

    /**
     * Loads a chunk by id.
     */
    Optional<Chunk> fetchChunk(String chunkId);

    /**
     * Loads several chunks, silently skipping ids that do not resolve.
     */
    default List<Chunk> fetchChunks(final Collection<String> chunkIds) {
        final List<Chunk> chunks = new ArrayList<>(chunkIds.size());
        for (final String chunkId : chunkIds) {
            fetchChunk(chunkId).ifPresent(chunks::add);
        }
        return chunks;
    }
}
