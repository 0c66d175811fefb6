package eu.virtualparadox.ragqa.rag.index;

import eu.virtualparadox.ragqa.rag.index.model.Chunk;

import java.io.IOException;
import java.util.List;

/**
 * Write side of the chunk store, fed by the external ingestion pipeline.
 * <p>
 * All vectors supplied to {@link #upsert(String, List, List)} MUST have the same dimension,
 * and the dimension must stay the same for the lifetime of the index.
 */
public interface VectorIndexService {

    /**
     * Replaces every chunk of a document with the given chunk+vector pairs.
     *
     * @param docId   the parent document identifier (non-blank)
     * @param chunks  chunks of the document (non-empty)
     * @param vectors one embedding per chunk, same order
     * @throws IOException              if writing to the underlying index fails
     * @throws IllegalArgumentException if parameters are empty or sizes/dimensions mismatch
     */
    void upsert(String docId, List<Chunk> chunks, List<float[]> vectors) throws IOException;

    /**
     * Removes all indexed chunks belonging to the specified document.
     *
     * @param docId the parent document identifier (non-blank)
     * @throws IOException if the underlying index update fails
     */
    void deleteByDocId(String docId) throws IOException;
}
