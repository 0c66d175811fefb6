package eu.virtualparadox.ragqa.rag.retriever.service;

import eu.virtualparadox.ragqa.rag.config.PipelineConfig;
import eu.virtualparadox.ragqa.rag.retriever.RetrievalException;
import eu.virtualparadox.ragqa.rag.retriever.model.Query;
import eu.virtualparadox.ragqa.rag.retriever.model.RetrievalMode;
import eu.virtualparadox.ragqa.rag.retriever.model.RetrievalResult;

public interface RetrieverService {

    /**
     * Retrieves the chunks supporting a question.
     *
     * @param query  question, with its embedding when already encoded
     * @param mode   retrieval strategy
     * @param config run settings
     * @return ranked, deduplicated results plus the per-leg candidates
     * @throws RetrievalException if the backend is unavailable or times out
     */
    RetrievalResult retrieve(Query query, RetrievalMode mode, PipelineConfig config);
}
