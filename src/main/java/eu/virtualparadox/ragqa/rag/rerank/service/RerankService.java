package eu.virtualparadox.ragqa.rag.rerank.service;

import eu.virtualparadox.ragqa.rag.config.PipelineConfig;
import eu.virtualparadox.ragqa.rag.rerank.model.RerankResult;
import eu.virtualparadox.ragqa.rag.retriever.model.FusedResult;

import java.util.List;

/**
 * Service interface for re-ranking retrieved results.
 * <p>
 * A re-ranker assigns a refined relevance score to each candidate based on the question
 * and the candidate content. Only the first {@code candidateCount} candidates are scored;
 * the returned list never holds more than that.
 */
public interface RerankService {

    /**
     * Rerank the given results for the specified question.
     *
     * @param question   the user question
     * @param candidates fused retrieval results, best first
     * @param config     run settings
     * @return at most {@code min(candidateCount, candidates.size())} results, most relevant first
     * @throws RerankUnavailableException if no candidate could be judged at all
     */
    List<RerankResult> rerank(String question, List<FusedResult> candidates, PipelineConfig config);
}
