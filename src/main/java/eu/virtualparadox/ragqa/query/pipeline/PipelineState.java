package eu.virtualparadox.ragqa.query.pipeline;

import eu.virtualparadox.ragqa.rag.answer.Answer;
import eu.virtualparadox.ragqa.rag.config.PipelineConfig;
import eu.virtualparadox.ragqa.rag.index.model.Chunk;
import eu.virtualparadox.ragqa.rag.rerank.model.RerankResult;
import eu.virtualparadox.ragqa.rag.retriever.model.FusedResult;
import eu.virtualparadox.ragqa.rag.retriever.model.Query;
import eu.virtualparadox.ragqa.rag.retriever.model.RetrievalCandidate;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulator of one run. Owned by a single {@link QueryPipeline} traversal and never shared.
 */
@Getter
@Setter
class PipelineState {

    private final String runId;
    private final PipelineConfig config;

    private Query query;
    private List<RetrievalCandidate> candidates = List.of();
    private List<FusedResult> fused = List.of();
    /** {@code null} while reranking has not run or was skipped. */
    private List<RerankResult> reranked;
    private Answer answer;
    private PipelineStage stage = PipelineStage.ENCODE;
    private PipelineError error;
    private final List<String> degradations = new ArrayList<>();

    PipelineState(final String runId, final String question, final PipelineConfig config) {
        this.runId = runId;
        this.config = config;
        this.query = Query.of(question);
    }

    /**
     * Best ranking so far: reranked when reranking succeeded, else fused.
     */
    List<Chunk> ranking() {
        if (reranked != null) {
            return reranked.stream().map(RerankResult::chunk).toList();
        }
        return fused.stream().map(FusedResult::chunk).toList();
    }

    void degrade(final String reason) {
        degradations.add(reason);
    }
}
