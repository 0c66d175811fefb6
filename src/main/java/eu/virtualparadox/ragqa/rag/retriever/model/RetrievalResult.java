package eu.virtualparadox.ragqa.rag.retriever.model;

import java.util.List;

/**
 * @param mode       mode that actually ran (hybrid may run as fusion)
 * @param candidates every per-leg hit, in leg order
 * @param fused      deduplicated results, best first
 */
public record RetrievalResult(RetrievalMode mode, List<RetrievalCandidate> candidates, List<FusedResult> fused) {

    public RetrievalResult {
        candidates = List.copyOf(candidates);
        fused = List.copyOf(fused);
    }
}
