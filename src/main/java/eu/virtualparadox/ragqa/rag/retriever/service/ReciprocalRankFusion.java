package eu.virtualparadox.ragqa.rag.retriever.service;

import eu.virtualparadox.ragqa.rag.retriever.model.RetrievalCandidate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal Rank Fusion of a vector list and a keyword list.
 * <p>
 * A chunk at 1-based rank {@code r} in a list accrues {@code 1 / (rrfK + r)}; contributions
 * from both lists are summed, a list where the chunk is absent contributes nothing.
 * <p>
 * Ordering: summed score descending, then the better (lower) rank in the vector list
 * (chunks absent from it come last), then chunk id ascending. The result is deterministic
 * for identical inputs.
 */
@Component
public class ReciprocalRankFusion {

    /**
     * @param chunkId     fused chunk
     * @param score       summed reciprocal rank
     * @param vectorRank  rank in the vector list, {@code Integer.MAX_VALUE} when absent
     * @param keywordRank rank in the keyword list, {@code Integer.MAX_VALUE} when absent
     */
    public record FusedScore(String chunkId, double score, int vectorRank, int keywordRank) {
    }

    private static final Comparator<FusedScore> ORDER = Comparator
            .comparingDouble(FusedScore::score).reversed()
            .thenComparingInt(FusedScore::vectorRank)
            .thenComparing(FusedScore::chunkId);

    /**
     * Fuses two ranked lists.
     *
     * @param vectorHits  vector leg, in rank order
     * @param keywordHits keyword leg, in rank order
     * @param rrfK        smoothing constant, {@code >= 0}
     * @param limit       maximum number of fused entries
     * @return fused entries, at most {@code limit}, one per chunk id
     */
    public List<FusedScore> fuse(final List<RetrievalCandidate> vectorHits,
                                 final List<RetrievalCandidate> keywordHits,
                                 final double rrfK,
                                 final int limit) {
        final Map<String, double[]> scores = new LinkedHashMap<>();
        final Map<String, int[]> ranks = new LinkedHashMap<>();

        accumulate(vectorHits, rrfK, 0, scores, ranks);
        accumulate(keywordHits, rrfK, 1, scores, ranks);

        final List<FusedScore> fused = new ArrayList<>(scores.size());
        for (final Map.Entry<String, double[]> e : scores.entrySet()) {
            final int[] r = ranks.get(e.getKey());
            fused.add(new FusedScore(e.getKey(), e.getValue()[0], r[0], r[1]));
        }
        fused.sort(ORDER);
        return fused.size() > limit ? List.copyOf(fused.subList(0, limit)) : List.copyOf(fused);
    }

    private void accumulate(final List<RetrievalCandidate> hits,
                            final double rrfK,
                            final int listIndex,
                            final Map<String, double[]> scores,
                            final Map<String, int[]> ranks) {
        int rank = 0;
        for (final RetrievalCandidate hit : hits) {
            rank++;
            final int[] seen = ranks.computeIfAbsent(hit.chunkId(), k -> new int[]{Integer.MAX_VALUE, Integer.MAX_VALUE});
            if (seen[listIndex] != Integer.MAX_VALUE) {
                // same chunk twice in one list: first (best) rank counts
                continue;
            }
            seen[listIndex] = rank;
            scores.computeIfAbsent(hit.chunkId(), k -> new double[1])[0] += 1.0 / (rrfK + rank);
        }
    }
}
