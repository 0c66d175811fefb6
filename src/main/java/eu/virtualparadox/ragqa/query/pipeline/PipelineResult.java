package eu.virtualparadox.ragqa.query.pipeline;

import eu.virtualparadox.ragqa.rag.answer.Answer;
import eu.virtualparadox.ragqa.rag.index.model.Chunk;

import java.util.List;

/**
 * Outcome of {@link QueryPipeline#runQuery}: exactly one of {@code answer} and {@code error} is set.
 *
 * @param runId        id of the run, also used in log lines
 * @param answer       answer of a successful run
 * @param error        failure of an unsuccessful run
 * @param degradations optional stages that were skipped after a failure, empty when none
 * @param ranking      supporting chunks best first; on failure the partial ranking, possibly empty
 */
public record PipelineResult(String runId,
                             Answer answer,
                             PipelineError error,
                             List<String> degradations,
                             List<Chunk> ranking) {

    public PipelineResult {
        degradations = List.copyOf(degradations);
        ranking = List.copyOf(ranking);
    }

    public static PipelineResult success(final String runId, final Answer answer,
                                         final List<String> degradations, final List<Chunk> ranking) {
        return new PipelineResult(runId, answer, null, degradations, ranking);
    }

    public static PipelineResult failure(final String runId, final PipelineError error,
                                         final List<String> degradations, final List<Chunk> ranking) {
        return new PipelineResult(runId, null, error, degradations, ranking);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isDegraded() {
        return !degradations.isEmpty();
    }
}
