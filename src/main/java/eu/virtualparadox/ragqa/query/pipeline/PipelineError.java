package eu.virtualparadox.ragqa.query.pipeline;

import eu.virtualparadox.ragqa.rag.ErrorKind;

/**
 * Why a run ended in {@link PipelineStage#FAILED}.
 *
 * @param stage                   stage that was running when the run failed
 * @param kind                    failure category
 * @param message                 human readable detail
 * @param partialRankingAvailable true when retrieval had produced a ranking before the failure
 */
public record PipelineError(PipelineStage stage, ErrorKind kind, String message, boolean partialRankingAvailable) {
}
