package eu.virtualparadox.ragqa.query.pipeline;

/**
 * States of one pipeline run. {@link #DONE} and {@link #FAILED} are absorbing.
 */
public enum PipelineStage {
    ENCODE,
    RETRIEVE,
    RERANK,
    GENERATE,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
