package eu.virtualparadox.ragqa.query.pipeline;

/**
 * Observes stage entries of a run; called on the thread running the pipeline.
 */
@FunctionalInterface
public interface PipelineListener {

    PipelineListener NONE = (runId, stage) -> { };

    void onStage(String runId, PipelineStage stage);
}
