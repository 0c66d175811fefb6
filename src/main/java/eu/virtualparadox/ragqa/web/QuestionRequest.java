package eu.virtualparadox.ragqa.web;

import eu.virtualparadox.ragqa.rag.config.PipelineConfig;
import eu.virtualparadox.ragqa.rag.retriever.model.RetrievalMode;

/**
 * Question plus optional per-run overrides; {@code null} fields keep the configured value.
 */
public record QuestionRequest(String question, RetrievalMode mode, Boolean rerankEnabled, String documentFilter) {

    PipelineConfig applyTo(final PipelineConfig base) {
        final PipelineConfig.PipelineConfigBuilder builder = base.toBuilder();
        if (mode != null) builder.mode(mode);
        if (rerankEnabled != null) builder.rerankEnabled(rerankEnabled);
        if (documentFilter != null) builder.documentFilter(documentFilter);
        return builder.build();
    }
}
