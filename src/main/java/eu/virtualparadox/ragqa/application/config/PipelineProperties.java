package eu.virtualparadox.ragqa.application.config;

import eu.virtualparadox.ragqa.rag.config.PipelineConfig;
import eu.virtualparadox.ragqa.rag.retriever.model.RetrievalMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Pipeline settings bound from {@code ragqa.pipeline.*}; unset keys keep the {@link PipelineConfig} defaults.
 */
@Configuration
@ConfigurationProperties(prefix = "ragqa.pipeline")
@Getter @Setter
public class PipelineProperties {

    private static final PipelineConfig DEFAULTS = PipelineConfig.defaults();

    private RetrievalMode mode = DEFAULTS.getMode();
    private int topK = DEFAULTS.getTopK();
    private int vectorTopK = DEFAULTS.getVectorTopK();
    private int keywordTopK = DEFAULTS.getKeywordTopK();
    private int mergeTopK = DEFAULTS.getMergeTopK();
    private double rrfK = DEFAULTS.getRrfK();
    private double hybridAlpha = DEFAULTS.getHybridAlpha();
    private List<String> keywordProperties = new ArrayList<>();
    private String documentFilter;
    private Duration retrievalTimeout = DEFAULTS.getRetrievalTimeout();

    private boolean rerankEnabled = DEFAULTS.isRerankEnabled();
    private int candidateCount = DEFAULTS.getCandidateCount();
    private int judgeConcurrency = DEFAULTS.getJudgeConcurrency();
    private Duration judgeTimeout = DEFAULTS.getJudgeTimeout();
    private Duration rerankTimeout = DEFAULTS.getRerankTimeout();
    private int excerptMaxTokens = DEFAULTS.getExcerptMaxTokens();
    /** Chat model id used by the judge; provider default when blank. */
    private String judgeModel;

    private String generationModel;
    private Double generationTemperature;
    private int contextMaxTokens = DEFAULTS.getContextMaxTokens();
    private int contextMaxChunks = DEFAULTS.getContextMaxChunks();
    private Duration generationTimeout = DEFAULTS.getGenerationTimeout();

    /** Threads of the pipeline executor. */
    private int executorThreads = 8;

    public PipelineConfig toPipelineConfig() {
        return PipelineConfig.builder()
                .mode(mode)
                .topK(topK)
                .vectorTopK(vectorTopK)
                .keywordTopK(keywordTopK)
                .mergeTopK(mergeTopK)
                .rrfK(rrfK)
                .hybridAlpha(hybridAlpha)
                .keywordProperties(keywordProperties)
                .documentFilter(documentFilter)
                .retrievalTimeout(retrievalTimeout)
                .rerankEnabled(rerankEnabled)
                .candidateCount(candidateCount)
                .judgeConcurrency(judgeConcurrency)
                .judgeTimeout(judgeTimeout)
                .rerankTimeout(rerankTimeout)
                .excerptMaxTokens(excerptMaxTokens)
                .generationModel(generationModel)
                .generationTemperature(generationTemperature)
                .contextMaxTokens(contextMaxTokens)
                .contextMaxChunks(contextMaxChunks)
                .generationTimeout(generationTimeout)
                .build();
    }
}
