package eu.virtualparadox.ragqa.rag.config;

import eu.virtualparadox.ragqa.rag.retriever.model.RetrievalMode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

import static eu.virtualparadox.ragqa.util.LuceneConstants.*;

/**
 * Immutable settings for one pipeline run.
 * <p>
 * Obtain a customised copy with {@code PipelineConfig.defaults().toBuilder()...build()}.
 */
@Value
@Builder(toBuilder = true)
public class PipelineConfig {

    @Builder.Default
    RetrievalMode mode = RetrievalMode.FUSION;

    /** Result count for vector, keyword and hybrid modes. */
    @Builder.Default
    int topK = 10;

    @Builder.Default
    int vectorTopK = 20;

    @Builder.Default
    int keywordTopK = 20;

    /** Fusion output cap. */
    @Builder.Default
    int mergeTopK = 10;

    /** Reciprocal Rank Fusion smoothing constant. */
    @Builder.Default
    double rrfK = 60.0;

    /** Vector weight of native hybrid search, 1.0 = pure vector. */
    @Builder.Default
    double hybridAlpha = 0.5;

    @Singular
    List<String> keywordProperties;

    /** Restricts retrieval to one document when non-blank. */
    String documentFilter;

    @Builder.Default
    Duration retrievalTimeout = Duration.ofSeconds(15);

    @Builder.Default
    boolean rerankEnabled = true;

    @Builder.Default
    int candidateCount = 5;

    /** Maximum judge calls in flight. */
    @Builder.Default
    int judgeConcurrency = 4;

    @Builder.Default
    Duration judgeTimeout = Duration.ofSeconds(30);

    @Builder.Default
    Duration rerankTimeout = Duration.ofSeconds(120);

    /** Token budget of the chunk excerpt shown to the judge. */
    @Builder.Default
    int excerptMaxTokens = 128;

    /** Model id forwarded to the chat model; provider default when null. */
    String generationModel;

    Double generationTemperature;

    @Builder.Default
    int contextMaxTokens = 3000;

    @Builder.Default
    int contextMaxChunks = 10;

    @Builder.Default
    Duration generationTimeout = Duration.ofSeconds(120);

    public static PipelineConfig defaults() {
        return PipelineConfig.builder().build();
    }

    /**
     * Keyword properties, falling back to text, section title and keywords.
     */
    public List<String> effectiveKeywordProperties() {
        return keywordProperties.isEmpty()
                ? List.of(FIELD_TEXT, FIELD_SECTION_TITLE, FIELD_KEYWORDS)
                : keywordProperties;
    }

    /**
     * @throws IllegalArgumentException if any setting is out of range
     */
    public void validate() {
        requirePositive(topK, "topK");
        requirePositive(vectorTopK, "vectorTopK");
        requirePositive(keywordTopK, "keywordTopK");
        requirePositive(mergeTopK, "mergeTopK");
        requirePositive(candidateCount, "candidateCount");
        requirePositive(judgeConcurrency, "judgeConcurrency");
        requirePositive(excerptMaxTokens, "excerptMaxTokens");
        requirePositive(contextMaxTokens, "contextMaxTokens");
        requirePositive(contextMaxChunks, "contextMaxChunks");
        if (mode == null) {
            throw new IllegalArgumentException("mode must not be null");
        }
        if (rrfK < 0) {
            throw new IllegalArgumentException("rrfK must be >= 0, got: " + rrfK);
        }
        if (hybridAlpha < 0 || hybridAlpha > 1) {
            throw new IllegalArgumentException("hybridAlpha must be within [0,1], got: " + hybridAlpha);
        }
        requirePositive(retrievalTimeout, "retrievalTimeout");
        requirePositive(judgeTimeout, "judgeTimeout");
        requirePositive(rerankTimeout, "rerankTimeout");
        requirePositive(generationTimeout, "generationTimeout");
    }

    private static void requirePositive(final int value, final String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0, got: " + value);
        }
    }

    private static void requirePositive(final Duration value, final String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration, got: " + value);
        }
    }
}
