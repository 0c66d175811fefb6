package eu.virtualparadox.ragqa.query.pipeline;

import eu.virtualparadox.ragqa.rag.ErrorKind;
import eu.virtualparadox.ragqa.rag.answer.AnswerService;
import eu.virtualparadox.ragqa.rag.answer.GenerationException;
import eu.virtualparadox.ragqa.rag.config.PipelineConfig;
import eu.virtualparadox.ragqa.rag.embed.EmbeddingException;
import eu.virtualparadox.ragqa.rag.embed.EmbeddingService;
import eu.virtualparadox.ragqa.rag.rerank.model.RerankResult;
import eu.virtualparadox.ragqa.rag.rerank.service.RerankService;
import eu.virtualparadox.ragqa.rag.rerank.service.RerankUnavailableException;
import eu.virtualparadox.ragqa.rag.retriever.RetrievalException;
import eu.virtualparadox.ragqa.rag.retriever.model.RetrievalResult;
import eu.virtualparadox.ragqa.rag.retriever.service.RetrieverService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

/**
 * Sequences one question through the stages
 * <pre>
 *   ENCODE -> RETRIEVE -> [RERANK] -> GENERATE -> DONE
 *      \          \           \           \
 *       +----------+-----------+-----------+--> FAILED
 * </pre>
 * <ul>
 *   <li>ENCODE is skipped for keyword-only retrieval.</li>
 *   <li>RERANK is entered only when enabled and retrieval found something; when every judge call
 *       fails the run continues with the fused order and is flagged as degraded.</li>
 *   <li>Embedding, retrieval and generation failures end the run in FAILED.</li>
 *   <li>An interrupted caller thread ends the run in FAILED with kind CANCELLED.</li>
 * </ul>
 * The call is synchronous; stage internals run on the pipeline executor.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QueryPipeline {

    private final EmbeddingService embeddingService;
    private final RetrieverService retrieverService;
    private final RerankService rerankService;
    private final AnswerService answerService;

    public PipelineResult runQuery(final String question, final PipelineConfig config) {
        return runQuery(question, config, PipelineListener.NONE);
    }

    /**
     * @throws IllegalArgumentException for a blank question or an invalid config
     */
    public PipelineResult runQuery(final String question, final PipelineConfig config, final PipelineListener listener) {
        if (StringUtils.isBlank(question)) {
            throw new IllegalArgumentException("Question must not be blank");
        }
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        config.validate();

        final PipelineState state = new PipelineState(UUID.randomUUID().toString(), question.strip(), config);
        state.setStage(config.getMode().needsEmbedding() ? PipelineStage.ENCODE : PipelineStage.RETRIEVE);
        log.info("[{}] Running query mode={} rerank={}", state.getRunId(), config.getMode(), config.isRerankEnabled());

        while (!state.getStage().isTerminal()) {
            final PipelineStage current = state.getStage();
            final long started = System.nanoTime();
            final PipelineStage next = step(current, state, listener);
            log.info("[{}] {} -> {} in {} ms", state.getRunId(), current, next,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            state.setStage(next);
        }
        return toResult(state);
    }

    private PipelineStage step(final PipelineStage stage, final PipelineState state, final PipelineListener listener) {
        if (Thread.currentThread().isInterrupted()) {
            return fail(state, stage, ErrorKind.CANCELLED, "Run cancelled");
        }
        listener.onStage(state.getRunId(), stage);
        try {
            return switch (stage) {
                case ENCODE -> encode(state);
                case RETRIEVE -> retrieve(state);
                case RERANK -> rerank(state);
                case GENERATE -> generate(state);
                default -> throw new IllegalStateException("No transition out of " + stage);
            };
        } catch (final CancellationException e) {
            return fail(state, stage, ErrorKind.CANCELLED, "Run cancelled");
        }
    }

    private PipelineStage encode(final PipelineState state) {
        try {
            final float[] vector = embeddingService.embedQuery(state.getQuery().text());
            state.setQuery(state.getQuery().withVector(vector));
            return PipelineStage.RETRIEVE;
        } catch (final EmbeddingException e) {
            return fail(state, PipelineStage.ENCODE, ErrorKind.EMBEDDING_UNAVAILABLE, e.getMessage());
        }
    }

    private PipelineStage retrieve(final PipelineState state) {
        final RetrievalResult result;
        try {
            result = retrieverService.retrieve(state.getQuery(), state.getConfig().getMode(), state.getConfig());
        } catch (final RetrievalException e) {
            return fail(state, PipelineStage.RETRIEVE, e.getKind(), e.getMessage());
        } catch (final EmbeddingException e) {
            return fail(state, PipelineStage.RETRIEVE, ErrorKind.EMBEDDING_UNAVAILABLE, e.getMessage());
        }
        state.setCandidates(result.candidates());
        state.setFused(result.fused());
        log.info("[{}] Retrieved {} chunks ({} candidates, mode={})",
                state.getRunId(), result.fused().size(), result.candidates().size(), result.mode());

        if (state.getConfig().isRerankEnabled() && !result.fused().isEmpty()) {
            return PipelineStage.RERANK;
        }
        return PipelineStage.GENERATE;
    }

    private PipelineStage rerank(final PipelineState state) {
        try {
            final List<RerankResult> reranked =
                    rerankService.rerank(state.getQuery().text(), state.getFused(), state.getConfig());
            state.setReranked(reranked);
        } catch (final RerankUnavailableException e) {
            log.warn("[{}] Reranking unavailable, keeping fused order: {}", state.getRunId(), e.getMessage());
            state.degrade(e.getKind() + ": " + e.getMessage());
        }
        return PipelineStage.GENERATE;
    }

    private PipelineStage generate(final PipelineState state) {
        try {
            state.setAnswer(answerService.generate(state.getQuery().text(), state.ranking(), state.getConfig()));
            return PipelineStage.DONE;
        } catch (final GenerationException e) {
            return fail(state, PipelineStage.GENERATE, e.getKind(), e.getMessage());
        }
    }

    private PipelineStage fail(final PipelineState state, final PipelineStage stage,
                               final ErrorKind kind, final String message) {
        final boolean partial = !state.ranking().isEmpty();
        state.setError(new PipelineError(stage, kind, message, partial));
        state.setAnswer(null);
        if (kind == ErrorKind.CANCELLED) {
            log.info("[{}] Cancelled during {}", state.getRunId(), stage);
        } else {
            log.error("[{}] Failed during {}: {} {}", state.getRunId(), stage, kind, message);
        }
        return PipelineStage.FAILED;
    }

    private PipelineResult toResult(final PipelineState state) {
        if (state.getStage() == PipelineStage.FAILED) {
            return PipelineResult.failure(state.getRunId(), state.getError(), state.getDegradations(), state.ranking());
        }
        log.info("[{}] Done, {} citations{}", state.getRunId(), state.getAnswer().citations().size(),
                state.getDegradations().isEmpty() ? "" : " (degraded)");
        return PipelineResult.success(state.getRunId(), state.getAnswer(), state.getDegradations(), state.ranking());
    }
}
