package eu.virtualparadox.ragqa.query;

import eu.virtualparadox.ragqa.application.config.PipelineProperties;
import eu.virtualparadox.ragqa.application.executor.QuestionExecutor;
import eu.virtualparadox.ragqa.query.pipeline.PipelineResult;
import eu.virtualparadox.ragqa.query.pipeline.PipelineStage;
import eu.virtualparadox.ragqa.query.pipeline.QueryPipeline;
import eu.virtualparadox.ragqa.query.question.EQuestionStatus;
import eu.virtualparadox.ragqa.query.question.QuestionJob;
import eu.virtualparadox.ragqa.query.question.QuestionRegistry;
import eu.virtualparadox.ragqa.rag.ErrorKind;
import eu.virtualparadox.ragqa.rag.config.PipelineConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.Future;

import static eu.virtualparadox.ragqa.query.question.EQuestionStatus.*;

/**
 * Entry point for questions: synchronous runs and asynchronous, cancellable jobs.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QueryManager {

    private final QueryPipeline pipeline;
    private final QuestionRegistry registry;
    private final QuestionExecutor questionExecutor;
    private final PipelineProperties properties;

    public PipelineResult runQuery(final String question) {
        return runQuery(question, properties.toPipelineConfig());
    }

    public PipelineResult runQuery(final String question, final PipelineConfig config) {
        return pipeline.runQuery(question, config);
    }

    public QuestionJob submitQuery(final String question) {
        return submitQuery(question, properties.toPipelineConfig());
    }

    /**
     * @throws IllegalArgumentException for a blank question or an invalid config
     */
    public QuestionJob submitQuery(final String question, final PipelineConfig config) {
        if (StringUtils.isBlank(question)) {
            throw new IllegalArgumentException("Question must not be blank");
        }
        config.validate();

        final QuestionJob job = registry.createJob(question);
        final Future<?> future = questionExecutor.submit(() -> process(job, config));
        registry.attach(job.getId(), future);
        log.info("Question job {} queued", job.getId());
        return job;
    }

    public Optional<QuestionJob> getJob(final long id) {
        return registry.getJob(id);
    }

    /**
     * @return false when the job is unknown or has already finished
     */
    public boolean cancel(final long id) {
        final boolean cancelled = registry.cancel(id);
        if (cancelled) {
            log.info("Question job {} cancelled", id);
        }
        return cancelled;
    }

    private void process(final QuestionJob job, final PipelineConfig config) {
        try {
            final PipelineResult result = pipeline.runQuery(job.getQuestion(), config,
                    (runId, stage) -> registry.updateStatus(job.getId(), toStatus(stage), null));
            registry.updateStatus(job.getId(), finalStatus(result), result);
        } catch (Exception ex) {
            log.error("Job {} failed", job.getId(), ex);
            registry.updateStatus(job.getId(), FAILED, null);
        }
    }

    private static EQuestionStatus finalStatus(final PipelineResult result) {
        if (result.isSuccess()) {
            return COMPLETED;
        }
        return result.error().kind() == ErrorKind.CANCELLED ? CANCELLED : FAILED;
    }

    private static EQuestionStatus toStatus(final PipelineStage stage) {
        switch (stage) {
            case ENCODE: return ENCODING;
            case RETRIEVE: return RETRIEVING;
            case RERANK: return RERANKING;
            case GENERATE: return ANSWERING;
            default: throw new IllegalArgumentException("Not a running stage: " + stage);
        }
    }
}
