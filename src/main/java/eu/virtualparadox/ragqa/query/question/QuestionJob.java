package eu.virtualparadox.ragqa.query.question;

import eu.virtualparadox.ragqa.query.pipeline.PipelineResult;

import java.time.Instant;
import java.util.concurrent.Future;

public class QuestionJob {
    private final long id;
    private final String question;
    private final Instant createdAt;
    private volatile EQuestionStatus status;
    private volatile PipelineResult result;
    private volatile Future<?> future;

    public QuestionJob(long id, String question) {
        this.id = id;
        this.question = question;
        this.status = EQuestionStatus.QUEUED;
        this.createdAt = Instant.now();
    }

    public long getId() { return id; }
    public String getQuestion() { return question; }
    public Instant getCreatedAt() { return createdAt; }
    public EQuestionStatus getStatus() { return status; }
    /** {@code null} until the run has finished. */
    public PipelineResult getResult() { return result; }
    Future<?> getFuture() { return future; }

    void setStatus(EQuestionStatus status) { this.status = status; }
    void setResult(PipelineResult result) { this.result = result; }
    void setFuture(Future<?> future) { this.future = future; }
}
