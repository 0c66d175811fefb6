package eu.virtualparadox.ragqa.web;

import eu.virtualparadox.ragqa.query.pipeline.PipelineResult;
import eu.virtualparadox.ragqa.query.question.EQuestionStatus;
import eu.virtualparadox.ragqa.query.question.QuestionJob;

import java.time.Instant;

public record JobView(long id, String question, EQuestionStatus status, Instant createdAt, PipelineResult result) {

    static JobView of(final QuestionJob job) {
        return new JobView(job.getId(), job.getQuestion(), job.getStatus(), job.getCreatedAt(), job.getResult());
    }
}
