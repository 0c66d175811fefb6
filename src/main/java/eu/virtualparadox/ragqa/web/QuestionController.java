package eu.virtualparadox.ragqa.web;

import eu.virtualparadox.ragqa.application.config.PipelineProperties;
import eu.virtualparadox.ragqa.query.QueryManager;
import eu.virtualparadox.ragqa.query.pipeline.PipelineResult;
import eu.virtualparadox.ragqa.query.question.QuestionJob;
import eu.virtualparadox.ragqa.rag.eval.AnswerEvaluationService;
import eu.virtualparadox.ragqa.rag.eval.EvaluationResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Question endpoints.
 * <ul>
 *   <li>{@code POST /api/questions} queues a job, {@code GET /api/questions/{id}} polls it,
 *       {@code DELETE /api/questions/{id}} cancels it</li>
 *   <li>{@code POST /api/questions/run} answers synchronously</li>
 *   <li>{@code POST /api/evaluations} compares an answer with a ground truth</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class QuestionController {

    private final QueryManager queryManager;
    private final PipelineProperties properties;
    private final AnswerEvaluationService evaluationService;

    @PostMapping("/questions")
    public ResponseEntity<JobView> submit(@RequestBody final QuestionRequest request) {
        final QuestionJob job = queryManager.submitQuery(request.question(),
                request.applyTo(properties.toPipelineConfig()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobView.of(job));
    }

    @GetMapping("/questions/{id}")
    public ResponseEntity<JobView> poll(@PathVariable("id") final long id) {
        return queryManager.getJob(id)
                .map(JobView::of)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /** 204 when cancelled, 409 when the job has already finished. */
    @DeleteMapping("/questions/{id}")
    public ResponseEntity<Void> cancel(@PathVariable("id") final long id) {
        if (queryManager.getJob(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return queryManager.cancel(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.status(HttpStatus.CONFLICT).build();
    }

    @PostMapping("/questions/run")
    public PipelineResult run(@RequestBody final QuestionRequest request) {
        return queryManager.runQuery(request.question(), request.applyTo(properties.toPipelineConfig()));
    }

    @PostMapping("/evaluations")
    public EvaluationResult evaluate(@RequestBody final EvaluationRequest request) {
        return evaluationService.evaluate(request.question(), request.groundTruth(), request.generatedAnswer());
    }
}
