package eu.virtualparadox.ragqa.web;

import eu.virtualparadox.ragqa.rag.eval.EvaluationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(final IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", "invalid_request", "message", StringUtils.defaultString(ex.getMessage())));
    }

    @ExceptionHandler(EvaluationException.class)
    public ResponseEntity<Map<String, String>> evaluationFailed(final EvaluationException ex) {
        log.error("Evaluation failed", ex);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(Map.of("error", "evaluation_unavailable", "message", StringUtils.defaultString(ex.getMessage())));
    }
}
