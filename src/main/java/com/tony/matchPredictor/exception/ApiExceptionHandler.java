package com.tony.matchPredictor.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Traduit les erreurs métier en réponses ProblemDetail.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(InsufficientInputException.class)
    public ResponseEntity<ProblemDetail> handleInsufficientInput(InsufficientInputException ex) {
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient Input", ex);
    }

    @ExceptionHandler(InvalidSignalException.class)
    public ResponseEntity<ProblemDetail> handleInvalidSignal(InvalidSignalException ex) {
        return problem(HttpStatus.BAD_REQUEST, "Invalid Signal", ex);
    }

    @ExceptionHandler(ModelNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleModelNotFound(ModelNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Model Not Found", ex);
    }

    private ResponseEntity<ProblemDetail> problem(HttpStatus status, String title, RuntimeException ex) {
        log.debug("{} : {}", title, ex.getMessage());
        ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        detail.setTitle(title);
        return ResponseEntity.status(status).body(detail);
    }
}
