package com.scholary.orchestrator.api;

import com.scholary.orchestrator.job.ApplyStepUnavailableException;
import com.scholary.orchestrator.job.JobNotFinishedException;
import com.scholary.orchestrator.job.JobNotFoundException;
import com.scholary.orchestrator.job.NoSavedResultsException;
import com.scholary.orchestrator.job.PipelineNotFoundException;
import com.scholary.orchestrator.store.RecordNotFoundException;
import com.scholary.orchestrator.store.ResultDecodeException;
import com.scholary.orchestrator.store.ResultStoreException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps orchestration errors to HTTP responses. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({
    JobNotFoundException.class,
    PipelineNotFoundException.class,
    RecordNotFoundException.class,
    NoSavedResultsException.class
  })
  public ResponseEntity<ErrorResponse> notFound(RuntimeException e) {
    return error(HttpStatus.NOT_FOUND, e.getMessage());
  }

  @ExceptionHandler({JobNotFinishedException.class, ApplyStepUnavailableException.class})
  public ResponseEntity<ErrorResponse> conflict(RuntimeException e) {
    return error(HttpStatus.CONFLICT, e.getMessage());
  }

  @ExceptionHandler(InvalidTaskPayloadException.class)
  public ResponseEntity<ErrorResponse> invalidPayload(InvalidTaskPayloadException e) {
    return error(HttpStatus.BAD_REQUEST, e.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> invalid(MethodArgumentNotValidException e) {
    String message =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return error(HttpStatus.BAD_REQUEST, message);
  }

  @ExceptionHandler(ResultDecodeException.class)
  public ResponseEntity<ErrorResponse> undecodable(ResultDecodeException e) {
    LOGGER.error("Stored results could not be decoded", e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
  }

  @ExceptionHandler(ResultStoreException.class)
  public ResponseEntity<ErrorResponse> storeFailure(ResultStoreException e) {
    LOGGER.error("Result store failure", e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
  }

  private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(message));
  }
}
