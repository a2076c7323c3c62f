package com.nursingjobs.pipeline.ingest.api;

import com.nursingjobs.pipeline.ingest.model.DeletedJobTombstone;
import com.nursingjobs.pipeline.ingest.service.ActivePipelineRunException;
import com.nursingjobs.pipeline.ingest.service.JobGoneException;
import com.nursingjobs.pipeline.ingest.service.JobNotFoundException;
import com.nursingjobs.pipeline.ingest.service.UnknownEmployerException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class PipelineExceptionHandler {

  @ExceptionHandler(ActivePipelineRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActivePipelineRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_pipeline_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(UnknownEmployerException.class)
  public ResponseEntity<Map<String, String>> handleUnknownEmployer(UnknownEmployerException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "unknown_employer", "message", ex.getMessage()));
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(JobNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "job_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(JobGoneException.class)
  public ResponseEntity<Map<String, String>> handleGone(JobGoneException ex) {
    DeletedJobTombstone tombstone = ex.getTombstone();
    Map<String, String> body = new LinkedHashMap<>();
    body.put("error", "job_gone");
    body.put("slug", tombstone.slug());
    body.put("reason", tombstone.reason() == null ? "removed" : tombstone.reason());
    if (tombstone.createdAt() != null) {
      body.put("deletedAt", tombstone.createdAt().toString());
    }
    return ResponseEntity.status(HttpStatus.GONE).body(body);
  }
}
