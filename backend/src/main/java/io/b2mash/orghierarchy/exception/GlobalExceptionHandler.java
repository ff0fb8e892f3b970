package io.b2mash.orghierarchy.exception;

import io.b2mash.orghierarchy.importer.DataImportException;
import io.b2mash.orghierarchy.importer.FetchException;
import io.b2mash.orghierarchy.importer.ImportConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ImportConfigurationException.class)
  public ResponseEntity<ProblemDetail> handleImportConfiguration(ImportConfigurationException ex) {
    log.warn("Rejected import configuration: {}", ex.getMessage());
    return problem(HttpStatus.BAD_REQUEST, "Invalid import configuration", ex.getMessage());
  }

  @ExceptionHandler(FetchException.class)
  public ResponseEntity<ProblemDetail> handleFetch(FetchException ex) {
    log.warn("Import source request failed: {}", ex.getMessage());
    return problem(HttpStatus.BAD_GATEWAY, "Import source unavailable", ex.getMessage());
  }

  @ExceptionHandler(DataImportException.class)
  public ResponseEntity<ProblemDetail> handleDataImport(DataImportException ex) {
    log.warn("Import failed: {}", ex.getMessage());
    return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Import failed", ex.getMessage());
  }

  private static ResponseEntity<ProblemDetail> problem(
      HttpStatus status, String title, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(detail);
    return ResponseEntity.status(status).body(problem);
  }
}
