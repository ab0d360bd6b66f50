package com.riskrecon.worker.config;

import com.riskrecon.domain.risk.RiskDomainException;
import java.net.URI;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Maps failures of the risk, breaker and reconciler endpoints to RFC 7807 problems. */
@RestControllerAdvice
public class GlobalExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private static final String TYPE_PREFIX = "/problems/";

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ProblemDetail handleInvalidBody(MethodArgumentNotValidException ex) {
    List<FieldViolation> violations =
        ex.getFieldErrors().stream()
            .map(
                error ->
                    new FieldViolation(
                        error.getField(),
                        error.getDefaultMessage(),
                        String.valueOf(error.getRejectedValue())))
            .toList();
    ProblemDetail problem =
        problem(
            HttpStatus.BAD_REQUEST,
            "validation-error",
            "Validation Error",
            "Request validation failed");
    problem.setProperty("errors", violations);
    return problem;
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ProblemDetail handleUnreadableBody(HttpMessageNotReadableException ex) {
    return problem(
        HttpStatus.BAD_REQUEST, "malformed-request", "Malformed Request", "Malformed request body");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ProblemDetail handleQueryType(MethodArgumentTypeMismatchException ex) {
    return problem(
        HttpStatus.BAD_REQUEST,
        "type-mismatch",
        "Type Mismatch",
        "Parameter '" + ex.getName() + "' has an invalid value");
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return problem(HttpStatus.BAD_REQUEST, "invalid-argument", "Invalid Argument", ex.getMessage());
  }

  @ExceptionHandler(RiskDomainException.class)
  public ProblemDetail handleRiskContract(RiskDomainException ex) {
    return problem(
        HttpStatus.BAD_REQUEST,
        "risk-contract-violation",
        "Risk Contract Violation",
        ex.getMessage());
  }

  @ExceptionHandler(Exception.class)
  public ProblemDetail handleUnexpected(Exception ex) {
    log.error("Unhandled exception", ex);
    return problem(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "internal-error",
        "Internal Server Error",
        "An unexpected error occurred");
  }

  private static ProblemDetail problem(
      HttpStatus status, String type, String title, String detail) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
    problem.setType(URI.create(TYPE_PREFIX + type));
    problem.setTitle(title);
    return problem;
  }

  private record FieldViolation(String field, String message, String rejectedValue) {}
}
