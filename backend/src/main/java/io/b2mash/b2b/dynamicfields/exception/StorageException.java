package io.b2mash.b2b.dynamicfields.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Wraps a persistence failure with the operation that was running when it happened. Never retried
 * inside the engine; the problem body deliberately omits the underlying database message.
 */
public class StorageException extends ErrorResponseException {

  private final String operation;

  public StorageException(String operation, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(operation), cause);
    this.operation = operation;
  }

  public String getOperation() {
    return operation;
  }

  @Override
  public String getMessage() {
    return "Failed to " + operation + (getCause() != null ? ": " + getCause().getMessage() : "");
  }

  private static ProblemDetail createProblem(String operation) {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Storage failure");
    problem.setDetail("Failed to " + operation);
    return problem;
  }
}
