package io.b2mash.b2b.dynamicfields.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a dynamic field definition, screen setting or value fails input validation. The
 * offending attribute is exposed both as {@link #getAttribute()} and as the {@code attribute}
 * property of the problem body.
 */
public class FieldValidationException extends ErrorResponseException {

  private final String attribute;

  public FieldValidationException(String attribute, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(attribute, detail), null);
    this.attribute = attribute;
  }

  public String getAttribute() {
    return attribute;
  }

  @Override
  public String getMessage() {
    return attribute + ": " + getBody().getDetail();
  }

  private static ProblemDetail createProblem(String attribute, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid " + attribute);
    problem.setDetail(detail);
    problem.setProperty("attribute", attribute);
    return problem;
  }
}
