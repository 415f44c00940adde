package io.b2mash.b2b.dynamicfields.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when a stored config blob or an uploaded import bundle is not well-formed YAML. */
public class DocumentParseException extends ErrorResponseException {

  public DocumentParseException(String title, String detail, Throwable cause) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail), cause);
  }

  @Override
  public String getMessage() {
    return getBody().getTitle() + ": " + getBody().getDetail();
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
