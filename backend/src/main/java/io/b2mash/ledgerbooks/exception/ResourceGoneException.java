package io.b2mash.ledgerbooks.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Raised when a resource still exists but can no longer be used, e.g. an expired invitation. */
public class ResourceGoneException extends ErrorResponseException {

  public ResourceGoneException(String title, String detail) {
    super(HttpStatus.GONE, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.GONE);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
