package io.b2mash.ledgerbooks.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class MissingIdentityException extends ErrorResponseException {

  public MissingIdentityException() {
    super(HttpStatus.UNAUTHORIZED, createProblem(), null);
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Missing identity");
    problem.setDetail("Request is not bound to an authenticated user");
    return problem;
  }
}
