package io.b2mash.ledgerbooks.invitation;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when every generated invitation code collided with an existing one. */
public class InvitationCodeExhaustedException extends ErrorResponseException {

  public InvitationCodeExhaustedException(int attempts) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(attempts), null);
  }

  private static ProblemDetail createProblem(int attempts) {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Invitation code unavailable");
    problem.setDetail(
        "Could not generate a unique invitation code after " + attempts + " attempts");
    return problem;
  }
}
