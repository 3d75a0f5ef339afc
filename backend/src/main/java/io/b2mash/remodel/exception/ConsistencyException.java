package io.b2mash.remodel.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a mutation would break a ledger invariant that has no safe default, such as a second
 * deposit. Results in HTTP 409 Conflict when surfaced through a web layer.
 */
public class ConsistencyException extends ErrorResponseException {

  public ConsistencyException(String title, String detail) {
    super(HttpStatus.CONFLICT, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
