package io.b2mash.remodel.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown for internal calculation faults that cannot be folded into a result's error list. */
public class CalculationException extends ErrorResponseException {

  public CalculationException(String title, String detail) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
