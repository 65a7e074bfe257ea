package io.b2mash.shopcredits.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/** Builds the problem bodies shared by the ledger's error responses. */
final class RepairOrderProblems {

  static final String RO_NUMBER_PROPERTY = "roNumber";

  private RepairOrderProblems() {}

  static ProblemDetail problem(HttpStatus status, String title, String detail, String roNumber) {
    var problem = ProblemDetail.forStatusAndDetail(status, detail);
    problem.setTitle(title);
    if (roNumber != null) {
      problem.setProperty(RO_NUMBER_PROPERTY, roNumber);
    }
    return problem;
  }
}
