package io.b2mash.shopcredits.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    this(title, detail, null);
  }

  private InvalidStateException(String title, String detail, String roNumber) {
    super(
        HttpStatus.BAD_REQUEST,
        RepairOrderProblems.problem(HttpStatus.BAD_REQUEST, title, detail, roNumber),
        null);
  }

  /** Rejects an operation the repair order's current state does not allow. */
  public static InvalidStateException onRepairOrder(String roNumber, String title, String detail) {
    return new InvalidStateException(title, detail, roNumber);
  }
}
