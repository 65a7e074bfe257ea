package io.b2mash.shopcredits.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class ResourceConflictException extends ErrorResponseException {

  private ResourceConflictException(String title, String detail, String roNumber) {
    super(
        HttpStatus.CONFLICT,
        RepairOrderProblems.problem(HttpStatus.CONFLICT, title, detail, roNumber),
        null);
  }

  public static ResourceConflictException duplicateRepairOrder(String roNumber) {
    return new ResourceConflictException(
        "Repair order exists", "Repair order " + roNumber + " already exists", roNumber);
  }
}
