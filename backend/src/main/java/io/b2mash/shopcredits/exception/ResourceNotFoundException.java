package io.b2mash.shopcredits.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** 404 for a repair order, or for a ledger row, override or supplement on one. */
public class ResourceNotFoundException extends ErrorResponseException {

  private ResourceNotFoundException(String title, String detail, String roNumber) {
    super(
        HttpStatus.NOT_FOUND,
        RepairOrderProblems.problem(HttpStatus.NOT_FOUND, title, detail, roNumber),
        null);
  }

  public static ResourceNotFoundException repairOrder(String roNumber) {
    return new ResourceNotFoundException(
        "Repair order not found", "No repair order with number " + roNumber, roNumber);
  }

  public static ResourceNotFoundException onRepairOrder(
      String roNumber, String title, String detail) {
    return new ResourceNotFoundException(title, detail, roNumber);
  }
}
