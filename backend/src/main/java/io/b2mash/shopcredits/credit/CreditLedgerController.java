package io.b2mash.shopcredits.credit;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/repair-orders/{roNumber}/credits")
public class CreditLedgerController {

  private final CreditLedgerService creditLedgerService;
  private final CloseReconciliationService closeReconciliationService;

  public CreditLedgerController(
      CreditLedgerService creditLedgerService,
      CloseReconciliationService closeReconciliationService) {
    this.creditLedgerService = creditLedgerService;
    this.closeReconciliationService = closeReconciliationService;
  }

  @GetMapping
  public ResponseEntity<List<CreditRowResponse>> listCredits(@PathVariable String roNumber) {
    return ResponseEntity.ok(toResponses(creditLedgerService.generatedCreditRows(roNumber)));
  }

  @PostMapping("/recompute")
  public ResponseEntity<List<CreditRowResponse>> recompute(@PathVariable String roNumber) {
    return ResponseEntity.ok(toResponses(creditLedgerService.recompute(roNumber)));
  }

  @PutMapping("/overrides")
  public ResponseEntity<List<CreditRowResponse>> setOverride(
      @PathVariable String roNumber, @Valid @RequestBody SetOverrideRequest request) {
    var key = new CreditRowKey(roNumber, request.fromStage(), request.toStage(), request.note());
    return ResponseEntity.ok(
        toResponses(
            creditLedgerService.setOverride(key, request.date(), request.tech(), request.hours())));
  }

  @DeleteMapping("/overrides")
  public ResponseEntity<List<CreditRowResponse>> deleteOverride(
      @PathVariable String roNumber,
      @RequestParam String fromStage,
      @RequestParam String toStage,
      @RequestParam String note) {
    var key = new CreditRowKey(roNumber, fromStage, toStage, note);
    return ResponseEntity.ok(toResponses(creditLedgerService.deleteOverride(key)));
  }

  @PostMapping("/supplements/delete")
  public ResponseEntity<List<CreditRowResponse>> deleteSupplement(
      @PathVariable String roNumber, @Valid @RequestBody DeleteSupplementRequest request) {
    var row =
        new CreditLedgerService.DisplayedRow(
            request.fromStage(),
            request.toStage(),
            request.date(),
            request.employee(),
            request.hours(),
            request.note());
    return ResponseEntity.ok(toResponses(creditLedgerService.deleteSupplement(roNumber, row)));
  }

  @PostMapping("/close-reconcile")
  public ResponseEntity<List<ReconciliationPosting>> closeReconcile(@PathVariable String roNumber) {
    return ResponseEntity.ok(closeReconciliationService.closeReconcile(roNumber));
  }

  @GetMapping("/audit")
  public ResponseEntity<List<AuditEntryResponse>> listAudit(@PathVariable String roNumber) {
    return ResponseEntity.ok(
        creditLedgerService.auditEntries(roNumber).stream().map(AuditEntryResponse::from).toList());
  }

  private static List<CreditRowResponse> toResponses(List<CreditRow> rows) {
    return rows.stream().map(CreditRowResponse::from).toList();
  }

  // --- DTOs ---

  public record SetOverrideRequest(
      @NotBlank(message = "fromStage is required") String fromStage,
      @NotBlank(message = "toStage is required") String toStage,
      @NotBlank(message = "note is required") String note,
      LocalDate date,
      String tech,
      BigDecimal hours) {}

  public record DeleteSupplementRequest(
      @NotBlank(message = "fromStage is required") String fromStage,
      @NotBlank(message = "toStage is required") String toStage,
      @NotNull(message = "date is required") LocalDate date,
      String employee,
      @NotNull(message = "hours is required") BigDecimal hours,
      @NotBlank(message = "note is required") String note) {}

  public record CreditRowResponse(
      LocalDate date,
      String roNumber,
      String fromStage,
      String toStage,
      String employee,
      BigDecimal hours,
      String note,
      CreditRowOrigin origin,
      String milestoneId,
      boolean overridden) {

    public static CreditRowResponse from(CreditRow row) {
      return new CreditRowResponse(
          row.date(),
          row.roNumber(),
          row.fromStage(),
          row.toStage(),
          row.employee(),
          row.hours(),
          row.note(),
          row.origin(),
          row.milestoneId(),
          row.overridden());
    }
  }

  public record AuditEntryResponse(
      UUID id, LocalDate date, String roNumber, String employee, BigDecimal hours, String note) {

    public static AuditEntryResponse from(CreditAuditEntry entry) {
      return new AuditEntryResponse(
          entry.getId(),
          entry.getEntryDate(),
          entry.getRoNumber(),
          entry.getEmployee(),
          entry.getHours(),
          entry.getNote());
    }
  }
}
