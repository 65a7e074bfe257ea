package io.b2mash.shopcredits.repairorder;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/repair-orders")
public class RepairOrderController {

  private final RepairOrderService repairOrderService;

  public RepairOrderController(RepairOrderService repairOrderService) {
    this.repairOrderService = repairOrderService;
  }

  @PostMapping
  public ResponseEntity<RepairOrderResponse> createRepairOrder(
      @Valid @RequestBody CreateRepairOrderRequest request) {
    var repairOrder =
        repairOrderService.createRepairOrder(
            request.roNumber(),
            request.openedOn(),
            request.totalHours(),
            request.bodyHours(),
            request.refinishHours(),
            request.mechanicalHours(),
            request.estimator(),
            request.bodyTechnician(),
            request.painter(),
            request.mechanic(),
            request.stage());
    return ResponseEntity.created(URI.create("/api/repair-orders/" + repairOrder.getRoNumber()))
        .body(RepairOrderResponse.from(repairOrder));
  }

  @GetMapping
  public ResponseEntity<List<RepairOrderResponse>> listRepairOrders(
      @RequestParam(required = false) RepairOrderStatus status) {
    return ResponseEntity.ok(
        repairOrderService.listRepairOrders(status).stream()
            .map(RepairOrderResponse::from)
            .toList());
  }

  @GetMapping("/{roNumber}")
  public ResponseEntity<RepairOrderResponse> getRepairOrder(@PathVariable String roNumber) {
    return ResponseEntity.ok(RepairOrderResponse.from(repairOrderService.getRepairOrder(roNumber)));
  }

  @PatchMapping("/{roNumber}")
  public ResponseEntity<RepairOrderResponse> updateRepairOrder(
      @PathVariable String roNumber, @Valid @RequestBody UpdateRepairOrderRequest request) {
    var repairOrder =
        repairOrderService.updateRepairOrder(
            roNumber,
            request.totalHours(),
            request.bodyHours(),
            request.refinishHours(),
            request.mechanicalHours(),
            request.estimator(),
            request.bodyTechnician(),
            request.painter(),
            request.mechanic());
    return ResponseEntity.ok(RepairOrderResponse.from(repairOrder));
  }

  @PutMapping("/{roNumber}/stage")
  public ResponseEntity<RepairOrderResponse> changeStage(
      @PathVariable String roNumber, @Valid @RequestBody ChangeStageRequest request) {
    return ResponseEntity.ok(
        RepairOrderResponse.from(repairOrderService.changeStage(roNumber, request.stage())));
  }

  @PutMapping("/{roNumber}/status")
  public ResponseEntity<RepairOrderResponse> changeStatus(
      @PathVariable String roNumber, @Valid @RequestBody ChangeStatusRequest request) {
    return ResponseEntity.ok(
        RepairOrderResponse.from(repairOrderService.changeStatus(roNumber, request.status())));
  }

  @GetMapping("/{roNumber}/allocations")
  public ResponseEntity<List<AllocationResponse>> listAllocations(@PathVariable String roNumber) {
    return ResponseEntity.ok(
        repairOrderService.listAllocations(roNumber).stream()
            .map(AllocationResponse::from)
            .toList());
  }

  @PutMapping("/{roNumber}/allocations")
  public ResponseEntity<List<AllocationResponse>> replaceAllocations(
      @PathVariable String roNumber, @Valid @RequestBody ReplaceAllocationsRequest request) {
    var inputs =
        request.allocations().stream()
            .map(
                a -> new RepairOrderService.AllocationInput(a.employee(), a.role(), a.percent()))
            .toList();
    return ResponseEntity.ok(
        repairOrderService.replaceAllocations(roNumber, inputs).stream()
            .map(AllocationResponse::from)
            .toList());
  }

  @DeleteMapping("/{roNumber}")
  public ResponseEntity<Void> deleteRepairOrder(@PathVariable String roNumber) {
    repairOrderService.deleteRepairOrder(roNumber);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record CreateRepairOrderRequest(
      @NotBlank(message = "roNumber is required") String roNumber,
      LocalDate openedOn,
      @NotNull(message = "totalHours is required")
          @Positive(message = "totalHours must be positive")
          BigDecimal totalHours,
      @PositiveOrZero BigDecimal bodyHours,
      @PositiveOrZero BigDecimal refinishHours,
      @PositiveOrZero BigDecimal mechanicalHours,
      String estimator,
      String bodyTechnician,
      String painter,
      String mechanic,
      String stage) {}

  public record UpdateRepairOrderRequest(
      @Positive(message = "totalHours must be positive") BigDecimal totalHours,
      @PositiveOrZero BigDecimal bodyHours,
      @PositiveOrZero BigDecimal refinishHours,
      @PositiveOrZero BigDecimal mechanicalHours,
      String estimator,
      String bodyTechnician,
      String painter,
      String mechanic) {}

  public record ChangeStageRequest(@NotBlank(message = "stage is required") String stage) {}

  public record ChangeStatusRequest(
      @NotNull(message = "status is required") RepairOrderStatus status) {}

  public record AllocationRequest(
      @NotBlank(message = "employee is required") String employee,
      @NotNull(message = "role is required") EmployeeRole role,
      @NotNull @PositiveOrZero @DecimalMax("100") BigDecimal percent) {}

  public record ReplaceAllocationsRequest(
      @NotNull(message = "allocations is required") List<@Valid AllocationRequest> allocations) {}

  public record AllocationResponse(String employee, EmployeeRole role, BigDecimal percent) {

    public static AllocationResponse from(HoursAllocation allocation) {
      return new AllocationResponse(
          allocation.getEmployee(), allocation.getRole(), allocation.getPercent());
    }
  }

  public record RepairOrderResponse(
      String roNumber,
      LocalDate openedOn,
      BigDecimal totalHours,
      BigDecimal bodyHours,
      BigDecimal refinishHours,
      BigDecimal mechanicalHours,
      BigDecimal hoursTaken,
      BigDecimal hoursRemaining,
      String estimator,
      String bodyTechnician,
      String painter,
      String mechanic,
      String currentStage,
      RepairOrderStatus status,
      Instant createdAt,
      Instant updatedAt) {

    public static RepairOrderResponse from(RepairOrder ro) {
      return new RepairOrderResponse(
          ro.getRoNumber(),
          ro.getOpenedOn(),
          ro.getTotalHours(),
          ro.getBodyHours(),
          ro.getRefinishHours(),
          ro.getMechanicalHours(),
          ro.getHoursTaken(),
          ro.getHoursRemaining(),
          ro.getEstimator(),
          ro.getBodyTechnician(),
          ro.getPainter(),
          ro.getMechanic(),
          ro.getCurrentStage(),
          ro.getStatus(),
          ro.getCreatedAt(),
          ro.getUpdatedAt());
    }
  }
}
