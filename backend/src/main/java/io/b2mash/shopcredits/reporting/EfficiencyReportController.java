package io.b2mash.shopcredits.reporting;

import java.time.LocalDate;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class EfficiencyReportController {

  private final EfficiencyReportService efficiencyReportService;

  public EfficiencyReportController(EfficiencyReportService efficiencyReportService) {
    this.efficiencyReportService = efficiencyReportService;
  }

  @GetMapping("/api/credits/summary")
  public ResponseEntity<List<EmployeeEfficiency>> summary(
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate from,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate to) {
    return ResponseEntity.ok(efficiencyReportService.summary(from, to));
  }
}
