package io.b2mash.shopcredits.credit;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CreditSweepController {

  private final CreditRecomputeJob creditRecomputeJob;

  public CreditSweepController(CreditRecomputeJob creditRecomputeJob) {
    this.creditRecomputeJob = creditRecomputeJob;
  }

  @PostMapping("/api/credits/recompute")
  public ResponseEntity<CreditRecomputeJob.RecomputeSummary> recomputeAll() {
    return ResponseEntity.ok(creditRecomputeJob.recomputeAll());
  }
}
