package io.b2mash.shopcredits.credit;

import io.b2mash.shopcredits.repairorder.RepairOrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Recomputes the ledger of every repair order on {@code credit.recompute.cron}. Each RO runs in
 * its own transaction; one failure is logged and the sweep moves on.
 */
@Component
public class CreditRecomputeJob {

  private static final Logger log = LoggerFactory.getLogger(CreditRecomputeJob.class);

  private final RepairOrderRepository repairOrderRepository;
  private final CreditLedgerService creditLedgerService;

  public CreditRecomputeJob(
      RepairOrderRepository repairOrderRepository, CreditLedgerService creditLedgerService) {
    this.repairOrderRepository = repairOrderRepository;
    this.creditLedgerService = creditLedgerService;
  }

  @Scheduled(cron = "${credit.recompute.cron:0 0 3 * * *}")
  public void scheduledRecompute() {
    log.info("Credit recompute sweep started");
    var summary = recomputeAll();
    log.info(
        "Credit recompute sweep completed: {} repair orders processed, {} failed",
        summary.processed(),
        summary.failed());
  }

  public RecomputeSummary recomputeAll() {
    var roNumbers = repairOrderRepository.findAllRoNumbers();
    int failed = 0;
    for (String roNumber : roNumbers) {
      try {
        creditLedgerService.recompute(roNumber);
      } catch (Exception e) {
        failed++;
        log.error("Credit recompute failed for RO {}", roNumber, e);
      }
    }
    return new RecomputeSummary(roNumbers.size(), failed);
  }

  public record RecomputeSummary(int processed, int failed) {}
}
