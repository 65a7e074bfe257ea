package io.b2mash.shopcredits.credit;

import io.b2mash.shopcredits.event.RepairOrderClosedEvent;
import io.b2mash.shopcredits.event.RepairOrderHoursChangedEvent;
import io.b2mash.shopcredits.event.RepairOrderStageChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Keeps the ledger current as repair orders change. Runs inside the publishing transaction and
 * lets failures propagate, so an RO change never commits without its ledger update.
 */
@Component
public class CreditLedgerEventListener {

  private static final Logger log = LoggerFactory.getLogger(CreditLedgerEventListener.class);

  private final CreditLedgerService creditLedgerService;
  private final CloseReconciliationService closeReconciliationService;

  public CreditLedgerEventListener(
      CreditLedgerService creditLedgerService,
      CloseReconciliationService closeReconciliationService) {
    this.creditLedgerService = creditLedgerService;
    this.closeReconciliationService = closeReconciliationService;
  }

  @EventListener
  public void onStageChanged(RepairOrderStageChangedEvent event) {
    log.debug(
        "RO {} moved {} -> {}, recomputing credits",
        event.roNumber(),
        event.fromStage(),
        event.toStage());
    creditLedgerService.recompute(event.roNumber());
  }

  @EventListener
  public void onHoursChanged(RepairOrderHoursChangedEvent event) {
    creditLedgerService.recompute(event.roNumber());
  }

  @EventListener
  public void onClosed(RepairOrderClosedEvent event) {
    creditLedgerService.recompute(event.roNumber());
    var postings = closeReconciliationService.closeReconcile(event.roNumber());
    log.info(
        "RO {} closed (was {}), {} reconciliation postings",
        event.roNumber(),
        event.previousStatus(),
        postings.size());
  }
}
