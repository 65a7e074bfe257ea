package io.b2mash.shopcredits.credit;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.shopcredits.TestcontainersConfiguration;
import io.b2mash.shopcredits.repairorder.RepairOrder;
import io.b2mash.shopcredits.repairorder.RepairOrderRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class CreditBaselineRepositoryIntegrationTest {

  private static final String RO = "RO-2002";

  @Autowired private CreditBaselineRepository creditBaselineRepository;
  @Autowired private RepairOrderRepository repairOrderRepository;
  @Autowired private TransactionTemplate transactionTemplate;

  @BeforeAll
  void createRepairOrder() {
    repairOrderRepository.save(
        new RepairOrder(RO, LocalDate.of(2025, 3, 1), new BigDecimal("80"), "Body"));
  }

  @Test
  void insertIfAbsent_keepsFirstBaseline() {
    Integer first =
        transactionTemplate.execute(
            tx -> creditBaselineRepository.insertIfAbsent(RO, "body_60", new BigDecimal("40")));
    Integer second =
        transactionTemplate.execute(
            tx -> creditBaselineRepository.insertIfAbsent(RO, "body_60", new BigDecimal("50")));

    assertThat(first).isEqualTo(1);
    assertThat(second).isZero();
    assertThat(baseHours("body_60")).isEqualByComparingTo("40");
    assertThat(creditBaselineRepository.findByRoNumber(RO)).hasSize(1);
  }

  @Test
  void insertIfAbsent_keysBaselinesPerMilestone() {
    transactionTemplate.executeWithoutResult(
        tx -> {
          creditBaselineRepository.insertIfAbsent(RO, "paint_100", new BigDecimal("12"));
          creditBaselineRepository.insertIfAbsent(RO, "mech_100", new BigDecimal("6"));
        });

    assertThat(baseHours("paint_100")).isEqualByComparingTo("12");
    assertThat(baseHours("mech_100")).isEqualByComparingTo("6");
  }

  private BigDecimal baseHours(String milestoneId) {
    return creditBaselineRepository
        .findByRoNumberAndMilestoneId(RO, milestoneId)
        .orElseThrow()
        .getBaseHours();
  }
}
