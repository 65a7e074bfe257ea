package io.b2mash.shopcredits.credit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.b2mash.shopcredits.repairorder.EmployeeRole;
import io.b2mash.shopcredits.repairorder.HoursAllocation;
import io.b2mash.shopcredits.repairorder.HoursAllocationRepository;
import io.b2mash.shopcredits.repairorder.RepairOrder;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CreditSourceTest {

  private RepairOrder repairOrder;

  @BeforeEach
  void setUp() {
    repairOrder = new RepairOrder("RO-7", LocalDate.of(2025, 2, 1), new BigDecimal("80"), "Body");
    repairOrder.updateHours(
        new BigDecimal("80"), new BigDecimal("40"), new BigDecimal("12"), BigDecimal.ZERO);
    repairOrder.assign("Erin", "Alice", "Paula", "Mike");
  }

  @Test
  void fixedRole_expectsBucketTimesTotalShare() {
    var source = new FixedRoleCreditSource(new MilestonePolicy(InMemoryLedger.defaultMilestones()));

    var expected = source.expectedCredit(repairOrder);

    assertThat(expected).containsOnlyKeys("Alice", "Paula");
    assertThat(expected.get("Alice")).isEqualByComparingTo("40");
    assertThat(expected.get("Paula")).isEqualByComparingTo("12");
    assertThat(source.responsibleEmployee(repairOrder, EmployeeRole.MECHANIC)).isEqualTo("Mike");
  }

  @Test
  void fixedRole_mergesEmployeeHoldingSeveralRoles() {
    repairOrder.assign(null, "Alice", "Alice", null);
    var source = new FixedRoleCreditSource(new MilestonePolicy(InMemoryLedger.defaultMilestones()));

    assertThat(source.expectedCredit(repairOrder).get("Alice")).isEqualByComparingTo("52");
  }

  @Test
  void allocation_splitsBucketByPercent() {
    var repository = mock(HoursAllocationRepository.class);
    when(repository.findByRoNumber("RO-7"))
        .thenReturn(
            List.of(
                allocation("Alice", EmployeeRole.BODY_TECHNICIAN, "75"),
                allocation("Ben", EmployeeRole.BODY_TECHNICIAN, "25"),
                allocation("Paula", EmployeeRole.PAINTER, "100")));
    var source = new AllocationCreditSource(repository);

    var expected = source.expectedCredit(repairOrder);

    assertThat(expected.get("Alice")).isEqualByComparingTo("30");
    assertThat(expected.get("Ben")).isEqualByComparingTo("10");
    assertThat(expected.get("Paula")).isEqualByComparingTo("12");
    assertThat(source.responsibleEmployee(repairOrder, EmployeeRole.BODY_TECHNICIAN))
        .isEqualTo("Alice");
  }

  @Test
  void allocation_fallsBackToRoleAssignee() {
    var repository = mock(HoursAllocationRepository.class);
    when(repository.findByRoNumber("RO-7")).thenReturn(List.of());
    var source = new AllocationCreditSource(repository);

    assertThat(source.responsibleEmployee(repairOrder, EmployeeRole.PAINTER)).isEqualTo("Paula");
    assertThat(source.expectedCredit(repairOrder)).isEmpty();
  }

  private static HoursAllocation allocation(String employee, EmployeeRole role, String percent) {
    return new HoursAllocation("RO-7", employee, role, new BigDecimal(percent));
  }
}
