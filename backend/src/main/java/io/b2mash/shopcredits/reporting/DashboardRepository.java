package io.b2mash.shopcredits.reporting;

import io.b2mash.shopcredits.repairorder.EmployeeRole;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Tuple;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.stereotype.Repository;

/**
 * Workload aggregations over open repair orders. Closed orders are excluded; on-hold orders still
 * count as open work. Assigned hours unpivot the three role columns so each (employee, role) pair
 * is summed in one pass.
 */
@Repository
public class DashboardRepository {

  private final EntityManager entityManager;

  public DashboardRepository(EntityManager entityManager) {
    this.entityManager = entityManager;
  }

  public List<StageCountProjection> countOpenByStage() {
    var query =
        entityManager.createNativeQuery(
            """
            SELECT ro.current_stage AS stage, COUNT(*) AS open_repair_orders
            FROM repair_orders ro
            WHERE ro.status <> 'CLOSED'
            GROUP BY ro.current_stage
            """,
            Tuple.class);
    @SuppressWarnings("unchecked")
    List<Tuple> results = query.getResultList();
    return results.stream().map(this::toStageCountProjection).toList();
  }

  /** Names left blank or entered as "Unassigned" are not attributed to anyone. */
  public List<AssignedHoursProjection> sumAssignedHoursOnOpenRepairOrders() {
    var query =
        entityManager.createNativeQuery(
            """
            SELECT a.employee AS employee, a.role AS role, SUM(a.hours) AS assigned_hours
            FROM (
                SELECT ro.body_technician AS employee, 'BODY_TECHNICIAN' AS role,
                       ro.body_hours AS hours
                FROM repair_orders ro WHERE ro.status <> 'CLOSED'
                UNION ALL
                SELECT ro.painter, 'PAINTER', ro.refinish_hours
                FROM repair_orders ro WHERE ro.status <> 'CLOSED'
                UNION ALL
                SELECT ro.mechanic, 'MECHANIC', ro.mechanical_hours
                FROM repair_orders ro WHERE ro.status <> 'CLOSED'
            ) a
            WHERE a.employee IS NOT NULL
              AND TRIM(a.employee) <> ''
              AND LOWER(TRIM(a.employee)) <> 'unassigned'
            GROUP BY a.employee, a.role
            """,
            Tuple.class);
    @SuppressWarnings("unchecked")
    List<Tuple> results = query.getResultList();
    return results.stream().map(this::toAssignedHoursProjection).toList();
  }

  // --- Tuple-to-projection mappers ---

  private StageCountProjection toStageCountProjection(Tuple tuple) {
    return new StageCountProjection() {
      @Override
      public String getStage() {
        return tuple.get("stage", String.class);
      }

      @Override
      public long getOpenRepairOrders() {
        return ((Number) tuple.get("open_repair_orders")).longValue();
      }
    };
  }

  private AssignedHoursProjection toAssignedHoursProjection(Tuple tuple) {
    return new AssignedHoursProjection() {
      @Override
      public String getEmployee() {
        return tuple.get("employee", String.class);
      }

      @Override
      public EmployeeRole getRole() {
        return EmployeeRole.valueOf(tuple.get("role", String.class));
      }

      @Override
      public BigDecimal getAssignedHours() {
        return toBigDecimal(tuple.get("assigned_hours"));
      }
    };
  }

  private BigDecimal toBigDecimal(Object value) {
    if (value == null) {
      return BigDecimal.ZERO;
    }
    if (value instanceof BigDecimal bd) {
      return bd;
    }
    if (value instanceof Number n) {
      return BigDecimal.valueOf(n.doubleValue());
    }
    return new BigDecimal(value.toString());
  }
}
