package io.b2mash.shopcredits.reporting;

import io.b2mash.shopcredits.workflow.StageOrderingService;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class DashboardService {

  private final DashboardRepository dashboardRepository;
  private final StageOrderingService stageOrderingService;

  public DashboardService(
      DashboardRepository dashboardRepository, StageOrderingService stageOrderingService) {
    this.dashboardRepository = dashboardRepository;
    this.stageOrderingService = stageOrderingService;
  }

  /**
   * Every configured stage is listed in workflow order, with zero when no open RO sits there.
   * Stages no longer configured but still held by open ROs follow alphabetically. Assigned hours
   * are ordered body technician, painter, mechanic, then by name ignoring case.
   */
  @Transactional(readOnly = true)
  public Dashboard dashboard() {
    Map<String, Long> counts = new LinkedHashMap<>();
    stageOrderingService.current().stages().forEach(stage -> counts.put(stage, 0L));
    Map<String, Long> unconfigured = new TreeMap<>();
    for (var row : dashboardRepository.countOpenByStage()) {
      if (counts.containsKey(row.getStage())) {
        counts.put(row.getStage(), row.getOpenRepairOrders());
      } else {
        unconfigured.merge(row.getStage(), row.getOpenRepairOrders(), Long::sum);
      }
    }
    counts.putAll(unconfigured);

    var openByStage = new ArrayList<Dashboard.StageCount>();
    counts.forEach((stage, count) -> openByStage.add(new Dashboard.StageCount(stage, count)));

    var assignedHours =
        dashboardRepository.sumAssignedHoursOnOpenRepairOrders().stream()
            .map(
                row ->
                    new Dashboard.AssignedHours(
                        row.getEmployee(), row.getRole(), row.getAssignedHours()))
            .sorted(
                Comparator.comparing(Dashboard.AssignedHours::role)
                    .thenComparing(
                        Dashboard.AssignedHours::employee, String.CASE_INSENSITIVE_ORDER))
            .toList();

    return new Dashboard(openByStage, assignedHours);
  }
}
