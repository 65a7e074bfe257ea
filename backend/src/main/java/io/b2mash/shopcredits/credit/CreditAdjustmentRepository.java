package io.b2mash.shopcredits.credit;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CreditAdjustmentRepository extends JpaRepository<CreditAdjustment, Long> {

  @Query(
      """
      SELECT a FROM CreditAdjustment a
      WHERE a.roNumber = :roNumber AND a.milestoneId = :milestoneId
      ORDER BY a.id ASC
      """)
  List<CreditAdjustment> findByRoNumberAndMilestoneId(
      @Param("roNumber") String roNumber, @Param("milestoneId") String milestoneId);
}
