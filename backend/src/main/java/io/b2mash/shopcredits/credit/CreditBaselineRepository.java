package io.b2mash.shopcredits.credit;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CreditBaselineRepository extends JpaRepository<CreditBaseline, UUID> {

  @Query(
      """
      SELECT b FROM CreditBaseline b
      WHERE b.roNumber = :roNumber AND b.milestoneId = :milestoneId
      """)
  Optional<CreditBaseline> findByRoNumberAndMilestoneId(
      @Param("roNumber") String roNumber, @Param("milestoneId") String milestoneId);

  @Query("SELECT b FROM CreditBaseline b WHERE b.roNumber = :roNumber ORDER BY b.createdAt")
  List<CreditBaseline> findByRoNumber(@Param("roNumber") String roNumber);

  /**
   * Insert-or-ignore: a baseline that already exists for the key wins, so the first observed value
   * stays frozen. Returns the number of inserted rows (0 or 1).
   */
  @Modifying
  @Query(
      nativeQuery = true,
      value =
          """
          INSERT INTO credit_baselines (id, ro_number, milestone_id, base_hours, created_at)
          VALUES (gen_random_uuid(), :roNumber, :milestoneId, :baseHours, now())
          ON CONFLICT (ro_number, milestone_id) DO NOTHING
          """)
  int insertIfAbsent(
      @Param("roNumber") String roNumber,
      @Param("milestoneId") String milestoneId,
      @Param("baseHours") BigDecimal baseHours);
}
