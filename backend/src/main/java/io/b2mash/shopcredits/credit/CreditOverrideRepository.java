package io.b2mash.shopcredits.credit;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CreditOverrideRepository extends JpaRepository<CreditOverride, UUID> {

  @Query(
      """
      SELECT o FROM CreditOverride o
      WHERE o.roNumber = :roNumber
        AND o.fromStage = :fromStage
        AND o.toStage = :toStage
        AND o.note = :note
      """)
  Optional<CreditOverride> findByKey(
      @Param("roNumber") String roNumber,
      @Param("fromStage") String fromStage,
      @Param("toStage") String toStage,
      @Param("note") String note);

  @Query("SELECT o FROM CreditOverride o WHERE o.roNumber = :roNumber")
  List<CreditOverride> findByRoNumber(@Param("roNumber") String roNumber);
}
