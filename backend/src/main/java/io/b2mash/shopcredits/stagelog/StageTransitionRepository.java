package io.b2mash.shopcredits.stagelog;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StageTransitionRepository extends JpaRepository<StageTransition, Long> {

  /** Log order: timestamp first, append sequence for ties. */
  @Query(
      """
      SELECT st FROM StageTransition st
      WHERE st.roNumber = :roNumber
      ORDER BY st.occurredAt ASC, st.id ASC
      """)
  List<StageTransition> findByRoNumberInLogOrder(@Param("roNumber") String roNumber);
}
