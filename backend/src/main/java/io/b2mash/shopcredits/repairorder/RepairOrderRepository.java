package io.b2mash.shopcredits.repairorder;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RepairOrderRepository extends JpaRepository<RepairOrder, UUID> {

  @Query("SELECT ro FROM RepairOrder ro WHERE ro.roNumber = :roNumber")
  Optional<RepairOrder> findByRoNumber(@Param("roNumber") String roNumber);

  /**
   * Locks the RO row for the rest of the transaction. Every ledger read-modify-write sequence
   * starts here so two recomputes of the same RO cannot both observe the same residual.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT ro FROM RepairOrder ro WHERE ro.roNumber = :roNumber")
  Optional<RepairOrder> findByRoNumberForUpdate(@Param("roNumber") String roNumber);

  boolean existsByRoNumber(String roNumber);

  @Query("SELECT ro.roNumber FROM RepairOrder ro ORDER BY ro.roNumber")
  List<String> findAllRoNumbers();

  @Query(
      """
      SELECT ro FROM RepairOrder ro
      WHERE (:status IS NULL OR ro.status = :status)
      ORDER BY ro.openedOn DESC, ro.roNumber ASC
      """)
  List<RepairOrder> findByStatus(@Param("status") RepairOrderStatus status);
}
