package io.b2mash.shopcredits.repairorder;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface HoursAllocationRepository extends JpaRepository<HoursAllocation, UUID> {

  @Query(
      """
      SELECT a FROM HoursAllocation a
      WHERE a.roNumber = :roNumber
      ORDER BY a.createdAt, a.employee
      """)
  List<HoursAllocation> findByRoNumber(@Param("roNumber") String roNumber);

  @Modifying
  @Query("DELETE FROM HoursAllocation a WHERE a.roNumber = :roNumber")
  void deleteByRoNumber(@Param("roNumber") String roNumber);
}
