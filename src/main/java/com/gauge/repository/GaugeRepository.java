package com.gauge.repository;

import com.gauge.model.Gauge;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for Gauge rows.
 *
 * Provides:
 * - Row locking (SELECT ... FOR UPDATE) for the lifecycle engine
 * - Set membership and spare lookups
 * - Identifier usage checks
 */
@Repository
public interface GaugeRepository extends JpaRepository<Gauge, Long> {

    /**
     * Lock a single gauge row for the rest of the current transaction.
     * Callers lock several rows one by one in ascending id order.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM Gauge g WHERE g.id = :id")
    Optional<Gauge> findByIdForUpdate(@Param("id") Long id);

    /**
     * Ids of every row carrying the set id, deleted ones included.
     * Ids only: loading entities here would shadow the state read under lock.
     */
    @Query("SELECT g.id FROM Gauge g WHERE g.setId = :setId ORDER BY g.id")
    List<Long> findMemberIds(@Param("setId") String setId);

    @Query("SELECT new com.gauge.repository.MembershipRef(g.id, g.setId, g.companionId) " +
           "FROM Gauge g WHERE g.id = :id")
    Optional<MembershipRef> findMembership(@Param("id") Long id);

    /**
     * Members of a set for read paths, deleted ones included.
     */
    List<Gauge> findBySetIdOrderByIdAsc(String setId);

    @Query("SELECT g FROM Gauge g WHERE g.categoryId = :categoryId AND g.spare = true " +
           "AND g.deletedAt IS NULL ORDER BY g.id")
    List<Gauge> findSpares(@Param("categoryId") Long categoryId);

    /**
     * True when an active gauge carries the identifier as its external id or set id.
     */
    @Query("SELECT COUNT(g) > 0 FROM Gauge g WHERE g.deletedAt IS NULL " +
           "AND (g.externalId = :identifier OR g.setId = :identifier)")
    boolean isIdentifierActive(@Param("identifier") String identifier);

    /**
     * True when any gauge row, deleted or not, carries the identifier.
     */
    @Query("SELECT COUNT(g) > 0 FROM Gauge g WHERE g.externalId = :identifier OR g.setId = :identifier")
    boolean isIdentifierPresent(@Param("identifier") String identifier);

    @Query("SELECT COUNT(g) > 0 FROM Gauge g WHERE g.serialNumber = :serialNumber " +
           "AND g.equipmentClass = com.gauge.model.EquipmentClass.THREAD_GAUGE")
    boolean existsThreadGaugeWithSerialNumber(@Param("serialNumber") String serialNumber);

    /**
     * Set ids with fewer than two active members while at least one member is active.
     * Retired sets have no active member and are not listed.
     */
    @Query("SELECT g.setId FROM Gauge g WHERE g.setId IS NOT NULL GROUP BY g.setId " +
           "HAVING SUM(CASE WHEN g.deletedAt IS NULL THEN 1 ELSE 0 END) = 1")
    List<String> findIncompleteSetIds();
}
