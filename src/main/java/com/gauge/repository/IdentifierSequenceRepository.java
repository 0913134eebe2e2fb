package com.gauge.repository;

import com.gauge.model.IdentifierSequence;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface IdentifierSequenceRepository extends JpaRepository<IdentifierSequence, Long> {

    /**
     * Exclusive lock on the counter row; held until the enclosing transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM IdentifierSequence s WHERE s.categoryId = :categoryId AND s.subType = :subType")
    Optional<IdentifierSequence> findForUpdate(@Param("categoryId") Long categoryId,
                                               @Param("subType") String subType);

    Optional<IdentifierSequence> findByCategoryIdAndSubType(Long categoryId, String subType);
}
