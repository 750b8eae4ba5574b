package com.sentient.repository;

import com.sentient.entity.PlanRecord;
import com.sentient.entity.PlanRecordId;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for PlanRecord entity operations.
 *
 * Record lookups by {@code (userId, recordId)} are served by the
 * {@code idx_plan_user_record} index instead of scanning a user's partition.
 *
 * @see com.sentient.entity.PlanRecord
 */
@Repository
public interface PlanRecordRepository extends JpaRepository<PlanRecord, PlanRecordId> {

    Optional<PlanRecord> findByUserIdAndRecordId(String userId, String recordId);

    /**
     * Most recent plans of a user first.
     *
     * @param userId the owning user
     * @param pageable limit of rows to return
     * @return plans ordered by creation time descending
     */
    @Query("SELECT p FROM PlanRecord p WHERE p.userId = :userId ORDER BY p.createdAt DESC")
    List<PlanRecord> findRecentByUserId(@Param("userId") String userId, Pageable pageable);
}
