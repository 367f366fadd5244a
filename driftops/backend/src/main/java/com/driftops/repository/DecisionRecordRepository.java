package com.driftops.repository;

import com.driftops.entity.DecisionRecord;
import com.driftops.model.CycleOutcome;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DecisionRecordRepository extends JpaRepository<DecisionRecord, UUID> {

    Page<DecisionRecord> findAllByOrderByRecordedAtAsc(Pageable pageable);

    Optional<DecisionRecord> findFirstByOrderByRecordedAtDesc();

    List<DecisionRecord> findByCycleIdOrderByRecordedAtAsc(String cycleId);

    @Query("""
        SELECT d FROM DecisionRecord d
        WHERE d.outcome IN :outcomes
        ORDER BY d.recordedAt DESC
    """)
    List<DecisionRecord> findRecentByOutcomes(
        @Param("outcomes") Collection<CycleOutcome> outcomes, Pageable pageable);
}
