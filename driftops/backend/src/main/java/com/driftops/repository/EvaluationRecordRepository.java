package com.driftops.repository;

import com.driftops.entity.EvaluationRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface EvaluationRecordRepository extends JpaRepository<EvaluationRecord, UUID> {

    Page<EvaluationRecord> findAllByOrderByEvaluatedAtAsc(Pageable pageable);

    Optional<EvaluationRecord> findFirstByVersionIdOrderByEvaluatedAtDesc(String versionId);
}
