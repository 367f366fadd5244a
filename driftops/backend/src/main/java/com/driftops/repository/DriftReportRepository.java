package com.driftops.repository;

import com.driftops.entity.DriftReportRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface DriftReportRepository extends JpaRepository<DriftReportRecord, UUID> {

    Page<DriftReportRecord> findAllByOrderByComputedAtAsc(Pageable pageable);

    List<DriftReportRecord> findByCycleIdOrderByComputedAtAsc(String cycleId);
}
