package com.driftops.repository;

import com.driftops.entity.ModelTransition;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.UUID;

public interface ModelTransitionRepository extends JpaRepository<ModelTransition, UUID> {

    List<ModelTransition> findAllByOrderBySequenceNoAsc();

    Page<ModelTransition> findAllByOrderBySequenceNoAsc(Pageable pageable);

    @Query("SELECT COALESCE(MAX(t.sequenceNo), 0) FROM ModelTransition t")
    long maxSequenceNo();
}
