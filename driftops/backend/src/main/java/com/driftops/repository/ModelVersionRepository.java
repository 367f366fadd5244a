package com.driftops.repository;

import com.driftops.entity.ModelVersion;
import com.driftops.model.ModelStage;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ModelVersionRepository extends JpaRepository<ModelVersion, String> {

    List<ModelVersion> findByStage(ModelStage stage);

    long countByStage(ModelStage stage);

    Optional<ModelVersion> findFirstByStageOrderByCreatedAtDesc(ModelStage stage);

    Page<ModelVersion> findAllByOrderByCreatedAtAsc(Pageable pageable);

    boolean existsByPromotedAtIsNotNull();
}
