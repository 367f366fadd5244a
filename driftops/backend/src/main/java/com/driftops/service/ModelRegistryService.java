package com.driftops.service;

import com.driftops.dto.ModelTransitionResponse;
import com.driftops.dto.ModelVersionResponse;
import com.driftops.entity.ModelTransition;
import com.driftops.entity.ModelVersion;
import com.driftops.exception.InvalidRequestException;
import com.driftops.exception.ModelVersionNotFoundException;
import com.driftops.exception.RegistryTransitionConflictException;
import com.driftops.model.ModelMetrics;
import com.driftops.model.ModelSnapshot;
import com.driftops.model.ModelStage;
import com.driftops.repository.ModelTransitionRepository;
import com.driftops.repository.ModelVersionRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * Single-writer facade over the model store. Readers go through the atomically swapped
 * production/candidate snapshots; writers are serialised and commit each stage change as
 * one transaction before the snapshots move.
 *
 * <p>If the store is ever observed with more than one PRODUCTION version (or none after a
 * model has been promoted) the registry halts: promotions and rollbacks are refused until
 * an operator calls {@link #resumePromotions(String)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelRegistryService {

    private static final Pattern VERSION_PATTERN = Pattern.compile("^[a-zA-Z0-9._-]{1,64}$");

    private final ModelVersionRepository versionRepository;
    private final ModelTransitionRepository transitionRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    private final AtomicReference<ModelSnapshot> production = new AtomicReference<>();
    private final AtomicReference<ModelSnapshot> candidate = new AtomicReference<>();
    private final AtomicReference<String> haltReason = new AtomicReference<>();

    @PostConstruct
    void init() {
        refreshPointers();
        try {
            checkInvariant();
        } catch (RegistryTransitionConflictException ex) {
            log.error("Registry loaded in an inconsistent state: {}", ex.getMessage());
        }
        log.info("Model registry ready | production={} | candidate={}",
            currentProduction().map(ModelSnapshot::id).orElse("none"),
            currentCandidate().map(ModelSnapshot::id).orElse("none"));
    }

    public Optional<ModelSnapshot> currentProduction() {
        return Optional.ofNullable(production.get());
    }

    public Optional<ModelSnapshot> currentCandidate() {
        return Optional.ofNullable(candidate.get());
    }

    public boolean isHalted() {
        return haltReason.get() != null;
    }

    public Optional<String> haltReason() {
        return Optional.ofNullable(haltReason.get());
    }

    public synchronized ModelSnapshot registerCandidate(String artifactUri, ModelMetrics metrics, int trainingSamples,
                                                        String parentId, String cycleId) {
        ModelSnapshot registered = transactionTemplate.execute(status -> {
            for (ModelVersion stale : versionRepository.findByStage(ModelStage.CANDIDATE)) {
                moveTo(stale, ModelStage.ARCHIVED, false, "superseded by a newer candidate", cycleId);
            }
            ModelVersion version = versionRepository.save(ModelVersion.builder()
                .id(nextVersionId())
                .stage(ModelStage.CANDIDATE)
                .accuracy(metrics.accuracy())
                .precision(metrics.precision())
                .recall(metrics.recall())
                .f1(metrics.f1())
                .parentId(parentId)
                .artifactUri(artifactUri)
                .trainingSamples(trainingSamples)
                .createdAt(Instant.now(clock))
                .build());
            appendTransition(version.getId(), null, ModelStage.CANDIDATE, "trained", cycleId);
            return ModelSnapshot.of(version);
        });
        candidate.set(registered);
        log.info("Candidate registered | id={} | parent={} | accuracy={} | cycleId={}",
            registered.id(), parentId, metrics.accuracy(), cycleId);
        return registered;
    }

    /**
     * Moves {@code candidateId} to PRODUCTION and archives the current production version in
     * one transaction.
     */
    public synchronized ModelSnapshot promote(String candidateId, String reason, String cycleId) {
        ensureNotHalted();
        ModelSnapshot promoted = transactionTemplate.execute(status -> {
            checkInvariant();
            ModelVersion target = load(candidateId);
            if (target.getStage() != ModelStage.CANDIDATE) {
                throw new RegistryTransitionConflictException(
                    "Version '" + candidateId + "' is " + target.getStage() + ", only candidates can be promoted");
            }
            return swapProduction(target, false, reason, cycleId);
        });
        production.set(promoted);
        candidate.set(null);
        log.info("Promoted | id={} | reason={} | cycleId={}", promoted.id(), reason, cycleId);
        return promoted;
    }

    /**
     * Rollback path: re-promotes an ARCHIVED version that once served production.
     */
    public synchronized ModelSnapshot reinstate(String versionId, String reason, String cycleId) {
        ensureNotHalted();
        ModelSnapshot reinstated = transactionTemplate.execute(status -> {
            checkInvariant();
            ModelVersion target = load(versionId);
            if (target.getStage() != ModelStage.ARCHIVED || !target.wasEverProduction()) {
                throw new RegistryTransitionConflictException(
                    "Version '" + versionId + "' is not an archived former production version");
            }
            return swapProduction(target, true, reason, cycleId);
        });
        production.set(reinstated);
        log.info("Reinstated | id={} | reason={} | cycleId={}", reinstated.id(), reason, cycleId);
        return reinstated;
    }

    public synchronized ModelSnapshot archiveCandidate(String candidateId, String reason, String cycleId) {
        ModelSnapshot archived = transactionTemplate.execute(status -> {
            ModelVersion target = load(candidateId);
            if (target.getStage() != ModelStage.CANDIDATE) {
                throw new RegistryTransitionConflictException(
                    "Version '" + candidateId + "' is " + target.getStage() + ", only candidates can be archived");
            }
            return ModelSnapshot.of(moveTo(target, ModelStage.ARCHIVED, false, reason, cycleId));
        });
        ModelSnapshot current = candidate.get();
        if (current != null && current.id().equals(candidateId)) {
            candidate.set(null);
        }
        log.info("Candidate archived | id={} | reason={} | cycleId={}", candidateId, reason, cycleId);
        return archived;
    }

    /**
     * Clears a halt after manual repair of the store. Fails if the store is still inconsistent.
     */
    public synchronized void resumePromotions(String operator) {
        if (operator == null || operator.isBlank() || !VERSION_PATTERN.matcher(operator).matches()) {
            throw new InvalidRequestException("Operator must match ^[a-zA-Z0-9._-]{1,64}$");
        }
        String previous = haltReason.getAndSet(null);
        transactionTemplate.executeWithoutResult(status -> checkInvariant());
        refreshPointers();
        log.warn("Promotions resumed | operator={} | previousHalt={}", operator, previous);
    }

    public ModelSnapshot get(String id) {
        if (id == null || !VERSION_PATTERN.matcher(id).matches()) {
            throw new InvalidRequestException("Model version must match ^[a-zA-Z0-9._-]{1,64}$");
        }
        return versionRepository.findById(id).map(ModelSnapshot::of)
            .orElseThrow(() -> new ModelVersionNotFoundException(id));
    }

    public Optional<ModelSnapshot> find(String id) {
        return id == null ? Optional.empty() : versionRepository.findById(id).map(ModelSnapshot::of);
    }

    public Page<ModelVersionResponse> versions(Pageable pageable) {
        return versionRepository.findAllByOrderByCreatedAtAsc(pageable).map(v -> toResponse(ModelSnapshot.of(v)));
    }

    public Page<ModelTransitionResponse> transitions(Pageable pageable) {
        return transitionRepository.findAllByOrderBySequenceNoAsc(pageable).map(t -> ModelTransitionResponse.builder()
            .sequenceNo(t.getSequenceNo())
            .versionId(t.getVersionId())
            .fromStage(t.getFromStage())
            .toStage(t.getToStage())
            .reason(t.getReason())
            .cycleId(t.getCycleId())
            .occurredAt(t.getOccurredAt())
            .build());
    }

    /**
     * Replays the transition log and returns the largest number of versions that held
     * PRODUCTION at once. Anything above 1 means the single-production invariant was broken.
     */
    public int maxConcurrentProductionInHistory() {
        Set<String> serving = new HashSet<>();
        int max = 0;
        for (ModelTransition t : transitionRepository.findAllByOrderBySequenceNoAsc()) {
            if (t.getFromStage() == ModelStage.PRODUCTION) {
                serving.remove(t.getVersionId());
            }
            if (t.getToStage() == ModelStage.PRODUCTION) {
                serving.add(t.getVersionId());
            }
            max = Math.max(max, serving.size());
        }
        return max;
    }

    public static ModelVersionResponse toResponse(ModelSnapshot s) {
        return ModelVersionResponse.builder()
            .id(s.id())
            .stage(s.stage())
            .accuracy(s.metrics().accuracy())
            .precision(s.metrics().precision())
            .recall(s.metrics().recall())
            .f1(s.metrics().f1())
            .parentId(s.parentId())
            .artifactUri(s.artifactUri())
            .trainingSamples(s.trainingSamples())
            .createdAt(s.createdAt())
            .promotedAt(s.promotedAt())
            .archivedAt(s.archivedAt())
            .build();
    }

    private ModelSnapshot swapProduction(ModelVersion target, boolean rollback, String reason, String cycleId) {
        // archive first so the log never shows two PRODUCTION entries
        for (ModelVersion current : versionRepository.findByStage(ModelStage.PRODUCTION)) {
            moveTo(current, ModelStage.ARCHIVED, false, "replaced by " + target.getId() + ": " + reason, cycleId);
        }
        ModelVersion promoted = moveTo(target, ModelStage.PRODUCTION, rollback, reason, cycleId);
        if (versionRepository.countByStage(ModelStage.PRODUCTION) != 1) {
            throw new RegistryTransitionConflictException("Promotion of '" + target.getId() + "' left the store inconsistent");
        }
        return ModelSnapshot.of(promoted);
    }

    private ModelVersion moveTo(ModelVersion version, ModelStage target, boolean rollback, String reason, String cycleId) {
        ModelStage from = version.getStage();
        if (!from.canTransitionTo(target, rollback)) {
            throw new RegistryTransitionConflictException(
                "Illegal transition " + from + " -> " + target + " for version '" + version.getId() + "'");
        }
        Instant now = Instant.now(clock);
        version.setStage(target);
        if (target == ModelStage.PRODUCTION) {
            if (version.getPromotedAt() == null) {
                version.setPromotedAt(now);
            }
            version.setArchivedAt(null);
        } else if (target == ModelStage.ARCHIVED) {
            version.setArchivedAt(now);
        }
        ModelVersion saved = versionRepository.saveAndFlush(version);
        appendTransition(saved.getId(), from, target, reason, cycleId);
        return saved;
    }

    private void appendTransition(String versionId, ModelStage from, ModelStage to, String reason, String cycleId) {
        transitionRepository.save(ModelTransition.builder()
            .versionId(versionId)
            .fromStage(from)
            .toStage(to)
            .reason(truncate(reason, 512))
            .cycleId(cycleId)
            .sequenceNo(transitionRepository.maxSequenceNo() + 1)
            .occurredAt(Instant.now(clock))
            .build());
        transitionRepository.flush();
    }

    private void checkInvariant() {
        List<ModelVersion> serving = versionRepository.findByStage(ModelStage.PRODUCTION);
        boolean everPromoted = !serving.isEmpty() || versionRepository.existsByPromotedAtIsNotNull();
        if (serving.size() > 1) {
            halt(serving.size() + " versions hold PRODUCTION: "
                + serving.stream().map(ModelVersion::getId).toList());
        } else if (serving.isEmpty() && everPromoted) {
            halt("no version holds PRODUCTION although a model has been promoted before");
        }
    }

    private void halt(String reason) {
        haltReason.compareAndSet(null, reason);
        log.error("Registry invariant violated, automated promotions halted | reason={}", reason);
        throw new RegistryTransitionConflictException("Registry invariant violated: " + reason);
    }

    private void ensureNotHalted() {
        String reason = haltReason.get();
        if (reason != null) {
            throw new RegistryTransitionConflictException(
                "Automated promotions are halted until manually resolved: " + reason);
        }
    }

    private void refreshPointers() {
        List<ModelVersion> serving = versionRepository.findByStage(ModelStage.PRODUCTION);
        production.set(serving.size() == 1 ? ModelSnapshot.of(serving.get(0)) : null);
        candidate.set(versionRepository.findFirstByStageOrderByCreatedAtDesc(ModelStage.CANDIDATE)
            .map(ModelSnapshot::of).orElse(null));
    }

    private ModelVersion load(String id) {
        return versionRepository.findById(id).orElseThrow(() -> new ModelVersionNotFoundException(id));
    }

    private String nextVersionId() {
        long n = versionRepository.count() + 1;
        while (versionRepository.existsById("v" + n)) {
            n++;
        }
        return "v" + n;
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
