package com.driftops.service;

import com.driftops.dto.AbTestStatsResponse;
import com.driftops.exception.InvalidRequestException;
import com.driftops.exception.RegistryTransitionConflictException;
import com.driftops.model.ModelSnapshot;
import com.driftops.model.RoutingArm;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.zip.CRC32;

/**
 * Splits live traffic between production and a candidate under test. The arm is derived
 * from a hash of the request id, so the same request always lands on the same arm and
 * outcomes can be attributed without remembering routes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrafficRouterService {

    private final ModelRegistryService registry;
    private final Clock clock;

    private final AtomicReference<ActiveTest> active = new AtomicReference<>();

    public record AbTestConfig(String productionVersion, String candidateVersion, double splitRatio,
                               Instant startedAt, String cycleId) {

        public String versionFor(RoutingArm arm) {
            return arm == RoutingArm.CANDIDATE ? candidateVersion : productionVersion;
        }
    }

    public record RoutingDecision(String versionId, RoutingArm arm) {}

    public record ArmStats(long routed, long labelled, long correct) {

        public double accuracy() {
            return labelled == 0 ? 0.0 : (double) correct / labelled;
        }
    }

    public record AbTestSnapshot(AbTestConfig config, ArmStats production, ArmStats candidate) {

        public long minLabelled() {
            return Math.min(production.labelled(), candidate.labelled());
        }
    }

    public AbTestConfig startTest(ModelSnapshot production, ModelSnapshot candidate, double splitRatio, String cycleId) {
        if (!(splitRatio > 0.0 && splitRatio < 1.0)) {
            throw new InvalidRequestException("splitRatio must lie strictly between 0 and 1, got " + splitRatio);
        }
        AbTestConfig config = new AbTestConfig(production.id(), candidate.id(), splitRatio, Instant.now(clock), cycleId);
        if (!active.compareAndSet(null, new ActiveTest(config))) {
            throw new RegistryTransitionConflictException(
                "An A/B test is already running for candidate " + active.get().config.candidateVersion());
        }
        log.info("A/B test started | production={} | candidate={} | splitRatio={} | cycleId={}",
            production.id(), candidate.id(), splitRatio, cycleId);
        return config;
    }

    public RoutingDecision route(String requestId) {
        requireRequestId(requestId);
        ActiveTest test = active.get();
        if (test == null) {
            String productionId = registry.currentProduction().map(ModelSnapshot::id).orElse(null);
            return new RoutingDecision(productionId, RoutingArm.PRODUCTION);
        }
        RoutingArm arm = armFor(requestId, test.config.splitRatio());
        test.counters(arm).routed.incrementAndGet();
        return new RoutingDecision(test.config.versionFor(arm), arm);
    }

    /**
     * Records whether the prediction served for {@code requestId} turned out correct.
     * Returns empty when no test is running.
     */
    public Optional<RoutingDecision> recordOutcome(String requestId, boolean correct) {
        requireRequestId(requestId);
        ActiveTest test = active.get();
        if (test == null) {
            log.debug("Outcome ignored, no A/B test running | requestId={}", requestId);
            return Optional.empty();
        }
        RoutingArm arm = armFor(requestId, test.config.splitRatio());
        Counters counters = test.counters(arm);
        counters.labelled.incrementAndGet();
        if (correct) {
            counters.correct.incrementAndGet();
        }
        return Optional.of(new RoutingDecision(test.config.versionFor(arm), arm));
    }

    public Optional<AbTestConfig> activeTest() {
        return Optional.ofNullable(active.get()).map(t -> t.config);
    }

    public Optional<AbTestSnapshot> snapshot() {
        return Optional.ofNullable(active.get()).map(ActiveTest::snapshot);
    }

    /**
     * Ends the running test and returns its final statistics.
     */
    public Optional<AbTestSnapshot> conclude() {
        ActiveTest test = active.getAndSet(null);
        if (test == null) {
            return Optional.empty();
        }
        AbTestSnapshot last = test.snapshot();
        log.info("A/B test concluded | candidate={} | productionAccuracy={} | candidateAccuracy={} | labelled={}/{}",
            last.config().candidateVersion(), last.production().accuracy(), last.candidate().accuracy(),
            last.production().labelled(), last.candidate().labelled());
        return Optional.of(last);
    }

    public static AbTestStatsResponse toResponse(AbTestSnapshot s) {
        return AbTestStatsResponse.builder()
            .productionVersion(s.config().productionVersion())
            .candidateVersion(s.config().candidateVersion())
            .splitRatio(s.config().splitRatio())
            .startedAt(s.config().startedAt())
            .production(toArm(s.production()))
            .candidate(toArm(s.candidate()))
            .build();
    }

    private static AbTestStatsResponse.Arm toArm(ArmStats a) {
        return AbTestStatsResponse.Arm.builder()
            .routed(a.routed())
            .labelled(a.labelled())
            .correct(a.correct())
            .accuracy(a.accuracy())
            .build();
    }

    static RoutingArm armFor(String requestId, double splitRatio) {
        CRC32 crc = new CRC32();
        crc.update(requestId.getBytes(StandardCharsets.UTF_8));
        double bucket = crc.getValue() / (double) (1L << 32);
        return bucket < splitRatio ? RoutingArm.CANDIDATE : RoutingArm.PRODUCTION;
    }

    private static void requireRequestId(String requestId) {
        if (requestId == null || requestId.isBlank()) {
            throw new InvalidRequestException("requestId must not be blank");
        }
    }

    private static final class Counters {
        private final AtomicLong routed = new AtomicLong();
        private final AtomicLong labelled = new AtomicLong();
        private final AtomicLong correct = new AtomicLong();

        private ArmStats stats() {
            return new ArmStats(routed.get(), labelled.get(), correct.get());
        }
    }

    private static final class ActiveTest {
        private final AbTestConfig config;
        private final Counters production = new Counters();
        private final Counters candidate = new Counters();

        private ActiveTest(AbTestConfig config) {
            this.config = config;
        }

        private Counters counters(RoutingArm arm) {
            return arm == RoutingArm.CANDIDATE ? candidate : production;
        }

        private AbTestSnapshot snapshot() {
            return new AbTestSnapshot(config, production.stats(), candidate.stats());
        }
    }
}
