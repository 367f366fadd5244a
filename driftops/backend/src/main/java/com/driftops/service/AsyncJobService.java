package com.driftops.service;

import com.driftops.dto.AsyncJobResponse;
import com.driftops.dto.AsyncJobStatus;
import com.driftops.exception.JobNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * Runs long operations (monitoring cycles) off the request thread. Jobs can be cancelled,
 * which interrupts the worker.
 */
@Slf4j
@Service
public class AsyncJobService {

    @Value("${jobs.pool-size:2}")
    private int poolSize;

    @Value("${jobs.max-retained:500}")
    private int maxRetained;

    private final Clock clock;
    private ExecutorService executor;
    private final ConcurrentHashMap<UUID, JobState> jobs = new ConcurrentHashMap<>();

    public AsyncJobService(Clock clock) {
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(1, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public UUID submit(String jobType, String requestId, Supplier<Object> task) {
        UUID jobId = UUID.randomUUID();
        JobState state = new JobState(jobId, jobType, requestId, Instant.now(clock));
        jobs.put(jobId, state);
        cleanupIfNeeded();

        state.future = executor.submit(() -> execute(state, task));
        log.info("Job queued | jobId={} | type={} | requestId={}", jobId, jobType, requestId);
        return jobId;
    }

    public AsyncJobResponse getJob(UUID jobId) {
        return find(jobId).toResponse();
    }

    /**
     * Interrupts a queued or running job. Finished jobs are returned unchanged.
     */
    public AsyncJobResponse cancel(UUID jobId) {
        JobState state = find(jobId);
        if (state.markCancelled(Instant.now(clock))) {
            Future<?> future = state.future;
            if (future != null) {
                future.cancel(true);
            }
            log.warn("Job cancelled | jobId={} | type={}", jobId, state.jobType);
        }
        return state.toResponse();
    }

    private JobState find(UUID jobId) {
        JobState state = jobs.get(jobId);
        if (state == null) {
            throw new JobNotFoundException(jobId);
        }
        return state;
    }

    private void execute(JobState state, Supplier<Object> task) {
        if (!state.markRunning(Instant.now(clock))) {
            return;
        }
        try {
            Object result = task.get();
            state.markCompleted(result, Instant.now(clock));
        } catch (Exception ex) {
            log.error("Job failed | jobId={} | type={} | error={}", state.jobId, state.jobType, ex.getMessage());
            state.markFailed(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName(), Instant.now(clock));
        }
    }

    private void cleanupIfNeeded() {
        if (jobs.size() <= maxRetained) {
            return;
        }
        jobs.entrySet().stream()
            .filter(e -> e.getValue().status.isTerminal())
            .sorted(Comparator.comparing(e -> e.getValue().createdAt))
            .limit(Math.max(1, jobs.size() - maxRetained))
            .map(Map.Entry::getKey)
            .forEach(jobs::remove);
    }

    private static final class JobState {
        private final UUID jobId;
        private final String jobType;
        private final String requestId;
        private final Instant createdAt;
        private volatile Future<?> future;
        private volatile Instant startedAt;
        private volatile Instant completedAt;
        private volatile AsyncJobStatus status = AsyncJobStatus.QUEUED;
        private volatile String message = "Queued";
        private volatile Object result;

        private JobState(UUID jobId, String jobType, String requestId, Instant createdAt) {
            this.jobId = jobId;
            this.jobType = jobType;
            this.requestId = requestId;
            this.createdAt = createdAt;
        }

        private synchronized boolean markRunning(Instant now) {
            if (status != AsyncJobStatus.QUEUED) {
                return false;
            }
            this.startedAt = now;
            this.status = AsyncJobStatus.RUNNING;
            this.message = "Running";
            return true;
        }

        private synchronized void markCompleted(Object result, Instant now) {
            if (status.isTerminal()) {
                return;
            }
            this.completedAt = now;
            this.status = AsyncJobStatus.COMPLETED;
            this.result = result;
            this.message = "Completed";
        }

        private synchronized void markFailed(String message, Instant now) {
            if (status.isTerminal()) {
                return;
            }
            this.completedAt = now;
            this.status = AsyncJobStatus.FAILED;
            this.message = message;
        }

        private synchronized boolean markCancelled(Instant now) {
            if (status.isTerminal()) {
                return false;
            }
            this.completedAt = now;
            this.status = AsyncJobStatus.CANCELLED;
            this.message = "Cancelled";
            return true;
        }

        private AsyncJobResponse toResponse() {
            return AsyncJobResponse.builder()
                .jobId(jobId)
                .jobType(jobType)
                .status(status)
                .terminal(status.isTerminal())
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .durationMs(startedAt != null && completedAt != null
                    ? Duration.between(startedAt, completedAt).toMillis() : null)
                .message(message)
                .result(result)
                .requestId(requestId)
                .build();
        }
    }
}
