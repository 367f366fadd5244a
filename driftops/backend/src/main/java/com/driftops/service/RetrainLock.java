package com.driftops.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide single permit guarding retraining. Acquisition never blocks: a second caller
 * gets an empty result while the permit is out.
 *
 * <pre>{@code
 * try (RetrainLock.Lease lease = lock.tryAcquire(cycleId).orElseThrow(...)) {
 *     ...
 * }
 * }</pre>
 */
@Slf4j
@Component
public class RetrainLock {

    private final Semaphore permit = new Semaphore(1);
    private final AtomicReference<String> holder = new AtomicReference<>();

    public Optional<Lease> tryAcquire(String owner) {
        if (!permit.tryAcquire()) {
            log.debug("Retrain lock busy | requestedBy={} | heldBy={}", owner, holder.get());
            return Optional.empty();
        }
        holder.set(owner);
        log.debug("Retrain lock acquired | owner={}", owner);
        return Optional.of(new Lease(owner));
    }

    public boolean isHeld() {
        return permit.availablePermits() == 0;
    }

    public Optional<String> holder() {
        return Optional.ofNullable(holder.get());
    }

    /** Scoped handle on the permit. Closing it more than once is a no-op. */
    public final class Lease implements AutoCloseable {

        private final String owner;
        private final AtomicBoolean released = new AtomicBoolean();

        private Lease(String owner) {
            this.owner = owner;
        }

        public String owner() {
            return owner;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                holder.compareAndSet(owner, null);
                permit.release();
                log.debug("Retrain lock released | owner={}", owner);
            }
        }
    }
}
