package dev.gazettemonitor.service;

import dev.gazettemonitor.exception.AlreadyRunningException;
import dev.gazettemonitor.exception.BusyException;
import dev.gazettemonitor.metrics.MonitorMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Client-wide lock held for the whole round trip of a manual search.
 * While held, screen switches and schedule mutations fail with {@link BusyException}.
 * There is no timeout and no queue. Other clients are not excluded.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExecutionMutex {

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final MonitorMetrics metrics;

    /**
     * @throws AlreadyRunningException if the lock is already held; the lock stays held
     */
    public void acquire() {
        if (!running.compareAndSet(false, true)) {
            metrics.recordBusyRejection();
            throw new AlreadyRunningException();
        }
        log.debug("Execution lock acquired");
    }

    public void release() {
        if (running.getAndSet(false)) {
            log.debug("Execution lock released");
        }
    }

    public boolean isHeld() {
        return running.get();
    }

    /**
     * Fail fast when a search is running. The attempted operation must be discarded.
     *
     * @param operation short description used in the notice, e.g. "switch screens"
     */
    public void ensureIdle(String operation) {
        if (running.get()) {
            metrics.recordBusyRejection();
            log.info("Rejected '{}': manual search in progress", operation);
            throw new BusyException(operation);
        }
    }

    /**
     * Run an operation while holding the lock. The lock is released on every exit path:
     * completion, error, cancellation, or an exception thrown while building the operation.
     */
    public <T> Mono<T> guard(Supplier<Mono<T>> operation) {
        return Mono.defer(() -> {
            acquire();
            Mono<T> guarded;
            try {
                guarded = operation.get();
            } catch (RuntimeException e) {
                release();
                return Mono.error(e);
            }
            return guarded.doFinally(signal -> release());
        });
    }
}
