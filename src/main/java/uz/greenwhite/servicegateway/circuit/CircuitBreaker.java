package uz.greenwhite.servicegateway.circuit;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Callable;

/**
 * Failure isolation state machine: CLOSED → OPEN → HALF_OPEN → CLOSED | OPEN.
 *
 * Failures and successes are both kept as timestamps inside {@code monitoringPeriod},
 * so threshold, minimum throughput and failure rate all look at the same window.
 * OPEN turns into HALF_OPEN lazily, on the first state read after {@code nextAttemptTime};
 * the next call is then the recovery probe. Only one probe is in flight at a time, other
 * callers are rejected until its outcome is recorded. One successful probe closes the circuit.
 * A call ended by thread interruption is not an outcome of the backend and is not recorded.
 *
 * State is guarded by the instance monitor. The protected call itself runs outside the lock.
 */
@Slf4j
public class CircuitBreaker {

    @Getter
    private final String name;
    @Getter
    private final CircuitBreakerConfig config;
    private final Clock clock;

    private final Deque<FailureRecord> failures = new ArrayDeque<>();
    private final Deque<Long> successes = new ArrayDeque<>();
    private CircuitState state = CircuitState.CLOSED;
    private long lastFailureTime;
    private long nextAttemptTime;
    private boolean probeInFlight;

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this.name = name;
        this.config = config;
        this.clock = clock;
    }

    public synchronized boolean isOpen() {
        updateState();
        return state == CircuitState.OPEN;
    }

    public synchronized CircuitState getState() {
        updateState();
        return state;
    }

    public synchronized void recordSuccess() {
        long now = clock.millis();
        updateState();
        successes.addLast(now);
        probeInFlight = false;

        if (state == CircuitState.HALF_OPEN) {
            state = CircuitState.CLOSED;
            failures.clear();
            successes.clear();
            lastFailureTime = 0;
            log.info("Circuit breaker [{}] closed after successful recovery attempt", name);
        } else if (state == CircuitState.CLOSED) {
            pruneOldRecords(now);
        }
    }

    public synchronized void recordFailure(String reason) {
        long now = clock.millis();
        updateState();
        failures.addLast(new FailureRecord(now, reason != null ? reason : "Unknown error"));
        lastFailureTime = now;
        probeInFlight = false;
        pruneOldRecords(now);

        if (state == CircuitState.HALF_OPEN) {
            open(now);
            log.warn("Circuit breaker [{}] reopened after failed recovery attempt: {}", name, reason);
        } else if (state == CircuitState.CLOSED && shouldOpen()) {
            open(now);
            log.warn("Circuit breaker [{}] opened: failures={}, threshold={}, window={}ms",
                    name, failures.size(), config.failureThreshold(), config.monitoringPeriod().toMillis());
        }
    }

    /**
     * Admission check for callers that record outcomes themselves. CLOSED always admits;
     * HALF_OPEN admits a single probe until {@link #recordSuccess}, {@link #recordFailure}
     * or {@link #releasePermission} is called.
     *
     * @return false when the call must be rejected
     */
    public synchronized boolean tryAcquirePermission() {
        updateState();
        switch (state) {
            case CLOSED:
                return true;
            case HALF_OPEN:
                if (probeInFlight) {
                    log.debug("Circuit breaker [{}] half-open, probe already in flight", name);
                    return false;
                }
                probeInFlight = true;
                return true;
            default:
                return false;
        }
    }

    /**
     * Gives back a permission without an outcome, e.g. when the call was cancelled.
     */
    public synchronized void releasePermission() {
        probeInFlight = false;
    }

    /**
     * CLOSED with nothing left in the monitoring window. Such a breaker carries no
     * state worth keeping and can be dropped from its registry.
     */
    public synchronized boolean isIdle() {
        updateState();
        pruneOldRecords(clock.millis());
        return state == CircuitState.CLOSED && failures.isEmpty() && successes.isEmpty() && !probeInFlight;
    }

    /**
     * Run {@code operation} unless the circuit is open. The outcome is recorded and
     * the original exception rethrown after recording.
     *
     * @throws CircuitBreakerOpenException when open, or half-open with a probe in flight;
     *                                     the operation is not invoked
     */
    public <T> T execute(Callable<T> operation) throws Exception {
        if (!tryAcquirePermission()) {
            throw new CircuitBreakerOpenException(name, nextAttemptTime());
        }
        return invoke(operation);
    }

    /**
     * Like {@link #execute} but calls {@code fallback} when the circuit is open,
     * either before the call or as a result of its failure.
     */
    public <T> T executeWithFallback(Callable<T> operation, Callable<T> fallback) throws Exception {
        if (!tryAcquirePermission()) {
            log.info("Circuit breaker [{}] not admitting calls, executing fallback", name);
            return fallback.call();
        }

        try {
            return invoke(operation);
        } catch (Exception e) {
            if (isOpen()) {
                log.info("Circuit breaker [{}] opened during execution, trying fallback", name);
                return fallback.call();
            }
            throw e;
        }
    }

    public synchronized CircuitBreakerMetrics getMetrics() {
        updateState();
        pruneOldRecords(clock.millis());

        int failureCount = failures.size();
        int successCount = successes.size();
        int total = failureCount + successCount;

        return CircuitBreakerMetrics.builder()
                .name(name)
                .state(state)
                .failureCount(failureCount)
                .successCount(successCount)
                .failureRate(total > 0 ? (double) failureCount / total : 0)
                .lastFailureTime(lastFailureTime)
                .nextAttemptTime(nextAttemptTime)
                .build();
    }

    /**
     * Administrative hard reset to CLOSED with empty history.
     */
    public synchronized void reset() {
        state = CircuitState.CLOSED;
        failures.clear();
        successes.clear();
        lastFailureTime = 0;
        nextAttemptTime = 0;
        probeInFlight = false;
        log.info("Circuit breaker [{}] manually reset to closed state", name);
    }

    synchronized long nextAttemptTime() {
        return nextAttemptTime;
    }

    private <T> T invoke(Callable<T> operation) throws Exception {
        T result;
        try {
            result = operation.call();
        } catch (Exception e) {
            if (isInterruption(e)) {
                releasePermission();
                log.debug("Circuit breaker [{}] call interrupted, outcome not recorded", name);
            } else {
                recordFailure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
            throw e;
        }
        recordSuccess();
        return result;
    }

    private static boolean isInterruption(Throwable e) {
        if (Thread.currentThread().isInterrupted()) {
            return true;
        }
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }

    private void open(long now) {
        state = CircuitState.OPEN;
        nextAttemptTime = now + config.recoveryTimeout().toMillis();
    }

    private void updateState() {
        if (state == CircuitState.OPEN && clock.millis() >= nextAttemptTime) {
            state = CircuitState.HALF_OPEN;
            probeInFlight = false;
            log.info("Circuit breaker [{}] transitioning to half-open for recovery attempt", name);
        }
    }

    private boolean shouldOpen() {
        int recentFailures = failures.size();
        int total = recentFailures + successes.size();
        if (total < config.minimumThroughput()) {
            return false;
        }
        return recentFailures >= config.failureThreshold();
    }

    private void pruneOldRecords(long now) {
        long cutoff = now - config.monitoringPeriod().toMillis();
        while (!failures.isEmpty() && failures.peekFirst().timestamp() <= cutoff) {
            failures.pollFirst();
        }
        while (!successes.isEmpty() && successes.peekFirst() <= cutoff) {
            successes.pollFirst();
        }
    }

    private record FailureRecord(long timestamp, String reason) {
    }
}
