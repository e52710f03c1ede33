package com.reliability.circuit;

import com.reliability.logging.LogEvent;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 단일 operation 보호용 CircuitBreaker
 *
 * - CLOSED : operation 직접 실행
 * - OPEN   : recoveryTimeout 경과 전까지 즉시 거부 (CircuitOpenException)
 * - HALF_OPEN : trial 1건만 실행, 성공 시 CLOSED / 실패 시 다시 OPEN
 *
 * 상태 판단(check → transition → permit)과 결과 반영은 lock 안에서 처리하고,
 * operation 자체는 lock 밖에서 실행한다.
 * recoveryTimeout은 별도 타이머 없이 다음 호출 시점에 판단한다.
 */
@Slf4j
public class CircuitBreaker {

    private enum Permit {
        STANDARD,
        TRIAL
    }

    @Getter
    private final String name;

    @Getter
    private final CircuitBreakerConfig config;

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<CircuitBreakerListener> listeners = new CopyOnWriteArrayList<>();

    // 아래 필드는 lock 보유 상태에서만 읽고 쓴다
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureTimestamp;
    private boolean trialInFlight;

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("circuit breaker name must not be blank");
        }
        this.name = name;
        this.config = config;
        this.clock = clock;

        log.info(
                "event={} circuit={} threshold={} timeoutSec={}",
                LogEvent.CIRCUIT_REGISTERED,
                name,
                config.failureThreshold(),
                config.recoveryTimeout().toSeconds()
        );
    }

    public void addListener(CircuitBreakerListener listener) {
        listeners.add(listener);
    }

    /**
     * operation을 보호 실행
     * - operation 예외는 실패로 집계한 뒤 그대로 다시 던진다
     *
     * @throws CircuitOpenException OPEN 상태로 호출이 거부된 경우 (operation 미실행)
     */
    public <T> T call(Supplier<T> operation) {
        Permit permit = acquirePermission();

        try {
            T result = operation.get();
            onSuccess(permit);
            return result;

        } catch (RuntimeException e) {
            onError(permit, e);
            throw e;

        } catch (Error e) {
            // Error는 집계 대상이 아님 (trial 권한만 반납)
            release(permit);
            throw e;
        }
    }

    /**
     * checked 예외를 던지는 operation 보호 실행
     */
    public <T> T callChecked(Callable<T> operation) throws Exception {
        Permit permit = acquirePermission();

        try {
            T result = operation.call();
            onSuccess(permit);
            return result;

        } catch (Exception e) {
            onError(permit, e);
            throw e;

        } catch (Error e) {
            release(permit);
            throw e;
        }
    }

    /**
     * OPEN으로 거부된 경우에만 fallback 결과로 대체
     * - operation 자체의 실패는 fallback 대상이 아니며 그대로 전파된다
     */
    public <T> T callWithFallback(Supplier<T> operation, Function<CircuitOpenException, T> fallback) {
        try {
            return call(operation);
        } catch (CircuitOpenException e) {
            log.warn("event={} circuit={}", LogEvent.FALLBACK, name);
            return fallback.apply(e);
        }
    }

    public void run(Runnable operation) {
        call(() -> {
            operation.run();
            return null;
        });
    }

    /**
     * 상태 조회 전용 (상태 변경 없음)
     * - recoveryTimeout이 지났더라도 다음 호출 전까지는 OPEN으로 보고된다
     */
    public CircuitBreakerSnapshot getState() {
        lock.lock();
        try {
            return new CircuitBreakerSnapshot(
                    name,
                    state,
                    failureCount,
                    lastFailureTimestamp,
                    config.failureThreshold(),
                    config.recoveryTimeout().toSeconds()
            );
        } finally {
            lock.unlock();
        }
    }

    public CircuitState getCurrentState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 마지막 실패 이후 recoveryTimeout의 2배 이상 OPEN 유지 중인지 여부
     */
    public boolean isStuckOpen() {
        lock.lock();
        try {
            if (state != CircuitState.OPEN || lastFailureTimestamp == null) {
                return false;
            }
            Duration openFor = Duration.between(lastFailureTimestamp, clock.instant());
            return openFor.compareTo(config.recoveryTimeout().multipliedBy(2)) > 0;
        } finally {
            lock.unlock();
        }
    }

    private Permit acquirePermission() {
        lock.lock();
        try {
            if (state == CircuitState.OPEN) {
                if (!recoveryTimeoutElapsed()) {
                    throw reject();
                }
                transitionTo(CircuitState.HALF_OPEN);
            }

            if (state == CircuitState.HALF_OPEN) {
                // trial은 동시에 1건만 허용
                if (trialInFlight) {
                    throw reject();
                }
                trialInFlight = true;
                return Permit.TRIAL;
            }

            return Permit.STANDARD;
        } finally {
            lock.unlock();
        }
    }

    private boolean recoveryTimeoutElapsed() {
        if (lastFailureTimestamp == null) {
            return true;
        }
        Duration elapsed = Duration.between(lastFailureTimestamp, clock.instant());
        return elapsed.compareTo(config.recoveryTimeout()) >= 0;
    }

    private CircuitOpenException reject() {
        log.debug("event={} circuit={} state={}", LogEvent.CIRCUIT_REJECTED, name, state);
        listeners.forEach(l -> l.onCallRejected(this));
        return new CircuitOpenException(name);
    }

    private void onSuccess(Permit permit) {
        lock.lock();
        try {
            failureCount = 0;
            if (permit == Permit.TRIAL) {
                trialInFlight = false;
            }
            if (state == CircuitState.HALF_OPEN) {
                transitionTo(CircuitState.CLOSED);
            }
        } finally {
            lock.unlock();
        }
    }

    private void onError(Permit permit, Throwable error) {
        if (!config.recordFailure().test(error)) {
            log.debug(
                    "event={} circuit={} cause={}",
                    LogEvent.CIRCUIT_IGNORED_ERROR,
                    name,
                    error.getClass().getSimpleName()
            );
            release(permit);
            return;
        }

        lock.lock();
        try {
            failureCount++;
            lastFailureTimestamp = clock.instant();
            if (permit == Permit.TRIAL) {
                trialInFlight = false;
            }

            // HALF_OPEN 중 실패는 failureCount와 무관하게 즉시 재차단
            if (state == CircuitState.HALF_OPEN || failureCount >= config.failureThreshold()) {
                if (state != CircuitState.OPEN) {
                    transitionTo(CircuitState.OPEN);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private void release(Permit permit) {
        if (permit != Permit.TRIAL) {
            return;
        }
        lock.lock();
        try {
            trialInFlight = false;
        } finally {
            lock.unlock();
        }
    }

    private void transitionTo(CircuitState next) {
        CircuitState prev = state;
        state = next;

        switch (next) {
            case OPEN -> log.warn(
                    "event={} circuit={} from={} failureCount={}",
                    LogEvent.CIRCUIT_OPENED,
                    name,
                    prev,
                    failureCount
            );
            case HALF_OPEN -> log.info("event={} circuit={}", LogEvent.CIRCUIT_HALF_OPEN, name);
            case CLOSED -> log.info("event={} circuit={}", LogEvent.CIRCUIT_CLOSED, name);
        }

        listeners.forEach(l -> l.onStateTransition(this, prev, next));
    }
}
