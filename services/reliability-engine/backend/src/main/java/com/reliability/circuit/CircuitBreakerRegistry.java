package com.reliability.circuit;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 살아있는 CircuitBreaker 목록 (상태 집계/리포트 전용)
 *
 * - 한 번 등록된 breaker는 제거하지 않는다
 * - 이름은 유일해야 한다
 */
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final List<Consumer<CircuitBreaker>> registrationHooks = new CopyOnWriteArrayList<>();
    private final Clock clock;

    // 등록과 hook 추가를 직렬화 (breaker당 hook 1회 적용)
    private final Object registrationLock = new Object();

    public CircuitBreakerRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * 외부에서 생성한 breaker 등록
     * - 같은 인스턴스 재등록은 무시
     * - 같은 이름의 다른 인스턴스는 거부
     */
    public void register(CircuitBreaker breaker) {
        synchronized (registrationLock) {
            CircuitBreaker existing = breakers.putIfAbsent(breaker.getName(), breaker);

            if (existing == null) {
                registrationHooks.forEach(hook -> hook.accept(breaker));
                return;
            }

            if (existing != breaker) {
                throw new IllegalArgumentException(
                        "circuit breaker already registered: " + breaker.getName()
                );
            }
        }
    }

    /**
     * 이름으로 조회, 없으면 생성 후 등록
     */
    public CircuitBreaker circuitBreaker(String name, CircuitBreakerConfig config) {
        CircuitBreaker found = breakers.get(name);
        if (found != null) {
            return found;
        }

        synchronized (registrationLock) {
            CircuitBreaker raced = breakers.get(name);
            if (raced != null) {
                return raced;
            }

            CircuitBreaker created = new CircuitBreaker(name, config, clock);
            breakers.put(name, created);
            registrationHooks.forEach(hook -> hook.accept(created));
            return created;
        }
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public Collection<CircuitBreaker> all() {
        return Collections.unmodifiableCollection(breakers.values());
    }

    /**
     * 등록 hook 추가 (이미 등록된 breaker에도 즉시 적용)
     */
    public void onRegister(Consumer<CircuitBreaker> hook) {
        synchronized (registrationLock) {
            registrationHooks.add(hook);
            breakers.values().forEach(hook);
        }
    }

    /**
     * 이름순 정렬된 전체 상태 스냅샷
     */
    public Map<String, CircuitBreakerSnapshot> snapshotAll() {
        Map<String, CircuitBreakerSnapshot> snapshots = new TreeMap<>();
        breakers.forEach((name, breaker) -> snapshots.put(name, breaker.getState()));
        return snapshots;
    }

    public List<String> listOpen() {
        List<String> open = new ArrayList<>();
        breakers.forEach((name, breaker) -> {
            if (breaker.getCurrentState() == CircuitState.OPEN) {
                open.add(name);
            }
        });
        Collections.sort(open);
        return open;
    }

    /**
     * OPEN 상태가 recoveryTimeout x 2 이상 지속된 breaker (stuck open)
     */
    public List<String> listCritical() {
        List<String> critical = new ArrayList<>();
        breakers.forEach((name, breaker) -> {
            if (breaker.isStuckOpen()) {
                critical.add(name);
            }
        });
        Collections.sort(critical);
        return critical;
    }
}
