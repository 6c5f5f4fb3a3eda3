package io.matchradar.dispatch.core.breaker;

import io.matchradar.dispatch.config.CircuitBreakerConfig;
import io.matchradar.dispatch.config.DispatchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Holds one {@link CircuitBreaker} per operation class, created on first use.
 */
@Service
public class CircuitBreakerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerConfig defaultConfig;
    private final Clock clock;

    public CircuitBreakerRegistry(DispatchConfig dispatchConfig, Clock clock) {
        this.defaultConfig = dispatchConfig.circuitBreaker();
        this.clock = clock;
    }

    public CircuitBreaker circuitBreaker(String operationName) {
        return breakers.computeIfAbsent(operationName, name -> {
            logger.debug("Creating circuit breaker for {}", name);
            return new CircuitBreaker(name, defaultConfig, clock);
        });
    }

    public CircuitBreaker circuitBreaker(String operationName, CircuitBreakerConfig config) {
        return breakers.computeIfAbsent(operationName, name -> new CircuitBreaker(name, config, clock));
    }

    public Map<String, CircuitBreakerStats> getAllStats() {
        return breakers.values().stream()
                .collect(Collectors.toMap(CircuitBreaker::getName, CircuitBreaker::getStats));
    }

    public void reset(String operationName) {
        CircuitBreaker breaker = breakers.get(operationName);
        if (breaker != null) {
            breaker.reset();
        }
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
        logger.info("Reset {} circuit breakers", breakers.size());
    }
}
