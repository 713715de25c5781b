package me.golemcore.memory.retrieval;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;

/**
 * One circuit breaker per retrieval source.
 *
 * <p>
 * A breaker opens after {@code threshold} consecutive failures (a count-based
 * window of that size with a 100% failure-rate threshold), stays open for
 * {@code cooldown}, then lets a single trial call through: success closes it,
 * failure opens it again.
 */
@Slf4j
public class SourceBreakers {

    private final String scope;
    private final CircuitBreakerRegistry registry;

    public SourceBreakers(String scope, int threshold, Duration cooldown) {
        this.scope = scope;
        int window = Math.max(1, threshold);
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(window)
                .minimumNumberOfCalls(window)
                .failureRateThreshold(100)
                .waitDurationInOpenState(cooldown)
                .permittedNumberOfCallsInHalfOpenState(1)
                .recordExceptions(Exception.class)
                .build();
        this.registry = CircuitBreakerRegistry.of(config);
        this.registry.getEventPublisher().onEntryAdded(event -> event.getAddedEntry().getEventPublisher()
                .onStateTransition(transition -> log.warn("[ConcurrentRetriever] {} breaker for '{}': {}",
                        this.scope, transition.getCircuitBreakerName(), transition.getStateTransition())));
    }

    public CircuitBreaker forSource(String source) {
        return registry.circuitBreaker(source);
    }

    public Map<String, CircuitBreaker.State> states() {
        Map<String, CircuitBreaker.State> states = new TreeMap<>();
        registry.getAllCircuitBreakers().forEach(breaker -> states.put(breaker.getName(), breaker.getState()));
        return states;
    }
}
