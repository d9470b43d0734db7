package com.timemultiplier.api.client;

import com.timemultiplier.api.exception.UpstreamUnavailableException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import java.time.Duration;

final class ResilienceTestUtils {

  private ResilienceTestUtils() {}

  /** A breaker that opens after {@code minimumCalls} consecutive upstream failures. */
  static CircuitBreakerRegistry circuitBreakerRegistry(int minimumCalls) {
    CircuitBreakerConfig cbConfig =
        CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(minimumCalls)
            .minimumNumberOfCalls(minimumCalls)
            .failureRateThreshold(50f)
            .waitDurationInOpenState(Duration.ofMinutes(1))
            .recordExceptions(UpstreamUnavailableException.class)
            .build();
    return CircuitBreakerRegistry.of(cbConfig);
  }

  /** Allows {@code permits} calls, then rejects immediately for the rest of the test. */
  static RateLimiterRegistry exhaustibleRateLimiterRegistry(int permits) {
    RateLimiterConfig rlConfig =
        RateLimiterConfig.custom()
            .limitForPeriod(permits)
            .limitRefreshPeriod(Duration.ofMinutes(10))
            .timeoutDuration(Duration.ZERO)
            .build();
    return RateLimiterRegistry.of(rlConfig);
  }

  static RateLimiterRegistry permissiveRateLimiterRegistry() {
    RateLimiterConfig rlConfig =
        RateLimiterConfig.custom()
            .limitForPeriod(100)
            .limitRefreshPeriod(Duration.ofMillis(100))
            .timeoutDuration(Duration.ZERO)
            .build();
    return RateLimiterRegistry.of(rlConfig);
  }
}
