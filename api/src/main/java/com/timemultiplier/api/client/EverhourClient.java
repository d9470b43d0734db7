package com.timemultiplier.api.client;

import com.timemultiplier.api.exception.UpstreamUnavailableException;
import com.timemultiplier.api.model.EverhourUser;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Looks up users in the Everhour API. Calls are single attempts: a failed lookup is never retried,
 * it either resolves to "not found" or raises {@link UpstreamUnavailableException}.
 */
@Slf4j
public class EverhourClient {

  static final String CIRCUIT_NAME = "everhourClientCircuit";
  static final String LIMITER_NAME = "everhourClientLimiter";

  private static final String USER_PATH = "/users/{id}";

  private final RestClient restClient;
  private final CircuitBreaker circuitBreaker;
  private final RateLimiter rateLimiter;

  public EverhourClient(
      RestClient restClient, CircuitBreakerRegistry cbRegistry, RateLimiterRegistry rlRegistry) {
    this.restClient = restClient;
    this.circuitBreaker = cbRegistry.circuitBreaker(CIRCUIT_NAME);
    this.rateLimiter = rlRegistry.rateLimiter(LIMITER_NAME);
  }

  // Throttled calls never reach the breaker, so they do not count toward its window.
  private <T> Supplier<T> decorateResilience(Supplier<T> supplier) {
    Supplier<T> guarded = CircuitBreaker.decorateSupplier(circuitBreaker, supplier);
    return RateLimiter.decorateSupplier(rateLimiter, guarded);
  }

  /**
   * Returns the user, or empty when Everhour answers with a client error (unknown id, forbidden).
   *
   * @throws UpstreamUnavailableException when Everhour cannot give a definitive answer
   */
  public Optional<EverhourUser> getUserById(String id) {
    if (id == null || id.isBlank()) {
      log.warn("Cannot look up Everhour user: id is null or blank");
      return Optional.empty();
    }

    Supplier<Optional<EverhourUser>> supplier =
        () -> {
          try {
            EverhourUser user =
                restClient.get().uri(USER_PATH, id).retrieve().body(EverhourUser.class);
            if (user == null) {
              log.warn("Everhour returned an empty body for user {}", id);
              return Optional.empty();
            }
            return Optional.of(user);
          } catch (RestClientResponseException e) {
            return handleRestError(e, id);
          } catch (RestClientException e) {
            log.error("Error calling Everhour for user {}: {}", id, e.toString());
            throw new UpstreamUnavailableException("Everhour is unreachable", e);
          }
        };

    try {
      return decorateResilience(supplier).get();
    } catch (CallNotPermittedException | RequestNotPermitted e) {
      log.warn("Everhour lookup for {} short-circuited: {}", id, e.getMessage());
      throw new UpstreamUnavailableException("Everhour is temporarily unavailable", e);
    }
  }

  private Optional<EverhourUser> handleRestError(RestClientResponseException e, String id) {
    HttpStatusCode status = e.getStatusCode();
    if (status.is4xxClientError()) {
      log.warn("Everhour user {} not available ({})", id, status.value());
      return Optional.empty();
    }
    log.error("Everhour error for user {}: {} – {}", id, status.value(), e.getMessage());
    throw new UpstreamUnavailableException("Everhour responded with " + status.value(), e);
  }
}
