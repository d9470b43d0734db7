package com.timemultiplier.api.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.timemultiplier.api.client.EverhourClient;
import com.timemultiplier.api.exception.UpstreamUnavailableException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestClient;

@Configuration
public class DashboardBeansConfig {

  private static final Logger log = LoggerFactory.getLogger(DashboardBeansConfig.class);

  @Bean
  public RestClient everhourRestClient(
      @Value("${everhour.base-url:https://api.everhour.com}") String baseUrl,
      @Value("${everhour.api-key:}") String apiKey) {
    ObjectMapper mapper = new ObjectMapper();
    mapper.findAndRegisterModules();
    mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    MappingJackson2HttpMessageConverter converter = new MappingJackson2HttpMessageConverter(mapper);

    if (apiKey.isBlank()) {
      log.warn("everhour.api-key is not set; employee lookups will be rejected by Everhour");
    }

    return RestClient.builder()
        .baseUrl(baseUrl)
        .messageConverters(
            list -> {
              list.removeIf(c -> c instanceof MappingJackson2HttpMessageConverter);
              list.add(converter);
            })
        .defaultHeader("Accept", "application/json")
        .defaultHeader("X-Api-Key", apiKey)
        .requestInterceptor(
            (request, body, execution) -> {
              log.debug("Request: {} {}", request.getMethod(), request.getURI());
              try {
                var response = execution.execute(request, body);
                log.debug("Response: {} {}", response.getStatusCode(), response.getHeaders());
                return response;
              } catch (Exception e) {
                log.error(
                    "Error executing request [{} {}]: {}",
                    request.getMethod(),
                    request.getURI(),
                    e.getMessage());
                throw e;
              }
            })
        .build();
  }

  @Bean
  public EverhourClient everhourClient(
      RestClient everhourRestClient,
      CircuitBreakerRegistry cbRegistry,
      RateLimiterRegistry rlRegistry) {
    return new EverhourClient(everhourRestClient, cbRegistry, rlRegistry);
  }

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean
  public GroupedOpenApi dashboardApi() {
    return GroupedOpenApi.builder().group("dashboard").pathsToMatch("/api/**").build();
  }

  @Bean
  public CircuitBreakerRegistry circuitBreakerRegistry() {
    CircuitBreakerConfig cbConfig =
        CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .slowCallRateThreshold(50)
            .slowCallDurationThreshold(Duration.ofSeconds(5))
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .permittedNumberOfCallsInHalfOpenState(2)
            .minimumNumberOfCalls(5)
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(10)
            .recordExceptions(UpstreamUnavailableException.class)
            .build();

    return CircuitBreakerRegistry.of(cbConfig);
  }

  @Bean
  public RateLimiterRegistry rateLimiterRegistry() {
    RateLimiterConfig rlConfig =
        RateLimiterConfig.custom()
            .limitRefreshPeriod(Duration.ofSeconds(1))
            .limitForPeriod(5) // 5 lookups per second
            .timeoutDuration(Duration.ofMillis(500))
            .build();

    return RateLimiterRegistry.of(rlConfig);
  }
}
