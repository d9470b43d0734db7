package com.timemultiplier.api.security;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class BearerTokenFilterTest {

  private final BearerTokenFilter filter = new BearerTokenFilter("s3cret", new ObjectMapper());

  private MockFilterChain run(MockHttpServletRequest request, MockHttpServletResponse response)
      throws Exception {
    MockFilterChain chain = new MockFilterChain();
    filter.doFilter(request, response, chain);
    return chain;
  }

  @Test
  void matchingToken_passesThrough() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/stats");
    request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer s3cret");
    MockHttpServletResponse response = new MockHttpServletResponse();

    MockFilterChain chain = run(request, response);

    assertThat(chain.getRequest()).isSameAs(request);
    assertThat(response.getStatus()).isEqualTo(200);
  }

  @Test
  void missingToken_isForbidden() throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();

    MockFilterChain chain = run(new MockHttpServletRequest("GET", "/api/employees"), response);

    assertThat(chain.getRequest()).isNull();
    assertThat(response.getStatus()).isEqualTo(403);
    assertThat(response.getContentAsString()).contains("Invalid authentication");
  }

  @Test
  void wrongToken_isForbidden() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/config");
    request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer s3cre");
    MockHttpServletResponse response = new MockHttpServletResponse();

    run(request, response);

    assertThat(response.getStatus()).isEqualTo(403);
  }

  @Test
  void otherScheme_isForbidden() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/config");
    request.addHeader(HttpHeaders.AUTHORIZATION, "Basic czNjcmV0");
    MockHttpServletResponse response = new MockHttpServletResponse();

    run(request, response);

    assertThat(response.getStatus()).isEqualTo(403);
  }

  @Test
  void healthAndPreflight_areExempt() throws Exception {
    MockHttpServletResponse healthResponse = new MockHttpServletResponse();
    MockFilterChain healthChain =
        run(new MockHttpServletRequest("GET", "/api/health"), healthResponse);

    MockHttpServletRequest preflight = new MockHttpServletRequest("OPTIONS", "/api/employees");
    preflight.addHeader(HttpHeaders.ORIGIN, "http://dashboard.local");
    MockHttpServletResponse preflightResponse = new MockHttpServletResponse();
    MockFilterChain preflightChain = run(preflight, preflightResponse);

    assertThat(healthChain.getRequest()).isNotNull();
    assertThat(preflightChain.getRequest()).isNotNull();
    assertThat(healthResponse.getStatus()).isEqualTo(200);
  }

  @Test
  void pathsOutsideApi_areNotGuarded() throws Exception {
    MockFilterChain chain =
        run(new MockHttpServletRequest("GET", "/swagger-ui.html"), new MockHttpServletResponse());

    assertThat(chain.getRequest()).isNotNull();
  }
}
