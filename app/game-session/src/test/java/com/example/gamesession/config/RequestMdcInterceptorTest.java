package com.example.gamesession.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.HandlerMapping;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void putsMatchAndPlayerKeysAndRemovesThemAfterCompletion() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/matches/m-1");
    request.setAttribute(
        HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("matchId", "m-1"));
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Forwarded-For", "10.0.0.1, 10.0.0.2");
    request.addHeader("X-Player-Id", "p1");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    assertThat(interceptor.preHandle(request, response, new Object())).isTrue();

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("GET");
    assertThat(MDC.get("client_ip")).isEqualTo("10.0.0.1");
    assertThat(MDC.get("match_id")).isEqualTo("m-1");
    assertThat(MDC.get("player_id")).isEqualTo("p1");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("match_id")).isNull();
    assertThat(MDC.get("player_id")).isNull();
  }

  @Test
  void pathPlayerIdWinsOverHeaderAndRequestIdIsGenerated() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("GET", "/v1/players/p2/match");
    request.setAttribute(
        HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("playerId", "p2"));
    request.addHeader("X-Player-Id", "p1");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("player_id")).isEqualTo("p2");
    assertThat(MDC.get("request_id")).isNotBlank();
    assertThat(MDC.get("match_id")).isNull();
  }

  @Test
  void nonStringPathVariablesAreConvertedToText() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/matches/42");
    final Map<Object, Object> variables = new HashMap<>();
    variables.put("matchId", 42);
    variables.put("ignored", null);
    request.setAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, variables);

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("match_id")).isEqualTo("42");
  }
}
