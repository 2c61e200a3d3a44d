/*
 * どこで: Crons Web 設定テスト
 * 何を: リクエスト開始時に MDC へ積んだキーが完了時に取り除かれることを検証する
 * なぜ: スレッド再利用時に別リクエストのモニター情報がログへ漏れないようにするため
 */
package com.example.crons.config;

import static org.assertj.core.api.Assertions.assertThat;

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
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void putsRequestKeysAndRemovesThemAfterCompletion() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("GET", "/monitors/nightly-report");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Trace-Id", "trace-1");
    request.setParameter("environment", "staging");
    request.setAttribute(
        HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("slug", "nightly-report"));
    final MockHttpServletResponse response = new MockHttpServletResponse();

    assertThat(interceptor.preHandle(request, response, new Object())).isTrue();

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("trace_id")).isEqualTo("trace-1");
    assertThat(MDC.get("http_method")).isEqualTo("GET");
    assertThat(MDC.get("http_path")).isEqualTo("/monitors/nightly-report");
    assertThat(MDC.get("monitor_slug")).isEqualTo("nightly-report");
    assertThat(MDC.get("environment")).isEqualTo("staging");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("monitor_slug")).isNull();
    assertThat(MDC.get("environment")).isNull();
  }

  @Test
  void generatesRequestIdAndSkipsMissingKeys() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/monitors/nightly-report/checkins");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isNotBlank();
    assertThat(MDC.get("trace_id")).isNull();
    assertThat(MDC.get("monitor_slug")).isNull();
  }
}
