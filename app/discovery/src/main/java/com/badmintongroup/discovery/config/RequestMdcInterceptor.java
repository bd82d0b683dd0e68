/*
 * どこで: Discovery Web 層
 * 何を: 検索リクエストの経路と対象セッションを MDC へ出し入れする
 * なぜ: 検索ログや遅いクエリの警告をリクエストと対象セッションへ紐付けるため
 */
package com.badmintongroup.discovery.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String SESSION_ID_VARIABLE = "sessionId";

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final Map<String, String> values = new LinkedHashMap<>();
    values.put("request_id", requestId(request));
    values.put("http_method", request.getMethod());
    values.put("discovery_route", route(request));
    values.put("session_id", pathVariable(request, SESSION_ID_VARIABLE));
    values.put("client_ip", clientIp(request));
    values.values().removeIf(value -> value == null || value.isBlank());
    values.forEach(MDC::put);
    request.setAttribute(ATTRIBUTE_KEYS, values.keySet());
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(ATTRIBUTE_KEYS) instanceof Iterable<?> keys) {
      keys.forEach(key -> MDC.remove(String.valueOf(key)));
    }
  }

  private String requestId(HttpServletRequest request) {
    final String header = request.getHeader("X-Request-Id");
    return header == null || header.isBlank() ? UUID.randomUUID().toString() : header;
  }

  /** マッピングされたパターン (/discovery/{sessionId} など)。未解決なら実パスを使う。 */
  private String route(HttpServletRequest request) {
    if (request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE)
        instanceof String pattern) {
      return pattern;
    }
    return request.getRequestURI();
  }

  @Nullable
  private String pathVariable(HttpServletRequest request, String name) {
    if (request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE)
        instanceof Map<?, ?> variables) {
      final Object value = variables.get(name);
      return value == null ? null : value.toString();
    }
    return null;
  }

  private String clientIp(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    return forwarded.split(",", 2)[0].trim();
  }
}
