/*
 * どこで: Squad Web 層
 * 何を: リクエスト単位の trace_id / tenant_id / user_id を MDC へ積む
 * なぜ: 登録や統計 API のログをテナント単位で追跡するため
 */
package com.example.squad_announcer.config;

import com.example.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String TRACE_HEADER = "X-Trace-Id";
  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    final String traceId = resolveTraceId(request);
    put(keys, "trace_id", traceId);
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    final Map<String, String> pathVariables = pathVariables(request);
    put(keys, "tenant_id", pathVariables.get("tenantId"));
    put(keys, "user_id", pathVariables.get("userId"));
    response.setHeader(TRACE_HEADER, traceId);
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    final Object attribute = request.getAttribute(ATTRIBUTE_KEYS);
    if (!(attribute instanceof List<?> rawKeys)) {
      return;
    }
    for (Object rawKey : rawKeys) {
      if (rawKey instanceof String key) {
        MDC.remove(key);
      }
    }
  }

  private String resolveTraceId(HttpServletRequest request) {
    final String traceId = request.getHeader(TRACE_HEADER);
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    return TraceIds.newTraceId();
  }

  @SuppressWarnings("unchecked")
  private Map<String, String> pathVariables(HttpServletRequest request) {
    final Object attribute = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    if (attribute instanceof Map<?, ?> map) {
      return (Map<String, String>) map;
    }
    return Map.of();
  }

  private void put(List<String> keys, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
