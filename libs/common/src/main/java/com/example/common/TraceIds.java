package com.example.common;

import java.util.Locale;
import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  /** W3C trace-context 形式 (32 桁 hex) の trace_id を払い出す。 */
  public static String newTraceId() {
    return UUID.randomUUID().toString().replace("-", "").toLowerCase(Locale.ROOT);
  }
}
