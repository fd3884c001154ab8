package com.example.common.trace;

import java.util.UUID;
import org.slf4j.MDC;

/** trace id の採番と MDC からの取り出し。 */
public final class TraceIds {

  public static final String MDC_KEY = "trace_id";
  public static final String LEGACY_MDC_KEY = "traceId";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** MDC の trace_id、無ければ traceId、どちらも無ければ新規採番した値を返す。 */
  public static String currentOrNew() {
    final String traceId = MDC.get(MDC_KEY);
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    final String legacyTraceId = MDC.get(LEGACY_MDC_KEY);
    if (legacyTraceId != null && !legacyTraceId.isBlank()) {
      return legacyTraceId;
    }
    return newTraceId();
  }
}
