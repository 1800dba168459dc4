package org.erpsuite.currency.http;

/** Request headers set by the upstream gateway. */
public final class TenantHeaders {

  /** Opaque id of the calling tenant; required on every tenant-scoped endpoint. */
  public static final String TENANT_ID = "X-Tenant-Id";

  /** Correlation id propagated across services and echoed on the response. */
  public static final String CORRELATION_ID = "X-Correlation-ID";

  private TenantHeaders() {}
}
