package com.github.dimitryivaniuta.egress.web;


public final class RequestContextKeys {
    private RequestContextKeys() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    public static final String PROVIDER_MDC_KEY = "provider";
    public static final String REQUEST_ID_MDC_KEY = "requestId";
}
