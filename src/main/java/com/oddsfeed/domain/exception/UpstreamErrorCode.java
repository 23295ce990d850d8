package com.oddsfeed.domain.exception;

/**
 * Machine-readable failure codes surfaced when the upstream odds service cannot be used.
 */
public enum UpstreamErrorCode {

    /** Transport failure (refused, timeout, DNS) that survived every retry. */
    CONNECTION_ERROR("upstream_connection_error", 504),

    /** 200 response whose body is not a JSON object. */
    INVALID_PAYLOAD("upstream_invalid_payload", 502),

    /** 429 / 503 on the final attempt. The surfaced status is the upstream one. */
    UNAVAILABLE("upstream_unavailable", 503),

    /** Any other non-2xx response. */
    HTTP_ERROR("upstream_http_error", 502),

    /** Retry loop finished without a response or a failure being classified. */
    RETRY_EXHAUSTED("upstream_retry_exhausted", 502);

    private final String code;
    private final int defaultStatus;

    UpstreamErrorCode(String code, int defaultStatus) {
        this.code = code;
        this.defaultStatus = defaultStatus;
    }

    public String getCode() {
        return code;
    }

    public int getDefaultStatus() {
        return defaultStatus;
    }

    @Override
    public String toString() {
        return code;
    }
}
