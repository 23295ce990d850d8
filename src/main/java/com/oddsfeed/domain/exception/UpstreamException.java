package com.oddsfeed.domain.exception;

/**
 * Terminal failure while retrieving odds from the upstream service.
 */
public class UpstreamException extends RuntimeException {

    private final UpstreamErrorCode errorCode;
    private final int status;
    private final Integer upstreamStatus;
    private final Double retryAfter;

    public UpstreamException(UpstreamErrorCode errorCode, String message) {
        this(errorCode, message, errorCode.getDefaultStatus(), null, null, null);
    }

    public UpstreamException(UpstreamErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, errorCode.getDefaultStatus(), null, null, cause);
    }

    /**
     * @param status         HTTP status to surface to callers
     * @param upstreamStatus status returned by the upstream service, if any
     * @param retryAfter     upstream retry hint in seconds, if any
     */
    public UpstreamException(
        UpstreamErrorCode errorCode,
        String message,
        int status,
        Integer upstreamStatus,
        Double retryAfter,
        Throwable cause
    ) {
        super(message, cause);
        this.errorCode = errorCode;
        this.status = status;
        this.upstreamStatus = upstreamStatus;
        this.retryAfter = retryAfter;
    }

    public UpstreamErrorCode getErrorCode() {
        return errorCode;
    }

    public int getStatus() {
        return status;
    }

    public Integer getUpstreamStatus() {
        return upstreamStatus;
    }

    public Double getRetryAfter() {
        return retryAfter;
    }
}
