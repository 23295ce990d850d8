package com.oddsfeed.infrastructure.rest;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body: {@code {"error": {"code", "message", "upstream_status"?, "retry_after"?}}}.
 */
public record ApiErrorResponse(ApiErrorDetail error) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ApiErrorDetail(String code, String message, Integer upstreamStatus, Double retryAfter) {}
}
