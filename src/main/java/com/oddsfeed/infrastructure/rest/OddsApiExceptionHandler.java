package com.oddsfeed.infrastructure.rest;

import com.oddsfeed.domain.exception.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Renders upstream failures as structured error bodies.
 */
@RestControllerAdvice
public class OddsApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(OddsApiExceptionHandler.class);

    static final String INTERNAL_ERROR_CODE = "internal_error";

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<ApiErrorResponse> handleUpstream(UpstreamException ex) {
        logger.warn("Odds request failed: {} (status {}, upstream status {})",
            ex.getErrorCode(), ex.getStatus(), ex.getUpstreamStatus());
        ApiErrorResponse.ApiErrorDetail detail = new ApiErrorResponse.ApiErrorDetail(
            ex.getErrorCode().getCode(),
            ex.getMessage(),
            ex.getUpstreamStatus(),
            ex.getRetryAfter());
        return ResponseEntity.status(ex.getStatus()).body(new ApiErrorResponse(detail));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(RuntimeException ex) {
        logger.error("Unexpected error while serving odds", ex);
        ApiErrorResponse.ApiErrorDetail detail = new ApiErrorResponse.ApiErrorDetail(
            INTERNAL_ERROR_CODE, "Internal server error.", null, null);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ApiErrorResponse(detail));
    }
}
