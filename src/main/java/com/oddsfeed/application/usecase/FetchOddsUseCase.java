package com.oddsfeed.application.usecase;

import com.fasterxml.jackson.databind.JsonNode;
import com.oddsfeed.domain.exception.UpstreamErrorCode;
import com.oddsfeed.domain.exception.UpstreamException;
import com.oddsfeed.domain.model.OddsResponse;
import com.oddsfeed.domain.ports.OddsGateway;
import com.oddsfeed.domain.ports.OddsPayloadNormalizer;
import com.oddsfeed.infrastructure.config.OddsUpstreamProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Use case for retrieving the normalized odds of one event.
 *
 * The whole upstream fetch, retries and backoff included, runs on a worker
 * thread bounded by the configured request timeout. On timeout the worker is
 * interrupted, which cuts short any backoff sleep in progress.
 */
@Service
public class FetchOddsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(FetchOddsUseCase.class);

    private final OddsGateway oddsGateway;
    private final OddsPayloadNormalizer normalizer;
    private final ExecutorService executorService;
    private final Duration requestTimeout;

    public FetchOddsUseCase(
        OddsGateway oddsGateway,
        OddsPayloadNormalizer normalizer,
        @Qualifier("oddsFetchExecutor") ExecutorService executorService,
        OddsUpstreamProperties properties
    ) {
        this.oddsGateway = oddsGateway;
        this.normalizer = normalizer;
        this.executorService = executorService;
        this.requestTimeout = properties.requestTimeout();
    }

    /**
     * Fetches and normalizes the odds for an event.
     *
     * @param eventId Event identifier as requested by the caller
     * @return Normalized odds
     * @throws UpstreamException if the upstream service could not deliver a usable payload
     */
    public OddsResponse execute(String eventId) {
        JsonNode payload = fetchWithTimeout(eventId);

        try {
            OddsResponse response = normalizer.normalize(eventId, payload);
            logger.info("Normalized odds for event {} from {}: {} bookmakers",
                eventId, oddsGateway.getProviderName(), response.getEvent().getBookmakers().size());
            return response;
        } catch (IllegalArgumentException e) {
            logger.error("Payload for event {} could not be normalized", eventId, e);
            throw new UpstreamException(
                UpstreamErrorCode.INVALID_PAYLOAD,
                "Upstream odds service returned an unexpected payload.",
                e);
        }
    }

    private JsonNode fetchWithTimeout(String eventId) {
        Future<JsonNode> future = executorService.submit(() -> oddsGateway.fetchOdds(eventId));

        try {
            if (requestTimeout.isZero() || requestTimeout.isNegative()) {
                return future.get();
            }
            return future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.error("Timed out after {} ms fetching odds for event {}", requestTimeout.toMillis(), eventId);
            throw new UpstreamException(
                UpstreamErrorCode.CONNECTION_ERROR,
                "Timed out waiting for the upstream odds service.",
                e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new UpstreamException(
                UpstreamErrorCode.CONNECTION_ERROR,
                "Interrupted while waiting for the upstream odds service.",
                e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new UpstreamException(
                UpstreamErrorCode.RETRY_EXHAUSTED,
                "Failed to retrieve odds from the upstream service.",
                cause);
        }
    }
}
