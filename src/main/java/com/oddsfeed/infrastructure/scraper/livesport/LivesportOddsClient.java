package com.oddsfeed.infrastructure.scraper.livesport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.oddsfeed.domain.exception.UpstreamErrorCode;
import com.oddsfeed.domain.exception.UpstreamException;
import com.oddsfeed.domain.ports.OddsGateway;
import com.oddsfeed.infrastructure.config.OddsUpstreamProperties;
import com.oddsfeed.infrastructure.scraper.HttpTransport;
import com.oddsfeed.infrastructure.scraper.HttpTransport.HttpResult;
import com.oddsfeed.infrastructure.scraper.Sleeper;
import org.apache.hc.core5.net.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Fetch client for the Livesport odds endpoint.
 *
 * Owns a short-lived per-event cache of raw payloads, bounded retry with
 * exponential backoff, and the classification of upstream failures into
 * {@link UpstreamErrorCode}s. Concurrent misses for the same event are not
 * coalesced: each caller issues its own upstream request.
 */
public class LivesportOddsClient implements OddsGateway {

    private static final Logger logger = LoggerFactory.getLogger(LivesportOddsClient.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final int MAX_LOG_BODY_LENGTH = 500;

    static final Set<Integer> RETRYABLE_STATUS_CODES = Set.of(408, 425, 429, 500, 502, 503, 504);
    static final Set<Integer> THROTTLING_STATUS_CODES = Set.of(429, 503);

    private final HttpTransport transport;
    private final OddsUpstreamProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;
    private final URI baseUri;

    private final Object cacheLock = new Object();
    private final Map<String, CachedOdds> cache;

    public LivesportOddsClient(
        HttpTransport transport,
        OddsUpstreamProperties properties,
        Clock clock,
        Sleeper sleeper
    ) {
        this.transport = transport;
        this.properties = properties;
        this.clock = clock;
        this.sleeper = sleeper;
        this.baseUri = URI.create(properties.baseUrl());

        int maxEntries = properties.cacheMaxEntries();
        this.cache = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CachedOdds> eldest) {
                return size() > maxEntries;
            }
        };
    }

    @Override
    public String getProviderName() {
        return properties.source();
    }

    @Override
    public JsonNode fetchOdds(String eventId) {
        JsonNode cached = getCached(eventId);
        if (cached != null) {
            logger.debug("Serving odds for event {} from cache", eventId);
            return cached;
        }

        logger.info("Requesting odds for event {} from upstream", eventId);
        URI uri = buildUri(eventId);
        int maxRetries = properties.maxRetries();
        int attempts = maxRetries + 1;
        IOException lastError = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            boolean finalAttempt = attempt == maxRetries;

            HttpResult result;
            try {
                result = transport.get(uri, properties.headers());
            } catch (IOException e) {
                lastError = e;
                if (finalAttempt) {
                    logger.error("Unable to reach upstream for event {} after {} attempts", eventId, attempts, e);
                    throw new UpstreamException(
                        UpstreamErrorCode.CONNECTION_ERROR,
                        "Unable to contact upstream odds service.",
                        e);
                }
                logger.warn("Upstream request for event {} failed (attempt {}/{}): {}",
                    eventId, attempt + 1, attempts, e.toString());
                pause(computeBackoff(attempt, null));
                continue;
            }

            int status = result.statusCode();
            if (status == 200) {
                JsonNode payload = parsePayload(eventId, result);
                putCached(eventId, payload);
                return payload;
            }

            Double retryAfter = parseRetryAfter(result.header("Retry-After"));

            if (THROTTLING_STATUS_CODES.contains(status)) {
                if (finalAttempt) {
                    logger.error("Upstream still unavailable for event {} after {} attempts (status {})",
                        eventId, attempts, status);
                    throw new UpstreamException(
                        UpstreamErrorCode.UNAVAILABLE,
                        "Upstream odds service temporarily unavailable.",
                        status,
                        status,
                        retryAfter,
                        null);
                }
                logger.warn("Upstream throttled event {} with status {} (attempt {}/{})",
                    eventId, status, attempt + 1, attempts);
                pause(computeBackoff(attempt, retryAfter));
                continue;
            }

            if (RETRYABLE_STATUS_CODES.contains(status) && !finalAttempt) {
                logger.warn("Upstream returned status {} for event {} (attempt {}/{})",
                    status, eventId, attempt + 1, attempts);
                pause(computeBackoff(attempt, retryAfter));
                continue;
            }

            logger.error("Upstream returned status {} for event {}: {}", status, eventId, preview(result.body()));
            throw new UpstreamException(
                UpstreamErrorCode.HTTP_ERROR,
                "Upstream odds service responded with an error.",
                UpstreamErrorCode.HTTP_ERROR.getDefaultStatus(),
                status,
                retryAfter,
                null);
        }

        throw new UpstreamException(
            UpstreamErrorCode.RETRY_EXHAUSTED,
            "Failed to retrieve odds after retries.",
            lastError);
    }

    /**
     * Delay before the next attempt: {@code min(maxBackoff, backoffFactor * 2^attempt)},
     * or the upstream retry hint (capped at maxBackoff) when one was sent.
     */
    Duration computeBackoff(int attempt, Double retryAfterSeconds) {
        long maxMillis = Math.max(0, properties.maxBackoff().toMillis());
        if (retryAfterSeconds != null) {
            long hintMillis = Math.round(retryAfterSeconds * 1000);
            return Duration.ofMillis(Math.max(0, Math.min(hintMillis, maxMillis)));
        }
        double backoffMillis = properties.backoffFactor().toMillis() * Math.pow(2, attempt);
        return Duration.ofMillis((long) Math.max(0, Math.min(backoffMillis, maxMillis)));
    }

    /**
     * Parses a Retry-After value given as delta seconds or as an HTTP-date.
     *
     * @return seconds to wait, never negative, or null when absent or unparseable
     */
    Double parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String value = header.trim();
        try {
            double seconds = Double.parseDouble(value);
            return Double.isFinite(seconds) ? Math.max(seconds, 0.0) : null;
        } catch (NumberFormatException e) {
            try {
                Instant retryAt = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
                double seconds = Duration.between(clock.instant(), retryAt).toMillis() / 1000.0;
                return Math.max(seconds, 0.0);
            } catch (DateTimeParseException dateError) {
                logger.debug("Ignoring unparseable Retry-After header: {}", value);
                return null;
            }
        }
    }

    private JsonNode parsePayload(String eventId, HttpResult result) {
        JsonNode payload;
        try {
            payload = objectMapper.readTree(result.body());
        } catch (JsonProcessingException e) {
            logger.error("Failed to parse upstream odds JSON for event {}", eventId);
            logResponseBodyPreview(result.body());
            throw new UpstreamException(
                UpstreamErrorCode.INVALID_PAYLOAD,
                "Upstream odds service returned invalid JSON.",
                UpstreamErrorCode.INVALID_PAYLOAD.getDefaultStatus(),
                result.statusCode(),
                null,
                e);
        }

        // JSON null is an empty answer, normalized to an event without odds
        if (payload != null && payload.isNull()) {
            logger.warn("Upstream returned a null odds payload for event {}", eventId);
            return payload;
        }

        if (payload == null || !payload.isObject()) {
            logger.error("Upstream odds payload for event {} is not a JSON object", eventId);
            logResponseBodyPreview(result.body());
            throw new UpstreamException(
                UpstreamErrorCode.INVALID_PAYLOAD,
                "Upstream odds service returned an unexpected payload.",
                UpstreamErrorCode.INVALID_PAYLOAD.getDefaultStatus(),
                result.statusCode(),
                null,
                null);
        }
        return payload;
    }

    private void pause(Duration delay) {
        logger.debug("Backing off for {} ms before retrying", delay.toMillis());
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException(
                UpstreamErrorCode.CONNECTION_ERROR,
                "Interrupted while waiting to retry the upstream odds service.",
                e);
        }
    }

    private URI buildUri(String eventId) {
        try {
            return new URIBuilder(baseUri)
                .addParameter("_hash", properties.hash())
                .addParameter("eventId", eventId)
                .addParameter("projectId", properties.projectId())
                .addParameter("geoIpCode", properties.geoIpCode())
                .addParameter("geoIpSubdivisionCode", properties.geoIpSubdivisionCode())
                .build();
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Invalid upstream odds URL: " + properties.baseUrl(), e);
        }
    }

    private JsonNode getCached(String eventId) {
        if (!properties.cachingEnabled()) {
            return null;
        }
        synchronized (cacheLock) {
            CachedOdds cached = cache.get(eventId);
            if (cached == null) {
                return null;
            }
            if (cached.expiresAt().isBefore(clock.instant())) {
                cache.remove(eventId);
                return null;
            }
            return cached.payload();
        }
    }

    private void putCached(String eventId, JsonNode payload) {
        if (!properties.cachingEnabled()) {
            return;
        }
        synchronized (cacheLock) {
            cache.put(eventId, new CachedOdds(payload, clock.instant().plus(properties.cacheTtl())));
        }
    }

    private static String preview(String body) {
        return body.length() > MAX_LOG_BODY_LENGTH
            ? body.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : body;
    }

    private static void logResponseBodyPreview(String body) {
        logger.error("Response body preview: {}", preview(body));
    }

    private record CachedOdds(JsonNode payload, Instant expiresAt) {}
}
