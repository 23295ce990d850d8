package com.oddsfeed.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Upstream odds endpoint, retry and cache settings.
 *
 * Missing values fall back to the Livesport defaults so a bare deployment works.
 */
@ConfigurationProperties(prefix = "odds.upstream")
public record OddsUpstreamProperties(
    String baseUrl,
    String hash,
    String projectId,
    String geoIpCode,
    String geoIpSubdivisionCode,
    Map<String, String> headers,
    Duration connectTimeout,
    Duration responseTimeout,
    Duration requestTimeout,
    Integer maxConnections,
    Integer maxRetries,
    Duration backoffFactor,
    Duration maxBackoff,
    Duration cacheTtl,
    Integer cacheMaxEntries,
    String source
) {

    public static final Map<String, String> DEFAULT_HEADERS = defaultHeaders();

    public OddsUpstreamProperties {
        baseUrl = isBlank(baseUrl) ? "https://global.ds.lsapp.eu/odds/pq_graphql" : baseUrl;
        hash = isBlank(hash) ? "oce" : hash;
        projectId = isBlank(projectId) ? "1" : projectId;
        geoIpCode = isBlank(geoIpCode) ? "CZ" : geoIpCode;
        geoIpSubdivisionCode = isBlank(geoIpSubdivisionCode) ? "CZ10" : geoIpSubdivisionCode;
        headers = headers == null || headers.isEmpty()
            ? DEFAULT_HEADERS
            : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        connectTimeout = connectTimeout == null ? Duration.ofSeconds(3) : connectTimeout;
        responseTimeout = responseTimeout == null ? Duration.ofSeconds(15) : responseTimeout;
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(60) : requestTimeout;
        maxConnections = maxConnections == null || maxConnections < 1 ? 20 : maxConnections;
        maxRetries = maxRetries == null ? 3 : Math.max(0, maxRetries);
        backoffFactor = backoffFactor == null ? Duration.ofMillis(750) : backoffFactor;
        maxBackoff = maxBackoff == null ? Duration.ofSeconds(10) : maxBackoff;
        cacheTtl = cacheTtl == null ? Duration.ofSeconds(30) : cacheTtl;
        cacheMaxEntries = cacheMaxEntries == null || cacheMaxEntries < 1 ? 1024 : cacheMaxEntries;
        source = isBlank(source) ? "livesport" : source;
    }

    /**
     * Defaults only, handy for tests and tools that do not go through Spring binding.
     */
    public static OddsUpstreamProperties defaults() {
        return new OddsUpstreamProperties(
            null, null, null, null, null, null, null, null, null,
            null, null, null, null, null, null, null);
    }

    public boolean cachingEnabled() {
        return !cacheTtl.isNegative() && !cacheTtl.isZero();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // Accept-Encoding is left to the transport, which only decodes what it negotiates itself
    private static Map<String, String> defaultHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "*/*");
        headers.put("Sec-Fetch-Site", "cross-site");
        headers.put("Origin", "https://www.livesport.cz");
        headers.put("Sec-Fetch-Dest", "empty");
        headers.put("Accept-Language", "cs-CZ,cs;q=0.9");
        headers.put("Sec-Fetch-Mode", "cors");
        headers.put("User-Agent", "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) "
            + "AppleWebKit/605.1.15 (KHTML, like Gecko) Version/18.3.1 Safari/605.1.15");
        headers.put("Referer", "https://www.livesport.cz/");
        headers.put("Priority", "u=3, i");
        return Collections.unmodifiableMap(headers);
    }
}
