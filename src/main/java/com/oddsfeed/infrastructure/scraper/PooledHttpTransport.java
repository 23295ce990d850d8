package com.oddsfeed.infrastructure.scraper;

import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.io.CloseMode;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * {@link HttpTransport} backed by a pooled Apache HttpClient shared by every request
 * of the process. Closing it releases the connection pool.
 */
public class PooledHttpTransport implements HttpTransport {

    private static final Logger logger = LoggerFactory.getLogger(PooledHttpTransport.class);

    private final CloseableHttpClient httpClient;

    public PooledHttpTransport(Duration connectTimeout, Duration responseTimeout, int maxConnections) {
        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
            .setMaxConnTotal(maxConnections)
            .setMaxConnPerRoute(maxConnections)
            .setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(connectTimeout.toMillis()))
                .setSocketTimeout(Timeout.ofMilliseconds(responseTimeout.toMillis()))
                .build())
            .build();

        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(Timeout.ofMilliseconds(connectTimeout.toMillis()))
            .setResponseTimeout(Timeout.ofMilliseconds(responseTimeout.toMillis()))
            .build();

        this.httpClient = HttpClients.custom()
            .setConnectionManager(connectionManager)
            .setDefaultRequestConfig(requestConfig)
            .build();
    }

    @Override
    public HttpResult get(URI uri, Map<String, String> headers) throws IOException {
        HttpGet request = new HttpGet(uri);
        if (headers != null) {
            headers.forEach(request::addHeader);
        }

        return httpClient.execute(request, response -> {
            Map<String, String> responseHeaders = new HashMap<>();
            for (Header header : response.getHeaders()) {
                // first occurrence wins for repeated headers
                responseHeaders.putIfAbsent(header.getName().toLowerCase(Locale.ROOT), header.getValue());
            }
            HttpEntity entity = response.getEntity();
            String body = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
            return new HttpResult(response.getCode(), body, responseHeaders);
        });
    }

    @Override
    public void close() {
        logger.info("Closing upstream HTTP connection pool");
        httpClient.close(CloseMode.GRACEFUL);
    }
}
