package com.oddsfeed.infrastructure.scraper;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.util.Locale;
import java.util.Map;

/**
 * Blocking HTTP GET transport used by the upstream clients.
 */
public interface HttpTransport extends Closeable {

    /**
     * Issues a GET request and returns the response whatever its status.
     *
     * @throws IOException on transport-level failures (refused, timeout, DNS, ...)
     */
    HttpResult get(URI uri, Map<String, String> headers) throws IOException;

    /**
     * Status, body and headers of a completed exchange. Header names are stored lower-cased.
     */
    record HttpResult(int statusCode, String body, Map<String, String> headers) {

        public HttpResult {
            body = body == null ? "" : body;
            headers = headers == null ? Map.of() : Map.copyOf(headers);
        }

        public String header(String name) {
            return headers.get(name.toLowerCase(Locale.ROOT));
        }
    }
}
