package com.oddsfeed.domain.ports;

import com.fasterxml.jackson.databind.JsonNode;
import com.oddsfeed.domain.exception.UpstreamException;

/**
 * Port for retrieving raw odds data from the upstream provider.
 */
public interface OddsGateway {

    /**
     * Gets the identifier of the provider behind this gateway.
     *
     * @return Provider name (e.g., "livesport")
     */
    String getProviderName();

    /**
     * Fetches the raw, not yet normalized, odds payload for one event.
     *
     * @param eventId Event identifier as requested by the caller
     * @return The upstream JSON object, or a null node when upstream answered {@code null}
     * @throws UpstreamException if the upstream service cannot deliver a usable payload
     */
    JsonNode fetchOdds(String eventId);
}
