package com.oddsfeed.domain.ports;

import com.fasterxml.jackson.databind.JsonNode;
import com.oddsfeed.domain.model.OddsResponse;

/**
 * Port for mapping a raw upstream payload into the canonical odds contract.
 */
public interface OddsPayloadNormalizer {

    /**
     * Maps the payload. Missing or malformed fields become unknown values, never errors.
     *
     * @param eventId Event identifier requested by the caller; always used verbatim
     * @param payload Raw upstream JSON
     * @return The normalized odds
     * @throws IllegalArgumentException if the payload is not a JSON object
     */
    OddsResponse normalize(String eventId, JsonNode payload);
}
