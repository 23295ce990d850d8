package com.oddsfeed.infrastructure.scraper.livesport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.oddsfeed.domain.model.OddsResponse;
import com.oddsfeed.domain.ports.OddsPayloadNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Normalizes Livesport odds payloads into the canonical {@link OddsResponse}.
 *
 * The payload shape is probed up front: the pre-aggregated
 * {@code data.findOddsByEventId} form is mapped by {@link AggregateOddsMapper},
 * anything else goes through the tree-searching {@link GenericOddsMapper}.
 */
public class LivesportPayloadNormalizer implements OddsPayloadNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(LivesportPayloadNormalizer.class);

    static final String AGGREGATE_NODE = "findOddsByEventId";

    public enum PayloadShape {
        AGGREGATE,
        GENERIC
    }

    private final Clock clock;
    private final String defaultSource;

    public LivesportPayloadNormalizer(Clock clock, String defaultSource) {
        this.clock = clock;
        this.defaultSource = defaultSource;
    }

    @Override
    public OddsResponse normalize(String eventId, JsonNode payload) {
        JsonNode root = payload == null || payload.isNull() || payload.isMissingNode()
            ? JsonNodeFactory.instance.objectNode()
            : payload;
        if (!root.isObject()) {
            throw new IllegalArgumentException("Odds payload must be a JSON object but was " + root.getNodeType());
        }

        Instant retrievedAt = clock.instant();
        PayloadShape shape = detectShape(root);
        logger.debug("Normalizing {} odds payload for event {}", shape, eventId);

        return switch (shape) {
            case AGGREGATE -> AggregateOddsMapper.map(
                eventId, root.path("data").path(AGGREGATE_NODE), retrievedAt, defaultSource);
            case GENERIC -> GenericOddsMapper.map(eventId, root, retrievedAt, defaultSource);
        };
    }

    public static PayloadShape detectShape(JsonNode root) {
        return root.path("data").path(AGGREGATE_NODE).isObject() ? PayloadShape.AGGREGATE : PayloadShape.GENERIC;
    }
}
