package com.oddsfeed.infrastructure.scraper.livesport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.oddsfeed.domain.model.BookmakerOdds;
import com.oddsfeed.domain.model.EventOdds;
import com.oddsfeed.domain.model.OddsMarket;
import com.oddsfeed.domain.model.OddsOutcome;
import com.oddsfeed.domain.model.OddsResponse;
import com.oddsfeed.infrastructure.scraper.JsonValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the pre-aggregated {@code data.findOddsByEventId} payload.
 *
 * Bookmaker names come from {@code settings.bookmakers}; markets and outcomes
 * come from the flat {@code odds} list, where every entry is tagged with a
 * bookmaker id, a betting type and a betting scope.
 */
public class AggregateOddsMapper {

    private static final Logger logger = LoggerFactory.getLogger(AggregateOddsMapper.class);

    static final String DEFAULT_OUTCOME_LABEL = "Selection";

    public static OddsResponse map(String eventId, JsonNode node, Instant retrievedAt, String defaultSource) {
        Map<String, BookmakerOdds> bookmakers = mapSettingsBookmakers(node);

        // bookmakers only known from the odds list are kept, appended after the configured ones
        mapMarketsByBookmaker(node).forEach((bookmakerId, markets) ->
            bookmakers.computeIfAbsent(bookmakerId, id -> new BookmakerOdds(id, null, null))
                .getMarkets()
                .addAll(markets));

        JsonNode eventInfo = JsonValues.firstObject(node, PayloadAliases.AGGREGATE_EVENT_INFO)
            .orElse(MissingNode.getInstance());

        EventOdds event = new EventOdds();
        event.setEventId(eventId);
        event.setEventName(JsonValues.text(JsonValues.first(eventInfo, PayloadAliases.EVENT_NAME)));
        event.setCompetitionName(JsonValues.text(JsonValues.first(eventInfo, PayloadAliases.COMPETITION_NAME)));
        event.setStartTime(JsonValues.timestamp(JsonValues.first(eventInfo, PayloadAliases.START_TIME)));
        event.setBookmakers(new ArrayList<>(bookmakers.values()));

        String source = JsonValues.text(node.path("source"));
        return new OddsResponse(event, retrievedAt, source != null ? source : defaultSource);
    }

    /**
     * Bookmaker identities from {@code settings.bookmakers}, keyed by id in
     * payload order. Entries without an id are unusable and skipped; repeated
     * ids only fill in a missing name.
     */
    static Map<String, BookmakerOdds> mapSettingsBookmakers(JsonNode node) {
        Map<String, BookmakerOdds> bookmakers = new LinkedHashMap<>();

        for (JsonNode entry : JsonValues.list(node.path("settings").path("bookmakers"))) {
            if (!entry.isObject()) {
                continue;
            }
            JsonNode info = entry.path("bookmaker");
            String id = JsonValues.stringify(JsonValues.firstPresent(info.path("id"), entry.path("bookmakerId")));
            if (id == null) {
                logger.debug("Skipping settings bookmaker without id");
                continue;
            }
            String name = JsonValues.text(JsonValues.firstPresent(info.path("name"), entry.path("name")));

            BookmakerOdds existing = bookmakers.get(id);
            if (existing == null) {
                bookmakers.put(id, new BookmakerOdds(id, name, null));
            } else if (existing.getName() == null) {
                existing.setName(name);
            }
        }
        return bookmakers;
    }

    /**
     * Groups the flat odds list into markets per bookmaker id, both in first-seen order.
     * Entries sharing a bookmaker and a market key contribute to the same market.
     */
    static Map<String, List<OddsMarket>> mapMarketsByBookmaker(JsonNode node) {
        Map<String, Map<String, OddsMarket>> aggregated = new LinkedHashMap<>();

        for (JsonNode entry : JsonValues.list(node.path("odds"))) {
            if (!entry.isObject()) {
                continue;
            }
            String bookmakerId = JsonValues.stringify(entry.path("bookmakerId"));
            if (bookmakerId == null) {
                continue;
            }

            MarketNameTables.MarketName marketName = MarketNameTables.describe(
                JsonValues.text(entry.path("bettingType")),
                JsonValues.text(entry.path("bettingScope")));

            OddsMarket market = aggregated
                .computeIfAbsent(bookmakerId, id -> new LinkedHashMap<>())
                .computeIfAbsent(marketName.key(), key -> {
                    OddsMarket m = new OddsMarket();
                    m.setId(key);
                    m.setKey(key);
                    m.setName(marketName.name());
                    return m;
                });

            List<OddsOutcome> outcomes = market.getOutcomes();
            for (JsonNode item : JsonValues.list(entry.path("odds"))) {
                if (!item.isObject()) {
                    continue;
                }
                outcomes.add(mapOutcome(item, marketName.key(), outcomes.size()));
            }
        }

        Map<String, List<OddsMarket>> result = new LinkedHashMap<>();
        aggregated.forEach((bookmakerId, markets) -> result.put(bookmakerId, new ArrayList<>(markets.values())));
        return result;
    }

    private static OddsOutcome mapOutcome(JsonNode item, String marketKey, int index) {
        String outcomeId = JsonValues.stringify(JsonValues.firstPresent(
            item.path("eventParticipantId"),
            item.path("selection"),
            item.path("score")));
        if (outcomeId == null) {
            outcomeId = marketKey + ":" + index;
        }

        OddsOutcome outcome = new OddsOutcome();
        outcome.setId(outcomeId);
        outcome.setLabel(formatOutcomeLabel(item));
        outcome.setSelectionKey(outcomeId);
        outcome.setOddsDecimal(JsonValues.decimal(item.path("value")));
        outcome.setProbability(JsonValues.decimal(item.path("probability")));
        return outcome;
    }

    /**
     * First of selection / winner / score / position, followed by the handicap
     * value in parentheses; else the participant id; else "Selection".
     */
    static String formatOutcomeLabel(JsonNode item) {
        List<String> parts = new ArrayList<>();
        for (String key : PayloadAliases.AGGREGATE_OUTCOME_LABEL) {
            String candidate = JsonValues.text(item.path(key));
            if (candidate != null) {
                parts.add(candidate);
                break;
            }
        }

        JsonNode handicap = item.path("handicap");
        if (handicap.isObject()) {
            String handicapValue = JsonValues.text(handicap.path("value"));
            if (handicapValue != null) {
                parts.add("(" + handicapValue + ")");
            }
        }

        if (parts.isEmpty()) {
            String participant = JsonValues.text(item.path("eventParticipantId"));
            if (participant != null) {
                parts.add(participant);
            }
        }

        String label = String.join(" ", parts).trim();
        return label.isEmpty() ? DEFAULT_OUTCOME_LABEL : label;
    }
}
