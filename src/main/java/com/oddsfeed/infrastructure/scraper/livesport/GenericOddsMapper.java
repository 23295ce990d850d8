package com.oddsfeed.infrastructure.scraper.livesport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.oddsfeed.domain.model.BookmakerOdds;
import com.oddsfeed.domain.model.EventOdds;
import com.oddsfeed.domain.model.OddsMarket;
import com.oddsfeed.domain.model.OddsOutcome;
import com.oddsfeed.domain.model.OddsResponse;
import com.oddsfeed.infrastructure.scraper.JsonValues;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps payloads of no known shape by searching the tree for an event node and
 * a bookmaker list, reading every field through the {@link PayloadAliases} tables.
 */
public class GenericOddsMapper {

    public static OddsResponse map(String eventId, JsonNode payload, Instant retrievedAt, String defaultSource) {
        JsonNode eventNode = locateEventNode(payload);
        JsonNode eventInfo = locateEventInfo(eventNode);

        EventOdds event = new EventOdds();
        event.setEventId(eventId);
        event.setEventName(JsonValues.text(JsonValues.first(eventInfo, PayloadAliases.EVENT_NAME)));
        event.setCompetitionName(JsonValues.text(JsonValues.first(eventInfo, PayloadAliases.COMPETITION_NAME)));
        event.setStartTime(JsonValues.timestamp(JsonValues.first(eventInfo, PayloadAliases.START_TIME)));
        event.setBookmakers(locateBookmakers(eventNode));

        String source = JsonValues.text(JsonValues.first(payload, PayloadAliases.SOURCE));
        return new OddsResponse(event, retrievedAt, source != null ? source : defaultSource);
    }

    /**
     * Candidate keys under {@code data}, then at the top level; then the first
     * object in the tree carrying a marker key; else {@code data} (or the payload) itself.
     */
    static JsonNode locateEventNode(JsonNode payload) {
        JsonNode data = payload.path("data");
        List<JsonNode> containers = data.isObject() ? List.of(data, payload) : List.of(payload);

        for (JsonNode container : containers) {
            for (String candidate : PayloadAliases.EVENT_NODE_CANDIDATES) {
                JsonNode node = container.get(candidate);
                if (node != null && node.isObject()) {
                    return node;
                }
            }
        }

        JsonNode fallback = data.isObject() && data.size() > 0 ? data : payload;
        return JsonValues.findFirst(payload, node -> JsonValues.hasAnyKey(node, PayloadAliases.EVENT_NODE_MARKERS))
            .orElse(fallback);
    }

    static JsonNode locateEventInfo(JsonNode eventNode) {
        JsonNode info = JsonValues.firstObject(eventNode, PayloadAliases.GENERIC_EVENT_INFO).orElse(eventNode);
        if (!JsonValues.isAbsent(info)) {
            return info;
        }
        return JsonValues.findFirst(eventNode, node -> JsonValues.hasAnyKey(node, PayloadAliases.EVENT_DESCRIPTIVE_KEYS))
            .orElse(MissingNode.getInstance());
    }

    /**
     * Bookmakers from the event node's own list; failing that, from the first
     * list found anywhere below it that yields at least one bookmaker.
     */
    static List<BookmakerOdds> locateBookmakers(JsonNode eventNode) {
        List<BookmakerOdds> bookmakers =
            mapBookmakers(JsonValues.list(JsonValues.first(eventNode, PayloadAliases.BOOKMAKER_LIST)));
        if (!bookmakers.isEmpty()) {
            return bookmakers;
        }

        for (JsonNode node : JsonValues.objectsBreadthFirst(eventNode)) {
            JsonNode candidates = JsonValues.first(node, PayloadAliases.BOOKMAKER_LIST);
            if (JsonValues.isAbsent(candidates)) {
                continue;
            }
            bookmakers = mapBookmakers(JsonValues.list(candidates));
            if (!bookmakers.isEmpty()) {
                return bookmakers;
            }
        }
        return bookmakers;
    }

    /**
     * Maps bookmaker entries, merging entries that share an identity (id, else
     * name). Merged entries keep the first non-null name / region and append markets.
     * Entries with neither id nor name are never merged.
     */
    static List<BookmakerOdds> mapBookmakers(List<JsonNode> entries) {
        Map<String, BookmakerOdds> byIdentity = new LinkedHashMap<>();

        for (int i = 0; i < entries.size(); i++) {
            JsonNode entry = entries.get(i);
            if (!entry.isObject()) {
                continue;
            }
            String id = JsonValues.stringify(JsonValues.first(entry, PayloadAliases.BOOKMAKER_ID));
            String name = JsonValues.text(JsonValues.first(entry, PayloadAliases.BOOKMAKER_NAME));
            String region = JsonValues.text(JsonValues.first(entry, PayloadAliases.BOOKMAKER_REGION));
            List<OddsMarket> markets = mapMarkets(
                expandGroups(JsonValues.list(JsonValues.first(entry, PayloadAliases.BOOKMAKER_MARKETS))));

            String identity = id != null ? "id:" + id : name != null ? "name:" + name : "bookmaker#" + i;
            BookmakerOdds bookmaker = byIdentity.computeIfAbsent(identity, key -> new BookmakerOdds(id, null, null));
            if (bookmaker.getName() == null) {
                bookmaker.setName(name);
            }
            if (bookmaker.getRegion() == null) {
                bookmaker.setRegion(region);
            }
            bookmaker.getMarkets().addAll(markets);
        }
        return new ArrayList<>(byIdentity.values());
    }

    /**
     * Replaces group wrappers (entries carrying their own {@code markets} list)
     * by the markets they contain, in place. Flat market entries pass through.
     */
    static List<JsonNode> expandGroups(List<JsonNode> rawMarkets) {
        List<JsonNode> expanded = new ArrayList<>();
        for (JsonNode candidate : rawMarkets) {
            if (candidate.isObject() && candidate.has(PayloadAliases.MARKET_GROUP_MARKETS)) {
                expanded.addAll(JsonValues.list(candidate.get(PayloadAliases.MARKET_GROUP_MARKETS)));
            } else {
                expanded.add(candidate);
            }
        }
        return expanded;
    }

    static List<OddsMarket> mapMarkets(List<JsonNode> rawMarkets) {
        List<OddsMarket> markets = new ArrayList<>();
        for (JsonNode raw : rawMarkets) {
            if (!raw.isObject()) {
                continue;
            }
            OddsMarket market = new OddsMarket();
            market.setId(JsonValues.stringify(JsonValues.first(raw, PayloadAliases.MARKET_ID)));
            market.setName(JsonValues.text(JsonValues.first(raw, PayloadAliases.MARKET_NAME)));
            market.setKey(JsonValues.stringify(JsonValues.first(raw, PayloadAliases.MARKET_KEY)));
            market.setOutcomes(mapOutcomes(JsonValues.list(JsonValues.first(raw, PayloadAliases.MARKET_OUTCOMES))));
            markets.add(market);
        }
        return markets;
    }

    static List<OddsOutcome> mapOutcomes(List<JsonNode> rawOutcomes) {
        List<OddsOutcome> outcomes = new ArrayList<>();
        for (JsonNode raw : rawOutcomes) {
            if (!raw.isObject()) {
                continue;
            }
            OddsOutcome outcome = new OddsOutcome();
            outcome.setId(JsonValues.stringify(JsonValues.first(raw, PayloadAliases.OUTCOME_ID)));
            outcome.setLabel(JsonValues.text(JsonValues.first(raw, PayloadAliases.OUTCOME_LABEL)));
            outcome.setSelectionKey(JsonValues.stringify(JsonValues.first(raw, PayloadAliases.OUTCOME_SELECTION_KEY)));
            outcome.setOddsDecimal(JsonValues.decimal(JsonValues.first(raw, PayloadAliases.OUTCOME_DECIMAL)));
            outcome.setOddsFractional(JsonValues.text(JsonValues.first(raw, PayloadAliases.OUTCOME_FRACTIONAL)));
            outcome.setProbability(JsonValues.decimal(JsonValues.first(raw, PayloadAliases.OUTCOME_PROBABILITY)));
            outcomes.add(outcome);
        }
        return outcomes;
    }
}
