package com.oddsfeed.infrastructure.scraper.livesport;

import java.util.List;

/**
 * Upstream key names accepted for each logical field, in lookup order.
 */
public final class PayloadAliases {

    private PayloadAliases() {
    }

    // Locating the event node in the generic shape
    public static final List<String> EVENT_NODE_CANDIDATES =
        List.of("event", "eventOdds", "eventOddsV2", "event_data", "eventOddsResponse");
    public static final List<String> EVENT_NODE_MARKERS =
        List.of("bookmakers", "bookmakerOdds", "odds", "event", "fixture", "details", "eventDetails");

    // Event descriptive fields
    public static final List<String> GENERIC_EVENT_INFO = List.of("event", "fixture", "details");
    public static final List<String> AGGREGATE_EVENT_INFO = List.of("event", "eventDetails", "fixture");
    public static final List<String> EVENT_NAME =
        List.of("name", "eventName", "shortName", "eventLabel", "eventTitle");
    public static final List<String> COMPETITION_NAME =
        List.of("competition", "tournament", "league", "competitionName");
    public static final List<String> START_TIME =
        List.of("startTime", "startTimestamp", "kickoff", "startDate");
    public static final List<String> EVENT_DESCRIPTIVE_KEYS = List.of(
        "name", "eventName", "shortName", "competition", "tournament", "league", "competitionName",
        "startTime", "startTimestamp", "kickoff", "startDate");

    public static final List<String> SOURCE = List.of("source", "provider", "origin");

    // Bookmakers
    public static final List<String> BOOKMAKER_LIST = List.of("bookmakers", "bookmakerOdds", "odds");
    public static final List<String> BOOKMAKER_ID = List.of("id", "bookmakerId", "bookmakerID");
    public static final List<String> BOOKMAKER_NAME = List.of("name", "bookmakerName", "label");
    public static final List<String> BOOKMAKER_REGION = List.of("region", "country", "jurisdiction");
    public static final List<String> BOOKMAKER_MARKETS = List.of("markets", "marketGroups", "groups");

    // Markets
    public static final String MARKET_GROUP_MARKETS = "markets";
    public static final List<String> MARKET_ID = List.of("id", "marketId");
    public static final List<String> MARKET_NAME = List.of("name", "marketName", "label", "text");
    public static final List<String> MARKET_KEY = List.of("key", "marketKey");
    public static final List<String> MARKET_OUTCOMES = List.of("outcomes", "selections");

    // Outcomes
    public static final List<String> OUTCOME_ID = List.of("id", "outcomeId");
    public static final List<String> OUTCOME_LABEL = List.of("name", "label", "displayName", "text");
    public static final List<String> OUTCOME_SELECTION_KEY = List.of("key", "selectionKey", "outcomeKey");
    public static final List<String> OUTCOME_DECIMAL = List.of("oddsDecimal", "decimalOdds", "value");
    public static final List<String> OUTCOME_FRACTIONAL = List.of("oddsFractional", "fractionalOdds");
    public static final List<String> OUTCOME_PROBABILITY = List.of("probability", "impliedProbability");

    // Aggregate outcome label, first non-empty wins
    public static final List<String> AGGREGATE_OUTCOME_LABEL = List.of("selection", "winner", "score", "position");
}
