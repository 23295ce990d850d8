package com.oddsfeed.infrastructure.scraper.livesport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.oddsfeed.domain.model.BookmakerOdds;
import com.oddsfeed.domain.model.EventOdds;
import com.oddsfeed.domain.model.OddsMarket;
import com.oddsfeed.domain.model.OddsOutcome;
import com.oddsfeed.domain.model.OddsResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LivesportPayloadNormalizer and the two shape mappers behind it.
 */
class LivesportPayloadNormalizerTest {

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private LivesportPayloadNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new LivesportPayloadNormalizer(Clock.fixed(NOW, ZoneOffset.UTC), "livesport");
    }

    private static JsonNode json(String value) throws Exception {
        return mapper.readTree(value);
    }

    @Test
    void testPayloadWithoutKnownKeysYieldsEmptyEvent() throws Exception {
        OddsResponse response = normalizer.normalize("evt-1", json("{\"unrelated\": true}"));

        EventOdds event = response.getEvent();
        assertEquals("evt-1", event.getEventId());
        assertNull(event.getEventName());
        assertNull(event.getCompetitionName());
        assertNull(event.getStartTime());
        assertTrue(event.getBookmakers().isEmpty());
        assertEquals("livesport", response.getSource());
        assertEquals(NOW, response.getRetrievedAt());
    }

    @Test
    void testNullPayloadIsTreatedAsEmpty() {
        OddsResponse response = normalizer.normalize("evt-1", null);
        OddsResponse fromNullNode = normalizer.normalize("evt-2", NullNode.getInstance());

        assertTrue(response.getEvent().getBookmakers().isEmpty());
        assertEquals("evt-2", fromNullNode.getEvent().getEventId());
        assertNull(fromNullNode.getEvent().getEventName());
        assertTrue(fromNullNode.getEvent().getBookmakers().isEmpty());
        assertEquals("livesport", fromNullNode.getSource());
    }

    @Test
    void testNonObjectPayloadIsRejected() throws Exception {
        JsonNode payload = json("[1, 2, 3]");

        assertThrows(IllegalArgumentException.class, () -> normalizer.normalize("evt-1", payload));
    }

    @Test
    void testDetectShape() throws Exception {
        assertEquals(LivesportPayloadNormalizer.PayloadShape.AGGREGATE,
            LivesportPayloadNormalizer.detectShape(json("{\"data\": {\"findOddsByEventId\": {}}}")));
        assertEquals(LivesportPayloadNormalizer.PayloadShape.GENERIC,
            LivesportPayloadNormalizer.detectShape(json("{\"data\": {\"findOddsByEventId\": null}}")));
        assertEquals(LivesportPayloadNormalizer.PayloadShape.GENERIC,
            LivesportPayloadNormalizer.detectShape(json("{\"data\": {\"event\": {}}}")));
    }

    @Test
    void testAggregatePayload() throws Exception {
        JsonNode payload = json("""
            {"data": {"findOddsByEventId": {
              "settings": {"bookmakers": [{"bookmaker": {"id": 16, "name": "bet365"}}]},
              "odds": [{"bookmakerId": 16, "bettingType": "HOME_DRAW_AWAY", "bettingScope": "FULL_TIME",
                        "odds": [{"eventParticipantId": "p1", "value": 1.85, "probability": 0.54}]}],
              "event": {"name": "Home - Away", "tournament": {"name": "League"}, "startTime": 1714586400}
            }}}
            """);

        OddsResponse response = normalizer.normalize("evt-1", payload);
        EventOdds event = response.getEvent();

        assertEquals("Home - Away", event.getEventName());
        assertEquals("League", event.getCompetitionName());
        assertEquals(Instant.ofEpochSecond(1714586400L), event.getStartTime());

        assertEquals(1, event.getBookmakers().size());
        BookmakerOdds bookmaker = event.getBookmakers().get(0);
        assertEquals("16", bookmaker.getId());
        assertEquals("bet365", bookmaker.getName());

        assertEquals(1, bookmaker.getMarkets().size());
        OddsMarket market = bookmaker.getMarkets().get(0);
        assertEquals("HOME_DRAW_AWAY:FULL_TIME", market.getKey());
        assertEquals("HOME_DRAW_AWAY:FULL_TIME", market.getId());
        assertEquals("1X2 - Full Time", market.getName());

        assertEquals(1, market.getOutcomes().size());
        OddsOutcome outcome = market.getOutcomes().get(0);
        assertEquals("p1", outcome.getId());
        assertEquals("p1", outcome.getSelectionKey());
        assertEquals("p1", outcome.getLabel());
        assertEquals(0, new BigDecimal("1.85").compareTo(outcome.getOddsDecimal()));
        assertEquals(0, new BigDecimal("0.54").compareTo(outcome.getProbability()));
        assertNull(outcome.getOddsFractional());
    }

    @Test
    void testAggregateKeepsBookmakersOnlyKnownFromOdds() throws Exception {
        JsonNode payload = json("""
            {"data": {"findOddsByEventId": {
              "settings": {"bookmakers": [{"bookmaker": {"id": 1, "name": "One"}}, {"name": "no id"}]},
              "odds": [
                {"bookmakerId": 2, "bettingType": "OVER_UNDER",
                 "odds": [{"selection": "Over", "handicap": {"value": "2.5"}, "value": "1.90"}, {}]},
                {"bookmakerId": 2, "bettingType": "OVER_UNDER",
                 "odds": [{"winner": "Under", "value": 1.95}]}
              ]
            }}}
            """);

        List<BookmakerOdds> bookmakers = normalizer.normalize("evt-1", payload).getEvent().getBookmakers();

        assertEquals(2, bookmakers.size());
        assertEquals("1", bookmakers.get(0).getId());
        assertTrue(bookmakers.get(0).getMarkets().isEmpty());

        BookmakerOdds oddsOnly = bookmakers.get(1);
        assertEquals("2", oddsOnly.getId());
        assertNull(oddsOnly.getName());
        assertNull(oddsOnly.getRegion());

        assertEquals(1, oddsOnly.getMarkets().size());
        OddsMarket market = oddsOnly.getMarkets().get(0);
        assertEquals("OVER_UNDER:UNKNOWN", market.getKey());
        assertEquals("Over/Under", market.getName());

        List<OddsOutcome> outcomes = market.getOutcomes();
        assertEquals(3, outcomes.size());
        assertEquals("Over (2.5)", outcomes.get(0).getLabel());
        assertEquals("Over", outcomes.get(0).getId());
        assertEquals("Selection", outcomes.get(1).getLabel());
        assertEquals("OVER_UNDER:UNKNOWN:1", outcomes.get(1).getId());
        assertEquals("Under", outcomes.get(2).getLabel());
    }

    @Test
    void testAggregateSourceFallsBackToDefault() throws Exception {
        OddsResponse response = normalizer.normalize("evt-1", json("{\"data\": {\"findOddsByEventId\": {\"odds\": []}}}"));

        assertEquals("livesport", response.getSource());
        assertTrue(response.getEvent().getBookmakers().isEmpty());
    }

    @Test
    void testGenericMergesDuplicateBookmakers() throws Exception {
        JsonNode payload = json("""
            {"data": {"event": {
              "name": "A vs B",
              "competition": {"name": "Cup"},
              "startTime": "2024-05-01T18:00:00Z",
              "bookmakers": [
                {"id": "b1", "name": "Alpha", "markets": [
                  {"id": "m1", "name": "Winner", "key": "WIN",
                   "outcomes": [{"id": "o1", "name": "A", "key": "HOME", "oddsDecimal": "1.5", "oddsFractional": "1/2"}]}
                ]},
                {"id": "b2", "name": "Beta", "region": "EU", "markets": []},
                {"id": "b1", "region": "UK", "markets": [{"id": "m2", "name": "Total"}]}
              ]
            }}}
            """);

        OddsResponse response = normalizer.normalize("evt-1", payload);
        EventOdds event = response.getEvent();

        assertEquals("A vs B", event.getEventName());
        assertEquals("Cup", event.getCompetitionName());
        assertEquals(Instant.parse("2024-05-01T18:00:00Z"), event.getStartTime());

        List<BookmakerOdds> bookmakers = event.getBookmakers();
        assertEquals(2, bookmakers.size());

        BookmakerOdds merged = bookmakers.get(0);
        assertEquals("b1", merged.getId());
        assertEquals("Alpha", merged.getName());
        assertEquals("UK", merged.getRegion());
        assertEquals(List.of("m1", "m2"), merged.getMarkets().stream().map(OddsMarket::getId).toList());

        OddsOutcome outcome = merged.getMarkets().get(0).getOutcomes().get(0);
        assertEquals("o1", outcome.getId());
        assertEquals("A", outcome.getLabel());
        assertEquals("HOME", outcome.getSelectionKey());
        assertEquals(new BigDecimal("1.5"), outcome.getOddsDecimal());
        assertEquals("1/2", outcome.getOddsFractional());

        assertEquals("Beta", bookmakers.get(1).getName());
        assertEquals("EU", bookmakers.get(1).getRegion());
    }

    @Test
    void testGenericBookmakersWithoutIdentityAreNeverMerged() throws Exception {
        JsonNode payload = json("""
            {"event": {"bookmakers": [{"region": "EU"}, {"region": "UK"}, {"bookmakerName": "Gamma"}]}}
            """);

        List<BookmakerOdds> bookmakers = normalizer.normalize("evt-1", payload).getEvent().getBookmakers();

        assertEquals(3, bookmakers.size());
        assertNull(bookmakers.get(0).getId());
        assertEquals("Gamma", bookmakers.get(2).getName());
    }

    @Test
    void testGenericExpandsMarketGroups() throws Exception {
        JsonNode payload = json("""
            {"event": {"bookmakers": [{"id": 7, "marketGroups": [
              {"name": "Main", "markets": [{"id": "m1"}, {"id": "m2"}]},
              {"id": "m3", "selections": [{"outcomeId": "s1", "decimalOdds": 3.2, "impliedProbability": "0.31"}]}
            ]}]}}
            """);

        BookmakerOdds bookmaker = normalizer.normalize("evt-1", payload).getEvent().getBookmakers().get(0);

        assertEquals("7", bookmaker.getId());
        assertEquals(List.of("m1", "m2", "m3"), bookmaker.getMarkets().stream().map(OddsMarket::getId).toList());

        OddsOutcome outcome = bookmaker.getMarkets().get(2).getOutcomes().get(0);
        assertEquals("s1", outcome.getId());
        assertEquals(0, new BigDecimal("3.2").compareTo(outcome.getOddsDecimal()));
        assertEquals(new BigDecimal("0.31"), outcome.getProbability());
    }

    @Test
    void testGenericSearchesTreeForEventNode() throws Exception {
        JsonNode payload = json("""
            {"provider": "mirror", "result": {"payload": [
              {"meta": {"page": 1}},
              {"bookmakerOdds": [{"bookmakerName": "Deep", "markets": []}], "eventName": "Found"}
            ]}}
            """);

        OddsResponse response = normalizer.normalize("evt-1", payload);

        assertEquals("mirror", response.getSource());
        assertEquals("Found", response.getEvent().getEventName());
        assertEquals(1, response.getEvent().getBookmakers().size());
        assertEquals("Deep", response.getEvent().getBookmakers().get(0).getName());
    }

    @Test
    void testGenericSearchesBelowEventNodeForBookmakers() throws Exception {
        JsonNode payload = json("""
            {"data": {"event": {"name": "Nested", "sections": {"book": {"bookmakers": [{"id": 1, "name": "One"}]}}}}}
            """);

        OddsResponse response = normalizer.normalize("evt-1", payload);

        assertEquals("Nested", response.getEvent().getEventName());
        assertEquals("One", response.getEvent().getBookmakers().get(0).getName());
    }

    @Test
    void testRequestedEventIdIsAuthoritative() throws Exception {
        OddsResponse response = normalizer.normalize("requested", json("{\"event\": {\"id\": \"other\", \"name\": \"X\"}}"));

        assertEquals("requested", response.getEvent().getEventId());
    }

    @Test
    void testEpochSecondsAndMillisGiveSameStartTime() throws Exception {
        Instant seconds = normalizer.normalize("e", json("{\"event\": {\"startTime\": 1700000000}}"))
            .getEvent().getStartTime();
        Instant millis = normalizer.normalize("e", json("{\"event\": {\"startTimestamp\": 1700000000000}}"))
            .getEvent().getStartTime();

        assertEquals(Instant.ofEpochSecond(1_700_000_000L), seconds);
        assertEquals(seconds, millis);
    }
}
