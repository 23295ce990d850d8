package com.oddsfeed.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Top level odds container for an event.
 */
public class EventOdds {

    /** Identifier requested by the caller. Never taken from the upstream payload. */
    private String eventId;

    /** Display name of the event or matchup. */
    private String eventName;

    /** Competition or tournament name, if provided. */
    private String competitionName;

    /** Scheduled start time in UTC. */
    private Instant startTime;

    /** Odds grouped by bookmaker. */
    private List<BookmakerOdds> bookmakers = new ArrayList<>();

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getEventName() {
        return eventName;
    }

    public void setEventName(String eventName) {
        this.eventName = eventName;
    }

    public String getCompetitionName() {
        return competitionName;
    }

    public void setCompetitionName(String competitionName) {
        this.competitionName = competitionName;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    public List<BookmakerOdds> getBookmakers() {
        return bookmakers;
    }

    public void setBookmakers(List<BookmakerOdds> bookmakers) {
        this.bookmakers = bookmakers;
    }
}
