package com.oddsfeed.domain.model;

import java.time.Instant;

/**
 * Structured response returned to consumers of the odds endpoint.
 */
public class OddsResponse {

    private EventOdds event;

    /** When the payload was normalized. Always set locally, never copied from upstream. */
    private Instant retrievedAt;

    /** Identifier for the upstream odds provider. */
    private String source;

    public OddsResponse() {
    }

    public OddsResponse(EventOdds event, Instant retrievedAt, String source) {
        this.event = event;
        this.retrievedAt = retrievedAt;
        this.source = source;
    }

    public EventOdds getEvent() {
        return event;
    }

    public void setEvent(EventOdds event) {
        this.event = event;
    }

    public Instant getRetrievedAt() {
        return retrievedAt;
    }

    public void setRetrievedAt(Instant retrievedAt) {
        this.retrievedAt = retrievedAt;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }
}
