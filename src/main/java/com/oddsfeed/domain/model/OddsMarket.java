package com.oddsfeed.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Container for all selections of one betting market offered by a bookmaker.
 */
public class OddsMarket {

    /** Identifier provided by the upstream source. */
    private String id;

    /** Display name of the market (e.g. "1X2 - First Half"). */
    private String name;

    /**
     * Stable key used to match the same market across refreshes
     * (e.g. "HOME_DRAW_AWAY:FULL_TIME").
     */
    private String key;

    /** Selections in upstream order. */
    private List<OddsOutcome> outcomes = new ArrayList<>();

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public List<OddsOutcome> getOutcomes() {
        return outcomes;
    }

    public void setOutcomes(List<OddsOutcome> outcomes) {
        this.outcomes = outcomes;
    }
}
