package com.oddsfeed.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Odds data scoped to a single bookmaker.
 */
public class BookmakerOdds {

    /** Identifier of the bookmaker from the upstream API. */
    private String id;

    /** Display name of the bookmaker. */
    private String name;

    /** Region or jurisdiction for which the odds apply. */
    private String region;

    /** Markets offered by the bookmaker for the event, in upstream order. */
    private List<OddsMarket> markets = new ArrayList<>();

    public BookmakerOdds() {
    }

    public BookmakerOdds(String id, String name, String region) {
        this.id = id;
        this.name = name;
        this.region = region;
    }

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

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public List<OddsMarket> getMarkets() {
        return markets;
    }

    public void setMarkets(List<OddsMarket> markets) {
        this.markets = markets;
    }
}
