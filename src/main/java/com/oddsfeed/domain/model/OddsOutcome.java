package com.oddsfeed.domain.model;

import java.math.BigDecimal;

/**
 * Individual selection available within a market.
 */
public class OddsOutcome {

    /** Identifier provided by the upstream source. */
    private String id;

    /** User facing label, e.g. team name or outcome description. */
    private String label;

    /** Stable key that can be used to match selections across updates. */
    private String selectionKey;

    /** Decimal odds, e.g. 1.85. */
    private BigDecimal oddsDecimal;

    /** Fractional odds, e.g. "17/20". */
    private String oddsFractional;

    /** Implied probability or probability override supplied by upstream. */
    private BigDecimal probability;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public String getSelectionKey() {
        return selectionKey;
    }

    public void setSelectionKey(String selectionKey) {
        this.selectionKey = selectionKey;
    }

    public BigDecimal getOddsDecimal() {
        return oddsDecimal;
    }

    public void setOddsDecimal(BigDecimal oddsDecimal) {
        this.oddsDecimal = oddsDecimal;
    }

    public String getOddsFractional() {
        return oddsFractional;
    }

    public void setOddsFractional(String oddsFractional) {
        this.oddsFractional = oddsFractional;
    }

    public BigDecimal getProbability() {
        return probability;
    }

    public void setProbability(BigDecimal probability) {
        this.probability = probability;
    }
}
