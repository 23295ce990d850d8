package com.oddsfeed.infrastructure.scraper.livesport;

import java.util.Locale;
import java.util.Map;

/**
 * Maps aggregate betting types and scopes to a stable market key and a display name.
 */
public class MarketNameTables {

    /** Scope label meaning "no specific scope"; the name then carries the type only. */
    public static final String SCOPE_SENTINEL = "Market";

    private static final String UNKNOWN = "UNKNOWN";

    public static final Map<String, String> TYPE_LABELS = Map.of(
        "HOME_DRAW_AWAY", "1X2",
        "DOUBLE_CHANCE", "Double Chance",
        "DRAW_NO_BET", "Draw No Bet",
        "OVER_UNDER", "Over/Under",
        "ASIAN_HANDICAP", "Asian Handicap",
        "EUROPEAN_HANDICAP", "European Handicap",
        "HALF_FULL_TIME", "Half-Time/Full-Time",
        "CORRECT_SCORE", "Correct Score",
        "BOTH_TEAMS_TO_SCORE", "Both Teams To Score",
        "ODD_OR_EVEN", "Odd or Even"
    );

    public static final Map<String, String> SCOPE_LABELS = Map.of(
        "FULL_TIME", "Full Time",
        "FIRST_HALF", "First Half",
        "SECOND_HALF", "Second Half",
        UNKNOWN, SCOPE_SENTINEL
    );

    public record MarketName(String key, String name) {}

    /**
     * Builds the "TYPE:SCOPE" key and display name for a betting type / scope pair.
     * Missing parts are treated as UNKNOWN.
     */
    public static MarketName describe(String bettingType, String bettingScope) {
        String type = bettingType == null || bettingType.isBlank() ? UNKNOWN : bettingType.toUpperCase(Locale.ROOT);
        String scope = bettingScope == null || bettingScope.isBlank() ? UNKNOWN : bettingScope.toUpperCase(Locale.ROOT);

        String typeLabel = TYPE_LABELS.getOrDefault(type, titleCase(type));
        String scopeLabel = SCOPE_LABELS.getOrDefault(scope, titleCase(scope));

        String name = SCOPE_SENTINEL.equals(scopeLabel) ? typeLabel : typeLabel + " - " + scopeLabel;
        return new MarketName(type + ":" + scope, name);
    }

    /**
     * "ASIAN_TOTAL_CORNERS" becomes "Asian Total Corners": underscores become
     * spaces, a letter following a non-letter is upper-cased, the rest lower-cased.
     */
    static String titleCase(String value) {
        StringBuilder result = new StringBuilder(value.length());
        boolean previousIsLetter = false;
        for (char c : value.replace('_', ' ').toCharArray()) {
            if (Character.isLetter(c)) {
                result.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousIsLetter = true;
            } else {
                result.append(c);
                previousIsLetter = false;
            }
        }
        return result.toString();
    }
}
