package com.example.reportmerge.domain.model;

/**
 * Matching passes in the order they are tried, from strictest to loosest.
 * Each pass also names the statistics counter it feeds.
 */
public enum MatchPass {
    EXACT_FILENAME(1, "exact_match"),
    FILENAME_WITHOUT_EXTENSION(2, "partial_match"),
    IDENTIFIER_PREFIX(3, "id_match"),
    RELIEFWEB_ID(4, "reliefweb_id_match"),
    TITLE_CONTAINMENT(5, "title_match");

    private final int number;
    private final String statisticKey;

    MatchPass(int number, String statisticKey) {
        this.number = number;
        this.statisticKey = statisticKey;
    }

    public int number() {
        return number;
    }

    public String statisticKey() {
        return statisticKey;
    }
}
