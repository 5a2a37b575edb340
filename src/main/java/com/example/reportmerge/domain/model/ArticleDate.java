package com.example.reportmerge.domain.model;

/**
 * Date block of an article. All three sub-fields are always present, empty when unknown.
 */
public record ArticleDate(String created, String changed, String original) {

    private static final ArticleDate EMPTY = new ArticleDate("", "", "");

    public ArticleDate {
        created = created == null ? "" : created;
        changed = changed == null ? "" : changed;
        original = original == null ? "" : original;
    }

    public static ArticleDate empty() {
        return EMPTY;
    }
}
