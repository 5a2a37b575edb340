package com.example.reportmerge.domain.model;

/**
 * Records a page that could not be read and therefore contributed no text or tables.
 *
 * @param page    1-based page number
 * @param message failure description taken from the underlying exception
 */
public record PageWarning(int page, String message) {
}
