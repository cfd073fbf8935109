package org.bookshelf.model.enums;

import lombok.Getter;

/**
 * Canonical columns every normalizer produces. The key is what gets stored in an import item's data map.
 */
@Getter
public enum ImportField {
    ID("id"),
    TITLE("Title"),
    AUTHOR("Author"),
    ISBN13("ISBN13"),
    RATING("My Rating"),
    REVIEW("My Review"),
    SHELF("Shelf"),
    DATE_ADDED("Date Added"),
    DATE_READ("Date Read");

    private final String key;

    ImportField(String key) {
        this.key = key;
    }
}
