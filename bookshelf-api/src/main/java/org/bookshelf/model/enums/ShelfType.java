package org.bookshelf.model.enums;

import lombok.Getter;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

@Getter
public enum ShelfType {
    TO_READ("to-read", "To Read", "to-read"),
    READING("reading", "Currently Reading", "currently-reading", "reading"),
    READ("read", "Read", "read");

    private final String identifier;
    private final String displayName;
    private final String[] sourceNames;

    ShelfType(String identifier, String displayName, String... sourceNames) {
        this.identifier = identifier;
        this.displayName = displayName;
        this.sourceNames = sourceNames;
    }

    public static Optional<ShelfType> fromSourceName(String sourceShelf) {
        if (sourceShelf == null) {
            return Optional.empty();
        }
        String normalized = sourceShelf.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> Arrays.asList(type.sourceNames).contains(normalized))
                .findFirst();
    }
}
