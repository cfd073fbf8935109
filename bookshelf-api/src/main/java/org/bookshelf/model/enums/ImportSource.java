package org.bookshelf.model.enums;

public enum ImportSource {
    GOODREADS,
    STORYGRAPH,
    LIBRARYTHING
}
