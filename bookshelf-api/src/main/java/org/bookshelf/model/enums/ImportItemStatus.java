package org.bookshelf.model.enums;

public enum ImportItemStatus {
    PENDING,
    RESOLVED,
    FAILED
}
