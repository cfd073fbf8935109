package org.bookshelf.model.enums;

public enum PrivacyLevel {
    PUBLIC,
    UNLISTED,
    FOLLOWERS,
    PRIVATE
}
