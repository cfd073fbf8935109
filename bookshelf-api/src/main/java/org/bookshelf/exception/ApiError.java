package org.bookshelf.exception;

import lombok.Getter;

@Getter
public enum ApiError {
    USER_NOT_FOUND(Kind.NOT_FOUND, "User not found with ID: %s"),
    IMPORT_JOB_NOT_FOUND(Kind.NOT_FOUND, "Import job not found with ID: %s"),
    IMPORT_ITEM_NOT_IN_JOB(Kind.VALIDATION, "Import item %s does not belong to import job %s"),
    NO_FAILED_IMPORT_ITEMS(Kind.VALIDATION, "Import job %s has no failed items to retry"),
    EMPTY_IMPORT_FILE(Kind.VALIDATION, "Import file contains no rows"),
    UNREADABLE_IMPORT_FILE(Kind.VALIDATION, "Import file could not be read: %s"),
    UNSUPPORTED_IMPORT_SOURCE(Kind.VALIDATION, "No normalizer registered for import source %s"),
    INVALID_IMPORT_ROW(Kind.VALIDATION, "Row %s is missing mandatory fields: %s"),
    IMPORT_BOOK_NOT_FOUND(Kind.RESOLUTION, "Could not find a match for book: %s"),
    IMPORT_BOOK_LOOKUP_FAILED(Kind.RESOLUTION, "Book lookup failed for %s: %s");

    private final Kind kind;
    private final String message;

    ApiError(Kind kind, String message) {
        this.kind = kind;
        this.message = message;
    }

    public APIException createException(Object... details) {
        return new APIException(this, String.format(message, details));
    }

    public APIException createException(Throwable cause, Object... details) {
        return new APIException(this, String.format(message, details), cause);
    }

    public enum Kind {
        VALIDATION,
        NOT_FOUND,
        RESOLUTION
    }
}
