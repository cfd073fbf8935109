package org.bookshelf.exception;

import lombok.Getter;

@Getter
public class APIException extends RuntimeException {

    private final ApiError error;

    public APIException(ApiError error, String message) {
        super(message);
        this.error = error;
    }

    public APIException(ApiError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}
