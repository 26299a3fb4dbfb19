package com.example.reelreply.content;

import lombok.Getter;

/**
 * Failure of a content API call. Carries the HTTP status and platform error code when known
 * so the failure can be classified.
 */
@Getter
public class ContentApiException extends RuntimeException {

    /** HTTP status, or 0 when no response was received. */
    private final int status;
    private final Integer errorCode;

    public ContentApiException(int status, Integer errorCode, String message) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public ContentApiException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.errorCode = null;
    }
}
