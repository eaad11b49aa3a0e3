package com.modsearch.core.error;

/**
 * Classifies every recoverable failure the client can surface to the user.
 */
public enum ErrorKind {
    /** Invalid filter, sort rule, navigation command or index. */
    USER_INPUT("Input error"),
    /** The API answered with a structured error payload. */
    REMOTE_APPLICATION("Error on server"),
    /** Connection failure, unexpected HTTP status or malformed response body. */
    TRANSPORT("Network error"),
    /** Local filesystem failure while writing a download. */
    RESOURCE("File error"),
    /** Inconsistent static tables or an unexpected fault inside the client. */
    INTERNAL("Internal error");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
