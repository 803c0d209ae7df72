package com.impetus.impetus_backend.exception;

import lombok.Getter;

/**
 * A persisted layout could not be read: unbalanced parentheses, premature end of input,
 * invalid JSON, or a document of the wrong shape.
 */
@Getter
public class LayoutFormatException extends RuntimeException {

    private final String format;

    public LayoutFormatException(String format, String message) {
        super(message);
        this.format = format;
    }

    public LayoutFormatException(String format, String message, Throwable cause) {
        super(message, cause);
        this.format = format;
    }
}
