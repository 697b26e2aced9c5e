package com.eyelevel.mediamigrator.exception.json;

import java.io.Serial;

/**
 * Thrown when an attempt to parse or serialize JSON data fails.
 */
public class JsonParsingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 2870416633710255519L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
