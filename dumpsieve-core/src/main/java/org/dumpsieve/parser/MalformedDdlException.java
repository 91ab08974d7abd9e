package org.dumpsieve.parser;

import lombok.Getter;

/**
 * Raised when a CREATE TABLE statement does not have the shape the rewriter relies on.
 */
@Getter
public class MalformedDdlException extends RuntimeException {
    private final String ddl;

    public MalformedDdlException(String message, String ddl) {
        super(message);
        this.ddl = ddl;
    }
}
