package org.tera201.commitlint.filter;

import org.tera201.commitlint.CommitLintException;

public class InvalidFilterException extends CommitLintException {
    public InvalidFilterException(String message) {
        super(message);
    }

    public InvalidFilterException(String message, Throwable cause) {
        super(message, cause);
    }
}
