package org.tera201.commitlint.scm.exceptions;

import org.tera201.commitlint.CommitLintException;

public class RepositoryException extends CommitLintException {
    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
