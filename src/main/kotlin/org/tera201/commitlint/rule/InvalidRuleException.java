package org.tera201.commitlint.rule;

import org.tera201.commitlint.CommitLintException;

public class InvalidRuleException extends CommitLintException {
    public InvalidRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
