package org.tera201.commitlint;

/**
 * Base type of every condition that aborts a lint run.
 */
public class CommitLintException extends Exception {

	public CommitLintException(String message) {
		super(message);
	}

	public CommitLintException(String message, Throwable cause) {
		super(message, cause);
	}

}
