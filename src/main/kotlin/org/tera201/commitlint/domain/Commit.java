package org.tera201.commitlint.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * A single commit as seen by the linter. Instances are immutable, so an
 * {@link org.tera201.commitlint.issue.Issue} can hold one without copying.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Commit {

	public static final int SHORT_ID_LENGTH = 7;

	private final String hash;
	private final String message;
	private final ZonedDateTime date;
	private final int numParents;
	private final Developer author;

	public Commit(String hash, String message, ZonedDateTime date, int numParents, Developer author) {
		if (hash == null || hash.isEmpty())
			throw new IllegalArgumentException("commit hash must not be empty");
		this.hash = hash;
		this.message = message == null ? "" : message;
		this.date = Objects.requireNonNull(date, "date");
		this.numParents = numParents;
		this.author = author == null ? new Developer("", "") : author;
	}

	/**
	 * @return The first {@value #SHORT_ID_LENGTH} characters of the hash.
	 * @throws IllegalStateException if the hash is shorter than that.
	 */
	public String getShortId() {
		if (hash.length() < SHORT_ID_LENGTH)
			throw new IllegalStateException("hash " + hash + " is shorter than " + SHORT_ID_LENGTH + " characters");
		return hash.substring(0, SHORT_ID_LENGTH);
	}

	/**
	 * @return The first line of the message.
	 */
	public String getSubject() {
		int eol = message.indexOf('\n');
		return eol < 0 ? message : message.substring(0, eol);
	}

	/**
	 * Everything after the first blank line. Paragraphs that follow are joined
	 * together without the blank lines that separated them.
	 *
	 * @return The message body, or an empty string when there is none.
	 */
	public String getBody() {
		String[] parts = message.split("\n\n", -1);
		if (parts.length < 2)
			return "";

		StringBuilder body = new StringBuilder();
		for (int i = 1; i < parts.length; i++) {
			body.append(parts[i]);
		}
		return body.toString();
	}
}
