package org.tera201.commitlint.filter.commit;

import org.tera201.commitlint.domain.Commit;
import org.tera201.commitlint.filter.InvalidFilterException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Accepts commits authored on or after midnight UTC of the given day.
 */
public class Since implements CommitFilter {

	private final Instant since;

	/**
	 * @param date	Day in {@code yyyy-MM-dd} format.
	 * @throws InvalidFilterException	if the date cannot be parsed.
	 */
	public Since(String date) throws InvalidFilterException {
		if (date == null)
			throw new InvalidFilterException("no date given");
		try {
			this.since = LocalDate.parse(date).atStartOfDay(ZoneOffset.UTC).toInstant();
		} catch (DateTimeParseException e) {
			throw new InvalidFilterException("invalid date [" + date + "], expected yyyy-MM-dd", e);
		}
	}

	@Override
	public boolean accept(Commit commit) {
		return !commit.getDate().toInstant().isBefore(since);
	}

	@Override
	public String toString() {
		return "Since(" + since + ")";
	}

}
