package org.tera201.commitlint.filter.commit;

import org.tera201.commitlint.domain.Developer;
import org.tera201.commitlint.filter.InvalidFilterException;

import java.util.List;

public class NotAuthoredByEmails extends NotAuthoredBy {

	public NotAuthoredByEmails(List<String> patterns) throws InvalidFilterException {
		super(patterns, Developer::getEmail);
	}

}
