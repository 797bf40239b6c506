package org.tera201.commitlint.rule;

import org.tera201.commitlint.domain.Commit;
import org.tera201.commitlint.issue.Issue;

import java.util.Optional;

/**
 * A check applied to a single commit.
 */
public interface Rule {

	/**
	 * @param commit	Commit to check.
	 * @return	The issue found, or empty if the commit complies.
	 */
	Optional<Issue> check(Commit commit);

}
