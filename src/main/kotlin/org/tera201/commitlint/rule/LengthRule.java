package org.tera201.commitlint.rule;

import org.tera201.commitlint.domain.Commit;
import org.tera201.commitlint.issue.Issue;

import java.util.Optional;

/**
 * Reports a commit when some part of its message is longer (or shorter) than
 * a limit.
 */
abstract class LengthRule implements Rule {

	private final int limit;
	private final boolean max;
	private final String desc;

	LengthRule(int limit, boolean max, String desc) {
		this.limit = limit;
		this.max = max;
		this.desc = String.format(desc, limit);
	}

	protected abstract String partOf(Commit commit);

	@Override
	public Optional<Issue> check(Commit commit) {
		int length = partOf(commit).length();
		boolean violated = max ? length > limit : length < limit;
		return violated ? Optional.of(new Issue(desc, commit)) : Optional.empty();
	}

}
