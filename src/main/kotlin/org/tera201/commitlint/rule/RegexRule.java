package org.tera201.commitlint.rule;

import org.tera201.commitlint.domain.Commit;
import org.tera201.commitlint.issue.Issue;

import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reports a commit when a regular expression is not found in some part of its
 * message.
 */
abstract class RegexRule implements Rule {

	private final Pattern pattern;
	private final String desc;

	RegexRule(String regex, int flags, String desc) throws InvalidRuleException {
		try {
			this.pattern = Pattern.compile(regex, flags);
		} catch (PatternSyntaxException e) {
			throw new InvalidRuleException("invalid regex [" + regex + "]", e);
		}
		this.desc = String.format(desc, regex);
	}

	protected abstract String partOf(Commit commit);

	@Override
	public Optional<Issue> check(Commit commit) {
		if (pattern.matcher(partOf(commit)).find())
			return Optional.empty();
		return Optional.of(new Issue(desc, commit));
	}

}
