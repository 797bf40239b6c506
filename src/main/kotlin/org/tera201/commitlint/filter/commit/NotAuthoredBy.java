package org.tera201.commitlint.filter.commit;

import org.tera201.commitlint.domain.Commit;
import org.tera201.commitlint.domain.Developer;
import org.tera201.commitlint.filter.InvalidFilterException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Leaves out commits whose author has an attribute matching any of a list of
 * regular expressions. A pattern matches when it is found anywhere in the
 * attribute.
 */
abstract class NotAuthoredBy implements CommitFilter {

	private final List<Pattern> patterns;
	private final Function<Developer, String> attribute;

	NotAuthoredBy(List<String> patterns, Function<Developer, String> attribute) throws InvalidFilterException {
		this.attribute = attribute;
		this.patterns = new ArrayList<>();
		for (String p : patterns) {
			try {
				this.patterns.add(Pattern.compile(p));
			} catch (PatternSyntaxException e) {
				throw new InvalidFilterException("invalid author pattern [" + p + "]", e);
			}
		}
	}

	@Override
	public boolean accept(Commit commit) {
		String value = attribute.apply(commit.getAuthor());
		return patterns.stream().noneMatch(p -> p.matcher(value).find());
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + patterns;
	}

}
