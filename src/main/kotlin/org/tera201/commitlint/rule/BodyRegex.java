package org.tera201.commitlint.rule;

import org.tera201.commitlint.domain.Commit;

import java.util.regex.Pattern;

/**
 * The pattern is compiled with {@link Pattern#DOTALL} so it can span the lines
 * of the body.
 */
public class BodyRegex extends RegexRule {

	public BodyRegex(String regex) throws InvalidRuleException {
		super(regex, Pattern.DOTALL, "body does not conform to regex [%s]");
	}

	@Override
	protected String partOf(Commit commit) {
		return commit.getBody();
	}

}
