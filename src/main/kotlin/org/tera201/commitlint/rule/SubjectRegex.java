package org.tera201.commitlint.rule;

import org.tera201.commitlint.domain.Commit;

public class SubjectRegex extends RegexRule {

	public SubjectRegex(String regex) throws InvalidRuleException {
		super(regex, 0, "subject does not match regex [%s]");
	}

	@Override
	protected String partOf(Commit commit) {
		return commit.getSubject();
	}

}
