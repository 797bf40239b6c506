package org.tera201.commitlint.rule;

import org.tera201.commitlint.domain.Commit;

public class SubjectMinLength extends LengthRule {

	public SubjectMinLength(int min) {
		super(min, false, "subject length less than min [%d]");
	}

	@Override
	protected String partOf(Commit commit) {
		return commit.getSubject();
	}

}
