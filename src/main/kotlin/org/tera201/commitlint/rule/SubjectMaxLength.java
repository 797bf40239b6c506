package org.tera201.commitlint.rule;

import org.tera201.commitlint.domain.Commit;

public class SubjectMaxLength extends LengthRule {

	public SubjectMaxLength(int max) {
		super(max, true, "subject length exceeds max [%d]");
	}

	@Override
	protected String partOf(Commit commit) {
		return commit.getSubject();
	}

}
