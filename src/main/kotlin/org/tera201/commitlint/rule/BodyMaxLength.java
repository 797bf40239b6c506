package org.tera201.commitlint.rule;

import org.tera201.commitlint.domain.Commit;

public class BodyMaxLength extends LengthRule {

	public BodyMaxLength(int max) {
		super(max, true, "body length exceeds max [%d]");
	}

	@Override
	protected String partOf(Commit commit) {
		return commit.getBody();
	}

}
