package org.tera201.commitlint.issue;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.tera201.commitlint.domain.Commit;

import java.util.Objects;

/**
 * A rule violation found in one commit.
 */
@Getter
@EqualsAndHashCode
public class Issue {

	private final String desc;
	private final Commit commit;

	public Issue(String desc, Commit commit) {
		if (desc == null || desc.isEmpty())
			throw new IllegalArgumentException("issue description must not be empty");
		this.desc = desc;
		this.commit = Objects.requireNonNull(commit, "commit");
	}

	@Override
	public String toString() {
		return String.format("Issue [commit=%s, desc=%s]", commit.getHash(), desc);
	}

}
