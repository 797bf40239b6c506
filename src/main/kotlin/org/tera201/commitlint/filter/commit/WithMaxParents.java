package org.tera201.commitlint.filter.commit;

import org.tera201.commitlint.domain.Commit;

/**
 * Accepts commits with at most {@code n} parents. {@code new WithMaxParents(1)}
 * leaves out merge commits.
 */
public class WithMaxParents implements CommitFilter {

	private final int maxParents;

	public WithMaxParents(int maxParents) {
		this.maxParents = maxParents;
	}

	public boolean accept(Commit commit) {
		return commit.getNumParents() <= maxParents;
	}

	@Override
	public String toString() {
		return "WithMaxParents(" + maxParents + ")";
	}

}
