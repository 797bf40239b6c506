package org.tera201.commitlint.filter.range;

import org.tera201.commitlint.domain.Commit;
import org.tera201.commitlint.scm.SCM;
import org.tera201.commitlint.scm.exceptions.RepositoryException;

import java.util.List;

/**
 * The history reachable from the head of a repository.
 */
public class AllCommits implements CommitRange {

	private final SCM scm;

	public AllCommits(SCM scm) {
		this.scm = scm;
	}

	@Override
	public List<Commit> get() throws RepositoryException {
		return scm.getCommits();
	}

	@Override
	public String toString() {
		return "AllCommits(" + scm + ")";
	}

}
