package org.tera201.commitlint.scm;

import org.tera201.commitlint.domain.Commit;
import org.tera201.commitlint.scm.exceptions.RepositoryException;

import java.util.List;

public interface SCM {

	/**
	 * @return Commit representing the "head" (most recent) commit.
	 * @throws RepositoryException if there is no head, e.g. in an empty repository.
	 */
	Commit getHead() throws RepositoryException;

	/**
	 * Walk the history reachable from the head, most recent first.
	 *
	 * @return All commits reachable from the head.
	 * @throws RepositoryException if the head cannot be resolved or the walk fails.
	 */
	List<Commit> getCommits() throws RepositoryException;

}
