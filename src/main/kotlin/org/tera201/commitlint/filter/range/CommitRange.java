package org.tera201.commitlint.filter.range;

import org.tera201.commitlint.domain.Commit;
import org.tera201.commitlint.filter.commit.CommitFilter;
import org.tera201.commitlint.scm.exceptions.RepositoryException;

import java.util.List;

/**
 * A re-invocable source of commits. Every call to {@link #get()} derives its
 * result again from the underlying collaborator; implementations never cache.
 */
public interface CommitRange {

	/**
	 * Extract the commits of this range.
	 *
	 * @return	The commits, in the order of the underlying source.
	 * @throws RepositoryException	if the underlying source could not be read.
	 */
	List<Commit> get() throws RepositoryException;

	/**
	 * @param filter	Commits to keep.
	 * @return	A range over the commits of this one that the filter accepts.
	 */
	default CommitRange filter(CommitFilter filter) {
		return new FilteredRange(this, filter);
	}

}
