package org.tera201.commitlint.filter.commit;

import org.tera201.commitlint.domain.Commit;

/**
 * A predicate over single commits, combined with a range through
 * {@link org.tera201.commitlint.filter.range.CommitRange#filter(CommitFilter)}.
 * Implementations validate their parameters when constructed.
 */
public interface CommitFilter {

	/**
	 * @param commit	Commit in question
	 * @return	True if the commit should be linted, false if it should be left out.
	 */
	boolean accept(Commit commit);

}
