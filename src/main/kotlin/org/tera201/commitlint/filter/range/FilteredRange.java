package org.tera201.commitlint.filter.range;

import org.tera201.commitlint.domain.Commit;
import org.tera201.commitlint.filter.commit.CommitFilter;
import org.tera201.commitlint.scm.exceptions.RepositoryException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Keeps the commits of an upstream range that a {@link CommitFilter} accepts,
 * in upstream order.
 */
public class FilteredRange implements CommitRange {

	private final CommitRange upstream;
	private final CommitFilter filter;

	public FilteredRange(CommitRange upstream, CommitFilter filter) {
		this.upstream = Objects.requireNonNull(upstream, "upstream");
		this.filter = Objects.requireNonNull(filter, "filter");
	}

	@Override
	public List<Commit> get() throws RepositoryException {
		List<Commit> all = upstream.get();

		List<Commit> filtered = new ArrayList<>();
		for (Commit commit : all) {
			if (filter.accept(commit)) {
				filtered.add(commit);
			}
		}

		return filtered;
	}

	@Override
	public String toString() {
		return upstream + " | " + filter;
	}

}
