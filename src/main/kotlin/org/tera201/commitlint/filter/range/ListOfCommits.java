package org.tera201.commitlint.filter.range;

import org.tera201.commitlint.domain.Commit;

import java.util.ArrayList;
import java.util.List;

public class ListOfCommits implements CommitRange {

	private final List<Commit> commits;

	public ListOfCommits(List<Commit> commits) {
		this.commits = commits;
	}

	@Override
	public List<Commit> get() {
		return new ArrayList<>(commits);
	}

	@Override
	public String toString() {
		return "ListOfCommits(" + commits.size() + ")";
	}

}
