package org.tera201.commitlint.issue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tera201.commitlint.domain.Commit;
import org.tera201.commitlint.filter.range.CommitRange;
import org.tera201.commitlint.rule.Rule;
import org.tera201.commitlint.scm.exceptions.RepositoryException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs every rule against every commit of a range.
 */
public class IssueCollector {

	private static Logger log = LoggerFactory.getLogger(IssueCollector.class);

	private final List<Rule> rules;

	public IssueCollector(List<Rule> rules) {
		this.rules = List.copyOf(rules);
	}

	/**
	 * Issues come out grouped by commit, in range order, and within one commit
	 * in rule order. A commit may produce one issue per rule.
	 *
	 * @param range	The commits to check.
	 * @return	Every issue found, in discovery order.
	 * @throws RepositoryException	if the range could not be read.
	 */
	public List<Issue> collect(CommitRange range) throws RepositoryException {
		List<Commit> commits = range.get();
		log.debug("Checking {} commits against {} rules", commits.size(), rules.size());

		List<Issue> issues = new ArrayList<>();
		for (Commit commit : commits) {
			for (Rule rule : rules) {
				Optional<Issue> issue = rule.check(commit);
				issue.ifPresent(issues::add);
			}
		}

		log.debug("Found {} issues", issues.size());
		return issues;
	}

}
