package org.tera201.commitlint;

import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tera201.commitlint.config.ConfigurationLoader;
import org.tera201.commitlint.config.LintConfiguration;
import org.tera201.commitlint.filter.InvalidFilterException;
import org.tera201.commitlint.filter.commit.NotAuthoredByEmails;
import org.tera201.commitlint.filter.commit.NotAuthoredByNames;
import org.tera201.commitlint.filter.commit.Since;
import org.tera201.commitlint.filter.commit.WithMaxParents;
import org.tera201.commitlint.filter.range.AllCommits;
import org.tera201.commitlint.filter.range.CommitRange;
import org.tera201.commitlint.filter.range.SingleMessage;
import org.tera201.commitlint.issue.Issue;
import org.tera201.commitlint.issue.IssueCollector;
import org.tera201.commitlint.issue.IssuePrinter;
import org.tera201.commitlint.rule.BodyMaxLength;
import org.tera201.commitlint.rule.BodyRegex;
import org.tera201.commitlint.rule.InvalidRuleException;
import org.tera201.commitlint.rule.Rule;
import org.tera201.commitlint.rule.SubjectMaxLength;
import org.tera201.commitlint.rule.SubjectMinLength;
import org.tera201.commitlint.rule.SubjectRegex;
import org.tera201.commitlint.scm.GitRepository;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command line entry point: lints the history of a repository, or a single
 * commit message, and prints one line per issue to standard output.
 */
public class CommitLint {

	public static final int EXIT_OK = 0;
	public static final int EXIT_ISSUES = 1;
	public static final int EXIT_ERROR = 2;

	private static Logger log = LoggerFactory.getLogger(CommitLint.class);

	private final OutputStream out;
	private final Path configFile;
	private final ConfigurationLoader loader = new ConfigurationLoader();

	public CommitLint(OutputStream out, Path configFile) {
		this.out = out;
		this.configFile = configFile;
	}

	public static void main(String[] args) {
		int status = new CommitLint(new FileOutputStream(FileDescriptor.out), Paths.get(ConfigurationLoader.DEFAULT_CONFIG_FILE)).run(args);
		System.exit(status);
	}

	public int run(String[] args) {
		LintConfiguration config;
		try {
			config = loader.load(args, configFile);
		} catch (ParseException e) {
			log.error("Invalid arguments: {}", e.getMessage());
			help();
			return EXIT_ERROR;
		} catch (IOException e) {
			log.error("Could not read " + configFile, e);
			return EXIT_ERROR;
		}

		if (config.isHelpRequested()) {
			help();
			return EXIT_OK;
		}

		try {
			List<Issue> issues = lint(config);
			new IssuePrinter("\n", out).print(issues);
			return issues.isEmpty() ? EXIT_OK : EXIT_ISSUES;
		} catch (CommitLintException e) {
			log.error("Lint aborted: {}", e.getMessage(), e);
			return EXIT_ERROR;
		} catch (IOException e) {
			log.error("Could not write report", e);
			return EXIT_ERROR;
		}
	}

	/**
	 * Reads, filters and checks the commits. Nothing is printed here, so a
	 * failure never leaves a partial report behind.
	 */
	public List<Issue> lint(LintConfiguration config) throws CommitLintException {
		CommitRange range = commits(config);
		log.debug("Linting {}", range);
		return new IssueCollector(rules(config)).collect(range);
	}

	public static CommitRange commits(LintConfiguration config) throws InvalidFilterException {
		CommitRange base = config.getMsgFile() != null
				? SingleMessage.fromFile(Paths.get(config.getMsgFile()))
				: new AllCommits(new GitRepository(config.getPath()));

		return base
				.filter(new Since(config.getSince()))
				.filter(new NotAuthoredByNames(config.getExcludedAuthorNames()))
				.filter(new NotAuthoredByEmails(config.getExcludedAuthorEmails()))
				.filter(new WithMaxParents(config.getMaxParents()));
	}

	public static List<Rule> rules(LintConfiguration config) throws InvalidRuleException {
		return List.of(
				new SubjectRegex(config.getSubjectRegex()),
				new SubjectMaxLength(config.getSubjectMaxLength()),
				new SubjectMinLength(config.getSubjectMinLength()),
				new BodyRegex(config.getBodyRegex()),
				new BodyMaxLength(config.getBodyMaxLength()));
	}

	private void help() {
		PrintWriter writer = new PrintWriter(System.err, true, StandardCharsets.UTF_8);
		new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "commit-lint [options]", null,
				loader.getOptions(), HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
		writer.flush();
	}

}
