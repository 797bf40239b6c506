package org.tera201.commitlint.config;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds a {@link LintConfiguration} from a settings file and the command line.
 * The file holds one option per line, written as on the command line; blank
 * lines and lines starting with {@code #} are skipped. Options given on the
 * command line override those from the file.
 */
public class ConfigurationLoader {

	public static final String DEFAULT_CONFIG_FILE = ".gitlint";

	private static Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

	private final Options options = setupOptions();

	public Options getOptions() {
		return options;
	}

	public LintConfiguration load(String[] args, Path configFile) throws ParseException, IOException {
		LintConfiguration config = new LintConfiguration();

		if (configFile != null && Files.isRegularFile(configFile)) {
			log.debug("Reading settings from {}", configFile);
			apply(parse(readConfigFile(configFile)), config);
		}
		apply(parse(args), config);

		log.debug("Using {}", config);
		return config;
	}

	private CommandLine parse(String[] args) throws ParseException {
		CommandLineParser parser = new DefaultParser();
		CommandLine cmdline = parser.parse(options, args);
		if (!cmdline.getArgList().isEmpty())
			throw new ParseException("Unexpected arguments: " + cmdline.getArgList());
		return cmdline;
	}

	private String[] readConfigFile(Path configFile) throws IOException {
		List<String> tokens = new ArrayList<>();
		for (String line : FileUtils.readLines(configFile.toFile(), StandardCharsets.UTF_8)) {
			String trimmed = line.trim();
			if (trimmed.isEmpty() || trimmed.startsWith("#"))
				continue;
			String[] split = trimmed.split("\\s+", 2);
			int eq = split[0].indexOf('=');
			if (split[0].startsWith("--") && eq > 0)
				tokens.add(trimmed);
			else
				tokens.addAll(Arrays.asList(split));
		}
		return tokens.toArray(new String[0]);
	}

	private void apply(CommandLine cmdline, LintConfiguration config) throws ParseException {
		if (cmdline.hasOption("help"))
			config.setHelpRequested(true);
		if (cmdline.hasOption("path"))
			config.setPath(cmdline.getOptionValue("path"));
		if (cmdline.hasOption("subject-regex"))
			config.setSubjectRegex(cmdline.getOptionValue("subject-regex"));
		if (cmdline.hasOption("subject-maxlen"))
			config.setSubjectMaxLength(intValue(cmdline, "subject-maxlen"));
		if (cmdline.hasOption("subject-minlen"))
			config.setSubjectMinLength(intValue(cmdline, "subject-minlen"));
		if (cmdline.hasOption("body-regex"))
			config.setBodyRegex(cmdline.getOptionValue("body-regex"));
		if (cmdline.hasOption("body-maxlen"))
			config.setBodyMaxLength(intValue(cmdline, "body-maxlen"));
		if (cmdline.hasOption("since"))
			config.setSince(cmdline.getOptionValue("since"));
		if (cmdline.hasOption("msg-file"))
			config.setMsgFile(cmdline.getOptionValue("msg-file"));
		if (cmdline.hasOption("max-parents"))
			config.setMaxParents(intValue(cmdline, "max-parents"));
		if (cmdline.hasOption("excl-author-names"))
			config.setExcludedAuthorNames(Arrays.asList(cmdline.getOptionValues("excl-author-names")));
		if (cmdline.hasOption("excl-author-emails"))
			config.setExcludedAuthorEmails(Arrays.asList(cmdline.getOptionValues("excl-author-emails")));
	}

	private int intValue(CommandLine cmdline, String option) throws ParseException {
		String value = cmdline.getOptionValue(option);
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new ParseException("--" + option + " expects a number, got [" + value + "]");
		}
	}

	private static Options setupOptions() {
		Options options = new Options();
		options.addOption("h", "help", false, "print this message");
		options.addOption(null, "path", true, "Path to the git repository (default: .)");
		options.addOption(null, "subject-regex", true, "Commit subject line must conform to this regular expression (default: .*)");
		options.addOption(null, "subject-maxlen", true, "Max length for commit subject line (default: unlimited)");
		options.addOption(null, "subject-minlen", true, "Min length for commit subject line (default: 0)");
		options.addOption(null, "body-regex", true, "Commit message body must conform to this regular expression (default: .*)");
		options.addOption(null, "body-maxlen", true, "Max length for commit body (default: unlimited)");
		options.addOption(null, "since", true, "A date in \"yyyy-MM-dd\" format starting from which commits will be analyzed (default: 1970-01-01)");
		options.addOption(null, "msg-file", true, "Only analyze the commit message found in this file");
		options.addOption(null, "max-parents", true, "Max number of parents a commit can have in order to be analyzed (default: 1)");
		options.addOption(Option.builder().longOpt("excl-author-names").hasArg().argName("regex")
				.desc("Don't lint commits with authors whose names match this regular expression (repeatable)")
				.build());
		options.addOption(Option.builder().longOpt("excl-author-emails").hasArg().argName("regex")
				.desc("Don't lint commits with authors whose emails match this regular expression (repeatable)")
				.build());
		options.getOption("path").setArgName("dir");
		options.getOption("msg-file").setArgName("file");
		options.getOption("since").setArgName("yyyy-MM-dd");
		return options;
	}

}
