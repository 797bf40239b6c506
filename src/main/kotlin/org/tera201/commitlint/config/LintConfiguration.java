package org.tera201.commitlint.config;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of one lint run. The defaults check nothing and keep every
 * non-merge commit.
 */
@Getter
@Setter
@ToString
public class LintConfiguration {

	private String path = ".";
	private String subjectRegex = ".*";
	private int subjectMaxLength = Integer.MAX_VALUE;
	private int subjectMinLength = 0;
	private String bodyRegex = ".*";
	private int bodyMaxLength = Integer.MAX_VALUE;
	private String since = "1970-01-01";
	/* Lint this message file instead of the repository history. */
	private String msgFile = null;
	private int maxParents = 1;
	private List<String> excludedAuthorNames = new ArrayList<>();
	private List<String> excludedAuthorEmails = new ArrayList<>();
	private boolean helpRequested = false;

}
