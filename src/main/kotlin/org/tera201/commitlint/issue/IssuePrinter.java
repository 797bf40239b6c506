package org.tera201.commitlint.issue;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes issues as {@code <short id>: <description><separator>}, one after the
 * other. The separator also follows the last issue. Write errors a
 * {@link PrintStream} only records are reported as {@link IOException}.
 */
public class IssuePrinter {

	private final String separator;
	private final OutputStream out;

	public IssuePrinter(String separator, OutputStream out) {
		this.separator = separator;
		this.out = out;
	}

	public void print(List<Issue> issues) throws IOException {
		for (Issue issue : issues) {
			String line = issue.getCommit().getShortId() + ": " + issue.getDesc() + separator;
			out.write(line.getBytes(StandardCharsets.UTF_8));
		}
		out.flush();
		if (out instanceof PrintStream && ((PrintStream) out).checkError())
			throw new IOException("could not write report");
	}

}
