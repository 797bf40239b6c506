package org.tera201.commitlint.filter.range;

import org.apache.commons.io.IOUtils;
import org.apache.commons.io.function.IOSupplier;
import org.tera201.commitlint.domain.Commit;
import org.tera201.commitlint.domain.Developer;
import org.tera201.commitlint.scm.exceptions.RepositoryException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.List;

/**
 * A single commit built from a message that has not been committed yet, such
 * as the file handed to a commit-msg hook. The commit carries a placeholder
 * hash and the current time.
 */
public class SingleMessage implements CommitRange {

	public static final String PLACEHOLDER_HASH = "fakehsh";

	private final IOSupplier<InputStream> message;

	public SingleMessage(IOSupplier<InputStream> message) {
		this.message = message;
	}

	public static SingleMessage fromFile(Path file) {
		return new SingleMessage(() -> Files.newInputStream(file));
	}

	public static SingleMessage fromText(String text) {
		return new SingleMessage(() -> IOUtils.toInputStream(text, StandardCharsets.UTF_8));
	}

	@Override
	public List<Commit> get() throws RepositoryException {
		String text;
		try (InputStream in = message.get()) {
			text = IOUtils.toString(in, StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new RepositoryException("could not read commit message", e);
		}

		return Collections.singletonList(
				new Commit(PLACEHOLDER_HASH, text, ZonedDateTime.now(), 0, new Developer("", "")));
	}

}
