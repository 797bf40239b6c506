package org.tera201.commitlint.scm;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tera201.commitlint.domain.Commit;
import org.tera201.commitlint.domain.Developer;
import org.tera201.commitlint.scm.exceptions.RepositoryException;

import java.io.File;
import java.io.IOException;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

public class GitRepository implements SCM {

	private static Logger log = LoggerFactory.getLogger(GitRepository.class);

	private final String path;

	public GitRepository(String path) {
		log.debug("Creating a GitRepository from path " + path);
		this.path = path;
	}

	private Git openRepository() throws RepositoryException {
		try {
			return Git.open(new File(path));
		} catch (IOException e) {
			throw new RepositoryException("Couldn't open git repository at " + path, e);
		}
	}

	private ObjectId resolveHead(Git git) throws RepositoryException {
		ObjectId head;
		try {
			head = git.getRepository().resolve(Constants.HEAD);
		} catch (IOException e) {
			throw new RepositoryException("error resolving HEAD in " + path, e);
		}
		if (head == null)
			throw new RepositoryException("no HEAD in " + path + ", is the repository empty?");
		return head;
	}

	@Override
	public Commit getHead() throws RepositoryException {
		try (Git git = openRepository(); RevWalk revWalk = new RevWalk(git.getRepository())) {
			RevCommit r = revWalk.parseCommit(resolveHead(git));
			return extractCommit(r);
		} catch (IOException e) {
			throw new RepositoryException("error in getHead() for " + path, e);
		}
	}

	@Override
	public List<Commit> getCommits() throws RepositoryException {
		try (Git git = openRepository()) {
			List<Commit> all = new ArrayList<>();
			for (RevCommit r : git.log().add(resolveHead(git)).call()) {
				all.add(extractCommit(r));
			}
			log.debug("Read {} commits from {}", all.size(), path);
			return all;
		} catch (IOException | GitAPIException e) {
			throw new RepositoryException("error walking history of " + path, e);
		}
	}

	private Commit extractCommit(RevCommit r) {
		PersonIdent author = r.getAuthorIdent();
		return new Commit(
				r.getName(),
				r.getFullMessage(),
				convertToDate(author),
				r.getParentCount(),
				new Developer(author.getName(), author.getEmailAddress()));
	}

	private ZonedDateTime convertToDate(PersonIdent ident) {
		return ident.getWhenAsInstant().atZone(ident.getZoneId());
	}

	@Override
	public String toString() {
		return "GitRepository [path=" + path + "]";
	}

}
