package org.tera201.commitlint.scm;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.MergeCommand;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.revwalk.RevCommit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tera201.commitlint.domain.Commit;
import org.tera201.commitlint.filter.commit.WithMaxParents;
import org.tera201.commitlint.filter.range.AllCommits;
import org.tera201.commitlint.scm.exceptions.RepositoryException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GitRepositoryTest {

    @TempDir
    Path tempDir;

    private Path projectRoot;
    private RevCommit first;
    private RevCommit second;

    @BeforeEach
    void setUp() throws Exception {
        projectRoot = tempDir.resolve("testRepo");
        Files.createDirectories(projectRoot);

        try (Git git = Git.init().setDirectory(projectRoot.toFile()).call()) {
            first = commitFile(git, "README.md", "Initial commit",
                    new PersonIdent("Test User", "test@example.com", Instant.parse("2019-01-01T10:00:00Z"), ZoneId.of("UTC")));
            second = commitFile(git, "NOTES.md", "Add notes\n\nSome background.\n",
                    new PersonIdent("Other User", "other@example.com", Instant.parse("2019-02-01T10:00:00Z"), ZoneId.of("Europe/Berlin")));
        }
    }

    private static RevCommit commitFile(Git git, String name, String message, PersonIdent author) throws Exception {
        Path file = git.getRepository().getWorkTree().toPath().resolve(name);
        Files.writeString(file, message);
        git.add().addFilepattern(name).call();
        return git.commit().setMessage(message).setAuthor(author).setCommitter(author).setSign(false).call();
    }

    @Test
    void testCommitsAreReadFromHeadNewestFirst() throws RepositoryException {
        List<Commit> commits = new GitRepository(projectRoot.toString()).getCommits();

        assertEquals(2, commits.size());
        Commit newest = commits.get(0);
        assertEquals(second.getName(), newest.getHash());
        assertEquals(40, newest.getHash().length());
        assertEquals("Add notes\n\nSome background.\n", newest.getMessage());
        assertEquals("Add notes", newest.getSubject());
        assertEquals("Other User", newest.getAuthor().getName());
        assertEquals("other@example.com", newest.getAuthor().getEmail());
        assertEquals(Instant.parse("2019-02-01T10:00:00Z"), newest.getDate().toInstant());
        assertEquals(1, newest.getNumParents());

        Commit root = commits.get(1);
        assertEquals(first.getName(), root.getHash());
        assertEquals(0, root.getNumParents());
    }

    @Test
    void testHeadIsMostRecentCommit() throws RepositoryException {
        assertEquals(second.getName(), new GitRepository(projectRoot.toString()).getHead().getHash());
    }

    @Test
    void testMergeCommitCountsBothParents() throws Exception {
        try (Git git = Git.open(projectRoot.toFile())) {
            String main = git.getRepository().getBranch();
            git.branchCreate().setName("feature").call();
            git.checkout().setName("feature").call();
            commitFile(git, "feature.txt", "Feature work", new PersonIdent("Test User", "test@example.com"));
            git.checkout().setName(main).call();
            commitFile(git, "main.txt", "Main work", new PersonIdent("Test User", "test@example.com"));
            Ref feature = git.getRepository().findRef("feature");
            git.merge().include(feature)
                    .setFastForward(MergeCommand.FastForwardMode.NO_FF)
                    .setMessage("Merge feature")
                    .call();
        }

        AllCommits all = new AllCommits(new GitRepository(projectRoot.toString()));
        List<Commit> commits = all.get();
        assertEquals(5, commits.size());
        assertEquals(1, commits.stream().filter(c -> c.getNumParents() == 2).count());

        List<Commit> noMerges = all.filter(new WithMaxParents(1)).get();
        assertEquals(4, noMerges.size());
        assertTrue(noMerges.stream().allMatch(c -> c.getNumParents() < 2));
    }

    @Test
    void testEmptyRepositoryHasNoHead() throws Exception {
        Path empty = tempDir.resolve("empty");
        Git.init().setDirectory(empty.toFile()).call().close();

        GitRepository repo = new GitRepository(empty.toString());

        assertThrows(RepositoryException.class, repo::getCommits);
        assertThrows(RepositoryException.class, repo::getHead);
    }

    @Test
    void testNotARepository() throws Exception {
        Path plain = Files.createDirectories(tempDir.resolve("plain"));

        assertThrows(RepositoryException.class, () -> new GitRepository(plain.toString()).getCommits());
    }

}
