package org.tera201.commitlint.filter.range;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tera201.commitlint.domain.Commit;
import org.tera201.commitlint.scm.exceptions.RepositoryException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SingleMessageTest {

    @TempDir
    Path tempDir;

    @Test
    void testBuildsOneCommitFromMessage() throws RepositoryException {
        List<Commit> commits = SingleMessage.fromText("Add feature\n\nWith a body").get();

        assertEquals(1, commits.size());
        Commit c = commits.get(0);
        assertEquals(SingleMessage.PLACEHOLDER_HASH, c.getHash());
        assertEquals("fakehsh", c.getShortId());
        assertEquals("Add feature", c.getSubject());
        assertEquals("With a body", c.getBody());
        assertEquals(0, c.getNumParents());
        assertNotNull(c.getDate());
    }

    @Test
    void testReadsMessageFile() throws IOException, RepositoryException {
        Path msg = tempDir.resolve("COMMIT_EDITMSG");
        Files.writeString(msg, "Subject from file\n", StandardCharsets.UTF_8);

        CommitRange range = SingleMessage.fromFile(msg);

        assertEquals("Subject from file", range.get().get(0).getSubject());
        assertEquals("Subject from file", range.get().get(0).getSubject());
    }

    @Test
    void testMissingMessageFileFails() {
        CommitRange range = SingleMessage.fromFile(tempDir.resolve("missing"));

        assertThrows(RepositoryException.class, range::get);
    }

    @Test
    void testReadFailureFails() {
        CommitRange range = new SingleMessage(() -> {
            throw new IOException("broken pipe");
        });

        RepositoryException e = assertThrows(RepositoryException.class, range::get);
        assertEquals("broken pipe", e.getCause().getMessage());
    }

}
