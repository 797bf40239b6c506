package org.tera201.commitlint.filter.commit;

import org.junit.jupiter.api.Test;
import org.tera201.commitlint.filter.InvalidFilterException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.tera201.commitlint.CommitFixtures.commit;

class NotAuthoredByTest {

    @Test
    void testNamesMatchingAnyPatternAreDropped() throws InvalidFilterException {
        NotAuthoredByNames filter = new NotAuthoredByNames(List.of("^dependabot", "Bot$"));

        assertFalse(filter.accept(commit("1234567", "dependabot[bot]", "bot@github.com")));
        assertFalse(filter.accept(commit("1234567", "Release Bot", "release@example.com")));
        assertTrue(filter.accept(commit("1234567", "Jane Doe", "jane@example.com")));
    }

    @Test
    void testPatternIsSearchedNotFullyMatched() throws InvalidFilterException {
        NotAuthoredByNames filter = new NotAuthoredByNames(List.of("Doe"));

        assertFalse(filter.accept(commit("1234567", "Jane Doe Smith", "jane@example.com")));
    }

    @Test
    void testEmailsMatchingAnyPatternAreDropped() throws InvalidFilterException {
        NotAuthoredByEmails filter = new NotAuthoredByEmails(List.of("@users\\.noreply\\.github\\.com$"));

        assertFalse(filter.accept(commit("1234567", "Jane Doe", "jane@users.noreply.github.com")));
        assertTrue(filter.accept(commit("1234567", "Jane Doe", "jane@example.com")));
    }

    @Test
    void testNameFilterIgnoresEmail() throws InvalidFilterException {
        NotAuthoredByNames filter = new NotAuthoredByNames(List.of("example"));

        assertTrue(filter.accept(commit("1234567", "Jane Doe", "jane@example.com")));
    }

    @Test
    void testNoPatternsKeepEverything() throws InvalidFilterException {
        assertTrue(new NotAuthoredByNames(List.of()).accept(commit("1234567")));
        assertTrue(new NotAuthoredByEmails(List.of()).accept(commit("1234567")));
    }

    @Test
    void testMalformedPatternIsRejected() {
        InvalidFilterException e = assertThrows(InvalidFilterException.class,
                () -> new NotAuthoredByNames(List.of("ok", "([unclosed")));
        assertTrue(e.getMessage().contains("([unclosed"));
        assertThrows(InvalidFilterException.class, () -> new NotAuthoredByEmails(List.of("*bad")));
    }

}
