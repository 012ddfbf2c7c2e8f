package com.williamcallahan.skillcatalog.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.skillcatalog.config.AppProperties;
import com.williamcallahan.skillcatalog.domain.RepositoryIdentity;
import com.williamcallahan.skillcatalog.domain.ingestion.RepositoryFile;
import com.williamcallahan.skillcatalog.service.github.RepositoryMetadataClient;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

/**
 * Verifies marker lookup order and the hidden-directory star allowance.
 */
class MarkerFileLocatorTest {

    private final RepositoryMetadataClient metadataClient = Mockito.mock(RepositoryMetadataClient.class);
    private final MarkerFileLocator locator = new MarkerFileLocator(metadataClient, new AppProperties());

    @Test
    void prefersUpperCaseMarkerAtRepositoryRoot() {
        RepositoryFile marker = new RepositoryFile("SKILL.md", "sha-1", 12, "# Notes");
        when(metadataClient.fetchFile("acme", "notes", "SKILL.md")).thenReturn(Optional.of(marker));

        Optional<RepositoryFile> located = locator.locate(RepositoryIdentity.of("acme", "notes"), 5);

        assertEquals(Optional.of(marker), located);
        verify(metadataClient, never()).fetchFile("acme", "notes", "skill.md");
    }

    @Test
    void fallsBackToLowerCaseMarkerUnderSubpath() {
        RepositoryFile marker = new RepositoryFile("skills/lint/skill.md", "sha-2", 9, "# Lint");
        when(metadataClient.fetchFile("acme", "tools", "skills/lint/skill.md")).thenReturn(Optional.of(marker));

        Optional<RepositoryFile> located = locator.locate(RepositoryIdentity.of("acme", "tools", "skills/lint"), 5);

        assertEquals("skill.md", MarkerFileLocator.markerFileName(located.orElseThrow()));
        verify(metadataClient).fetchFile("acme", "tools", "skills/lint/SKILL.md");
    }

    @Test
    void ignoresMarkerWithoutInlineContent() {
        when(metadataClient.fetchFile("acme", "notes", "SKILL.md"))
            .thenReturn(Optional.of(new RepositoryFile("SKILL.md", "sha-3", 4_000_000, null)));

        assertTrue(locator.locate(RepositoryIdentity.of("acme", "notes"), 5).isEmpty());
    }

    @Test
    void rejectsHiddenDirectorySkillBelowStarAllowance() {
        RepositoryIdentity hidden = RepositoryIdentity.of("acme", "dotfiles", ".claude/skills/notes");

        assertTrue(locator.locate(hidden, 999).isEmpty());
        verify(metadataClient, never()).fetchFile(anyString(), anyString(), anyString());
    }

    @Test
    void acceptsHiddenDirectorySkillAtStarAllowance() {
        RepositoryIdentity hidden = RepositoryIdentity.of("acme", "dotfiles", ".claude/skills/notes");
        RepositoryFile marker = new RepositoryFile(".claude/skills/notes/SKILL.md", "sha-4", 7, "# Notes");
        when(metadataClient.fetchFile("acme", "dotfiles", ".claude/skills/notes/SKILL.md"))
            .thenReturn(Optional.of(marker));

        assertEquals(Optional.of(marker), locator.locate(hidden, 1000));
    }
}
