package com.williamcallahan.skillcatalog.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.skillcatalog.domain.ingestion.SkillFrontmatter;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies tolerant front-matter parsing of marker files.
 */
class FrontmatterParserTest {

    private final FrontmatterParser parser = new FrontmatterParser();

    @Test
    void readsScalarsFoldedBlocksInlineListsAndNestedMetadata() {
        String content = """
            ---
            name: Commit Helper
            description: >
              Writes commit
              messages.
            category: git
            tags: [Git, automation]
            metadata:
              tags:
                - ignored
              category: testing
            ---
            # Commit Helper
            Body.
            """;

        SkillFrontmatter frontmatter = parser.parse(content);

        assertEquals("Commit Helper", frontmatter.name());
        assertEquals("Writes commit messages.", frontmatter.description());
        assertEquals(List.of("git"), frontmatter.declaredCategories());
        assertEquals(List.of("git", "automation"), frontmatter.declaredTags());
        assertEquals("testing", frontmatter.metadataCategory());
        assertEquals(List.of("ignored"), frontmatter.metadataTags());
    }

    @Test
    void fallsBackToNestedMetadataWhenTopLevelFieldsAreMissing() {
        String content = """
            ---
            name: "Quoted Name"
            metadata:
              category: Testing
              tags: a, b
            ---
            """;

        SkillFrontmatter frontmatter = parser.parse(content);

        assertEquals("Quoted Name", frontmatter.name());
        assertEquals(List.of("testing"), frontmatter.declaredCategories());
        assertEquals(List.of("a", "b"), frontmatter.declaredTags());
    }

    @Test
    void keepsLiteralBlockLineBreaksAndDashListCategories() {
        String content = """
            ---
            description: |
              line one
              line two
            categories:
              - Docker
              - ci-cd
            ---
            """;

        SkillFrontmatter frontmatter = parser.parse(content);

        assertEquals("line one\nline two", frontmatter.description());
        assertEquals(List.of("docker", "ci-cd"), frontmatter.declaredCategories());
    }

    @Test
    void missingBlockYieldsEmptyFrontmatter() {
        SkillFrontmatter frontmatter = parser.parse("# Just markdown\n\nNo front-matter here.");

        assertNull(frontmatter.name());
        assertTrue(frontmatter.declaredCategories().isEmpty());
        assertTrue(frontmatter.declaredTags().isEmpty());
    }

    @Test
    void headingSummaryUsesFirstHeadingAndFollowingParagraph() {
        String content = """
            ---
            name: ignored-for-heading
            ---

            # My Skill

            Does useful things
            across lines.

            ## Usage
            Not part of the summary.
            """;

        FrontmatterParser.HeadingSummary summary = parser.headingSummary(content).orElseThrow();

        assertEquals("My Skill", summary.title());
        assertEquals("Does useful things across lines.", summary.paragraph());
        assertTrue(parser.body(content).startsWith("\n# My Skill"));
    }
}
