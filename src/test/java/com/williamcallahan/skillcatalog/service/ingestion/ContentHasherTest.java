package com.williamcallahan.skillcatalog.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import com.williamcallahan.skillcatalog.domain.ContentFingerprint;
import com.williamcallahan.skillcatalog.domain.HashType;
import com.williamcallahan.skillcatalog.domain.ingestion.SkillFile;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies content fingerprints and whitespace normalization.
 */
class ContentHasherTest {

    private final ContentHasher hasher = new ContentHasher();

    @Test
    void sha256MatchesKnownDigest() {
        assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824", hasher.sha256("hello"));
    }

    @Test
    void reformattedCopiesShareNormalizedHashOnly() {
        String original = "# Skill\n\nDo the thing.\n";
        String reformatted = "  # Skill   \r\n\r\n\r\n\r\n    Do the thing.\r\n";

        List<ContentFingerprint> first = hasher.fingerprints("a", original);
        List<ContentFingerprint> second = hasher.fingerprints("b", reformatted);

        assertEquals(hash(first, HashType.NORMALIZED), hash(second, HashType.NORMALIZED));
        assertNotEquals(hash(first, HashType.FULL), hash(second, HashType.FULL));
    }

    @Test
    void contentHashIgnoresBinaryFilesAndListOrder() {
        SkillFile marker = new SkillFile("SKILL.md", 10, "content");
        SkillFile script = new SkillFile("scripts/run.sh", 5, "echo");
        SkillFile image = new SkillFile("logo.png", 2048, null);

        assertEquals(
                hasher.contentHash(List.of(marker, script)),
                hasher.contentHash(List.of(image, script, marker)));
        assertNotEquals(
                hasher.contentHash(List.of(marker, script)),
                hasher.contentHash(List.of(marker, new SkillFile("scripts/run.sh", 5, "echo twice"))));
    }

    private static String hash(List<ContentFingerprint> fingerprints, HashType hashType) {
        return fingerprints.stream()
                .filter(fingerprint -> fingerprint.hashType() == hashType)
                .findFirst()
                .orElseThrow()
                .hashValue();
    }
}
