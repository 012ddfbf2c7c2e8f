package com.williamcallahan.skillcatalog.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies the filesystem blob store.
 */
class LocalBlobStoreTest {

    @TempDir
    Path root;

    private LocalBlobStore blobStore;

    @BeforeEach
    void setUp() throws IOException {
        blobStore = new LocalBlobStore(root.toString());
    }

    @Test
    void writesOverwritesAndDeletes() {
        blobStore.putText("skills/acme/notes/SKILL.md", "first");
        blobStore.putText("skills/acme/notes/SKILL.md", "second");

        assertEquals(Optional.of("second"), blobStore.getText("skills/acme/notes/SKILL.md"));
        assertTrue(blobStore.delete("skills/acme/notes/SKILL.md"));
        assertFalse(blobStore.delete("skills/acme/notes/SKILL.md"));
        assertTrue(blobStore.getText("skills/acme/notes/SKILL.md").isEmpty());
    }

    @Test
    void listsKeysUnderPrefix() {
        blobStore.putText("archive/2024/01/a.json", "{}");
        blobStore.putText("archive/2024/02/b.json", "{}");
        blobStore.putText("cache/top.json", "{}");

        assertEquals(List.of("archive/2024/01/a.json", "archive/2024/02/b.json"), blobStore.list("archive"));
        assertTrue(blobStore.list("missing").isEmpty());
    }

    @Test
    void rejectsKeysEscapingTheRoot() {
        assertThrows(IllegalArgumentException.class, () -> blobStore.putText("../outside.txt", "nope"));
        assertThrows(IllegalArgumentException.class, () -> blobStore.getText("/etc/passwd"));
    }
}
