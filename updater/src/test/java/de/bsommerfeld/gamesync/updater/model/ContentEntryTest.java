package de.bsommerfeld.gamesync.updater.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.TreeMap;

import static de.bsommerfeld.gamesync.updater.TestTrees.dir;
import static de.bsommerfeld.gamesync.updater.TestTrees.file;
import static de.bsommerfeld.gamesync.updater.TestTrees.root;
import static org.junit.jupiter.api.Assertions.*;

class ContentEntryTest {

    private static final String HASH = "a".repeat(64);

    // -- FileEntry --

    @Test
    void fileEntry_shouldNormalizeHashToLowercase() {
        FileEntry entry = new FileEntry("a.txt", 3, "A".repeat(64));
        assertEquals(HASH, entry.contentHash());
    }

    @Test
    void fileEntry_shouldRejectParentSegment() {
        assertThrows(PathEscapeException.class, () -> new FileEntry("../evil.sh", 1, HASH));
        assertThrows(PathEscapeException.class, () -> new FileEntry("lib/../../evil.sh", 1, HASH));
    }

    @Test
    void fileEntry_shouldRejectAbsolutePath() {
        assertThrows(PathEscapeException.class, () -> new FileEntry("/etc/passwd", 1, HASH));
    }

    @Test
    void fileEntry_shouldRejectEmptyPath() {
        assertThrows(PathEscapeException.class, () -> new FileEntry("", 1, HASH));
    }

    @Test
    void fileEntry_shouldRejectMalformedHash() {
        assertThrows(IllegalArgumentException.class, () -> new FileEntry("a", 1, "xyz"));
        assertThrows(IllegalArgumentException.class, () -> new FileEntry("a", 1, "g".repeat(64)));
    }

    @Test
    void fileEntry_shouldRejectNegativeSize() {
        assertThrows(IllegalArgumentException.class, () -> new FileEntry("a", -1, HASH));
    }

    @Test
    void name_shouldReturnLastSegment() {
        assertEquals("core.jar", new FileEntry("lib/core.jar", 1, HASH).name());
    }

    // -- DirEntry --

    @Test
    void dirEntry_shouldSortChildrenByName() {
        DirEntry dir = root(file("c", "3"), file("a", "1"), file("b", "2"));
        assertEquals(List.of("a", "b", "c"), List.copyOf(dir.children().keySet()));
    }

    @Test
    void dirEntry_shouldRejectChildWithWrongPath() {
        TreeMap<String, ContentEntry> children = new TreeMap<>();
        children.put("a", new FileEntry("elsewhere/a", 1, HASH));
        assertThrows(PathEscapeException.class, () -> new DirEntry("", children));
    }

    @Test
    void dirEntry_shouldRejectTraversalKey() {
        TreeMap<String, ContentEntry> children = new TreeMap<>();
        children.put("..", new FileEntry("a", 1, HASH));
        assertThrows(PathEscapeException.class, () -> new DirEntry("", children));
    }

    @Test
    void dirEntry_shouldBeImmutable() {
        DirEntry dir = root(file("a", "1"));
        assertThrows(UnsupportedOperationException.class, () -> dir.children().clear());
    }

    @Test
    void files_shouldListAllFilesInPreOrder() {
        DirEntry tree = root(
                file("z.txt", "z"),
                dir("lib", file("lib/a.jar", "a"), dir("lib/native", file("lib/native/x.so", "x"))),
                file("b.txt", "b"));

        assertEquals(List.of("b.txt", "lib/a.jar", "lib/native/x.so", "z.txt"),
                tree.files().stream().map(FileEntry::relativePath).toList());
    }

    // -- Manifest / plan --

    @Test
    void manifest_shouldRequireRootAtEmptyPath() {
        DirEntry nested = dir("lib");
        assertThrows(IllegalArgumentException.class,
                () -> new Manifest(nested, Instant.now(), ContentScope.CLIENT));
    }

    @Test
    void contentScope_shouldRoundTripWireNames() {
        for (ContentScope scope : ContentScope.values()) {
            assertEquals(scope, ContentScope.fromWireName(scope.wireName()));
        }
        assertThrows(IllegalArgumentException.class, () -> ContentScope.fromWireName("mods"));
    }

    @Test
    void syncPlan_shouldSumBytesAndChanges() {
        SyncPlan plan = new SyncPlan(
                List.of(file("a", "1234"), file("b", "12")),
                List.of(file("c", "x")),
                List.of("d"));

        assertEquals(6, plan.bytesToFetch());
        assertEquals(3, plan.totalChanges());
        assertFalse(plan.isEmpty());
        assertTrue(SyncPlan.empty().isEmpty());
    }

    @Test
    void signedManifest_shouldCopyBytes() {
        byte[] bytes = {1, 2, 3};
        SignedManifest signed = new SignedManifest(bytes, "ab");
        bytes[0] = 9;
        assertEquals(1, signed.manifestBytes()[0]);
        assertEquals(new SignedManifest(new byte[]{1, 2, 3}, "ab"), signed);
    }
}
