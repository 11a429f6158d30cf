package de.bsommerfeld.gamesync.updater.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class RelativePathsTest {

    @ParameterizedTest
    @ValueSource(strings = {"a", "lib/core.jar", "assets/objects/ab/abcdef", "name with spaces.txt", ".hidden", "a..b"})
    void validate_shouldAcceptSafePaths(String path) {
        assertEquals(path, RelativePaths.validate(path));
    }

    @Test
    void validate_shouldAcceptRootPath() {
        assertEquals("", RelativePaths.validate(""));
    }

    @ParameterizedTest
    @ValueSource(strings = {"..", "../x", "a/../../x", "a/..", "./a", "a/./b", "/etc/passwd", "\\x", "a\\..\\b",
            "C:", "C:/Windows", "a//b", "a/", "a\0b"})
    void validate_shouldRejectEscapingPaths(String path) {
        PathEscapeException e = assertThrows(PathEscapeException.class, () -> RelativePaths.validate(path));
        assertEquals(path, e.path());
    }

    @Test
    void validate_shouldRejectNull() {
        assertThrows(PathEscapeException.class, () -> RelativePaths.validate(null));
    }

    @Test
    void validateName_shouldRejectSeparators() {
        assertThrows(PathEscapeException.class, () -> RelativePaths.validateName("a/b"));
        assertThrows(PathEscapeException.class, () -> RelativePaths.validateName(""));
        assertEquals("a", RelativePaths.validateName("a"));
    }

    @Test
    void child_shouldJoinWithSlash() {
        assertEquals("a", RelativePaths.child("", "a"));
        assertEquals("a/b", RelativePaths.child("a", "b"));
    }

    @Test
    void nameAndParent_shouldSplitLastSegment() {
        assertEquals("c.jar", RelativePaths.name("a/b/c.jar"));
        assertEquals("a/b", RelativePaths.parent("a/b/c.jar"));
        assertEquals("", RelativePaths.parent("top"));
        assertEquals("top", RelativePaths.name("top"));
    }
}
