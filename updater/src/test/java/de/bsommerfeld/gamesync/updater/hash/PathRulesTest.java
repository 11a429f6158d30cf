package de.bsommerfeld.gamesync.updater.hash;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.PatternSyntaxException;

import static org.junit.jupiter.api.Assertions.*;

class PathRulesTest {

    @Test
    void matches_shouldFindPatternAnywhereInPath() {
        PathRules rules = PathRules.of("natives");
        assertTrue(rules.matches("lib/natives/x.so"));
        assertFalse(rules.matches("lib/core.jar"));
    }

    @Test
    void matches_shouldHonorAnchors() {
        PathRules rules = PathRules.of("^saves/", "\\.jar$");
        assertTrue(rules.matches("saves/world1/level.dat"));
        assertFalse(rules.matches("backup/saves/level.dat"));
        assertTrue(rules.matches("lib/core.jar"));
        assertFalse(rules.matches("lib/core.jar.sha1"));
    }

    @Test
    void none_shouldMatchNothing() {
        assertTrue(PathRules.none().isEmpty());
        assertFalse(PathRules.none().matches("anything"));
        assertTrue(PathRules.of(List.of()).isEmpty());
        assertTrue(PathRules.of((List<String>) null).isEmpty());
    }

    @Test
    void of_shouldRejectInvalidExpression() {
        assertThrows(PatternSyntaxException.class, () -> PathRules.of("(unclosed"));
    }

    @Test
    void verificationPolicy_shouldFastCheckAllButFullHashRules() {
        VerificationPolicy policy = VerificationPolicy.fastCheckExcept(PathRules.of("\\.jar$"));

        assertEquals(HashMode.FULL, policy.modeFor("lib/core.jar"));
        assertEquals(HashMode.FAST, policy.modeFor("assets/sound.ogg"));
        assertNull(policy.placeholderFor("lib/core.jar", 10));
        assertEquals(HashUtil.sizePlaceholder(10), policy.placeholderFor("assets/sound.ogg", 10));
    }

    @Test
    void verificationPolicy_fullHashShouldNeverUsePlaceholders() {
        assertNull(VerificationPolicy.fullHash().placeholderFor("assets/sound.ogg", 10));
    }
}
