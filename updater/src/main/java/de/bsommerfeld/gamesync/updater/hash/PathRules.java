package de.bsommerfeld.gamesync.updater.hash;

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A set of regular expressions matched against forward-slash relative paths.
 * A path matches if any expression is found anywhere in it, so anchors
 * ({@code ^saves/}, {@code \.jar$}) must be written explicitly.
 */
public final class PathRules {

    private static final PathRules NONE = new PathRules(List.of());

    private final List<Pattern> patterns;

    private PathRules(List<Pattern> patterns) {
        this.patterns = patterns;
    }

    public static PathRules none() {
        return NONE;
    }

    /**
     * @throws java.util.regex.PatternSyntaxException for an invalid expression
     */
    public static PathRules of(Collection<String> expressions) {
        if (expressions == null || expressions.isEmpty())
            return NONE;
        return new PathRules(expressions.stream().map(Pattern::compile).toList());
    }

    public static PathRules of(String... expressions) {
        return of(List.of(expressions));
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    public boolean matches(String relativePath) {
        for (Pattern p : patterns) {
            if (p.matcher(relativePath).find())
                return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return patterns.toString();
    }
}
