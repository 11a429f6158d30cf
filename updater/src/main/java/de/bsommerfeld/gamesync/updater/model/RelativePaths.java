package de.bsommerfeld.gamesync.updater.model;

/**
 * Validation and composition of the forward-slash relative paths used
 * throughout content trees. The root directory has the empty path.
 */
public final class RelativePaths {

    public static final String ROOT = "";
    private static final char SEPARATOR = '/';

    private RelativePaths() {
    }

    /**
     * Rejects any path that could address something outside its root.
     *
     * @return the same path, for use in constructor assignments
     * @throws PathEscapeException if the path is absolute, contains a
     *                             {@code .} or {@code ..} segment, an empty
     *                             segment, a backslash, or a NUL character
     */
    public static String validate(String path) {
        if (path == null)
            throw new PathEscapeException("null", "Path must not be null");
        if (path.isEmpty())
            return path;

        if (path.indexOf('\\') >= 0)
            throw new PathEscapeException(path, "Backslash in relative path");
        if (path.indexOf('\0') >= 0)
            throw new PathEscapeException(path, "NUL character in relative path");
        if (path.charAt(0) == SEPARATOR)
            throw new PathEscapeException(path, "Absolute path");
        if (hasDrivePrefix(path))
            throw new PathEscapeException(path, "Drive-qualified path");

        for (String segment : path.split("/", -1)) {
            if (segment.isEmpty())
                throw new PathEscapeException(path, "Empty path segment");
            if (segment.equals(".") || segment.equals(".."))
                throw new PathEscapeException(path, "Relative navigation segment");
        }
        return path;
    }

    /** Validates a single child name; names never contain a separator. */
    public static String validateName(String name) {
        if (name == null || name.isEmpty() || name.indexOf(SEPARATOR) >= 0)
            throw new PathEscapeException(String.valueOf(name), "Invalid entry name");
        validate(name);
        return name;
    }

    /** {@code parent/name}, or just {@code name} below the root. */
    public static String child(String parent, String name) {
        return parent.isEmpty() ? name : parent + SEPARATOR + name;
    }

    /** The last segment of a path; the root's name is empty. */
    public static String name(String path) {
        int idx = path.lastIndexOf(SEPARATOR);
        return idx < 0 ? path : path.substring(idx + 1);
    }

    /** The parent path, or {@link #ROOT} for top-level entries. */
    public static String parent(String path) {
        int idx = path.lastIndexOf(SEPARATOR);
        return idx < 0 ? ROOT : path.substring(0, idx);
    }

    private static boolean hasDrivePrefix(String path) {
        return path.length() >= 2 && path.charAt(1) == ':' && Character.isLetter(path.charAt(0));
    }
}
