package de.bsommerfeld.gamesync.launcher;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Everything needed to start the game JVM.
 *
 * @param javaExecutable the {@code java} binary to run
 * @param jvmArgs        options placed before the class path
 * @param classPath      entries joined with the platform path separator
 * @param mainClass      fully qualified entry point
 * @param gameArgs       arguments passed to {@code main}
 * @param workingDir     directory the process starts in
 */
public record LaunchSpec(
        Path javaExecutable,
        List<String> jvmArgs,
        List<Path> classPath,
        String mainClass,
        List<String> gameArgs,
        Path workingDir) {

    public LaunchSpec {
        jvmArgs = List.copyOf(jvmArgs);
        classPath = List.copyOf(classPath);
        gameArgs = List.copyOf(gameArgs);
        if (mainClass == null || mainClass.isBlank())
            throw new IllegalArgumentException("mainClass must not be blank");
    }

    /**
     * Describes a launch from a synchronized client directory: every jar below it
     * goes on the class path in sorted order, and the runtime directory's
     * {@code bin/java} is used if the runtime has been synchronized.
     *
     * @throws IOException if the client directory holds no jars
     */
    public static LaunchSpec forInstall(Path clientRoot, Path runtimeRoot, List<String> jvmArgs, String mainClass,
            List<String> gameArgs) throws IOException {
        List<Path> jars;
        try (Stream<Path> files = Files.walk(clientRoot)) {
            jars = files.filter(p -> Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS))
                    .filter(p -> p.getFileName().toString().endsWith(".jar"))
                    .sorted()
                    .collect(Collectors.toList());
        }
        if (jars.isEmpty())
            throw new IOException("No jars in " + clientRoot + ", sync the client first");

        return new LaunchSpec(resolveJava(runtimeRoot), jvmArgs, jars, mainClass, gameArgs, clientRoot);
    }

    /** The full command line, starting with the java executable. */
    public List<String> command() {
        List<String> cmd = new ArrayList<>();
        cmd.add(javaExecutable.toString());
        cmd.addAll(jvmArgs);
        if (!classPath.isEmpty()) {
            cmd.add("-cp");
            cmd.add(classPath.stream().map(Path::toString).collect(Collectors.joining(File.pathSeparator)));
        }
        cmd.add(mainClass);
        cmd.addAll(gameArgs);
        return cmd;
    }

    /**
     * Prefers the synchronized runtime and falls back to the JVM running the
     * launcher.
     */
    static Path resolveJava(Path runtimeRoot) {
        String binary = isWindows() ? "java.exe" : "java";
        if (runtimeRoot != null) {
            Path bundled = runtimeRoot.resolve("bin").resolve(binary);
            if (Files.isExecutable(bundled))
                return bundled;
        }
        return Path.of(System.getProperty("java.home"), "bin", binary);
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase().contains("win");
    }
}
