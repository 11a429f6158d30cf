/**
 * Command line launcher around the update engine.
 *
 * <h2>Class responsibilities</h2>
 *
 * <pre>
 * LauncherMain     entry point, parses the command and runs it
 * AppModule        Guice wiring of configuration, event bus and engine
 * StorageResolver  layout of the writable data directory, one install root per scope
 * SyncReporter     event bus observer printing sync progress
 * LaunchSpec       java command line built from a synchronized client directory
 * GameProcess      runs the game JVM and captures its output
 * </pre>
 *
 * <h2>Startup</h2>
 * {@code LOG_DIR} is set before any logger exists so the file appender
 * writes into the data directory's {@code logs/}. Configuration is read
 * from {@code config.toml} there and created with defaults on first start.
 */
package de.bsommerfeld.gamesync.launcher;
