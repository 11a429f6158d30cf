package de.bsommerfeld.gamesync.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Loads a TOML configuration file into a POJO, creating the file from the
 * POJO's defaults when it does not exist yet.
 *
 * <pre>{@code
 * SyncConfig config = ConfigLoader.from(appDir.resolve("config.toml"))
 *         .load(SyncConfig.class, SyncConfig::new);
 * }</pre>
 *
 * <p>
 * Unknown keys are ignored so that older launchers can read configuration
 * written by newer ones. A file that exists but cannot be parsed is an
 * error: silently replacing a user's broken file with defaults would lose
 * their settings.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path file;
    private final TomlMapper mapper;

    private ConfigLoader(Path file) {
        this.file = file;
        this.mapper = new TomlMapper();
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static ConfigLoader from(Path file) {
        return new ConfigLoader(file);
    }

    /**
     * Reads the file, or writes {@code defaults} to it first if it is absent.
     *
     * @throws IOException if the file exists but is unreadable or malformed,
     *                     or if the defaults cannot be written
     */
    public <T> T load(Class<T> type, Supplier<T> defaults) throws IOException {
        if (!Files.exists(file)) {
            T fresh = defaults.get();
            save(fresh);
            LOG.info("Created default configuration at {}", file.toAbsolutePath());
            return fresh;
        }

        LOG.debug("Reading configuration from {}", file.toAbsolutePath());
        return mapper.readValue(file.toFile(), type);
    }

    /** Writes the given configuration, creating parent directories as needed. */
    public void save(Object config) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(file.toFile(), config);
    }
}
