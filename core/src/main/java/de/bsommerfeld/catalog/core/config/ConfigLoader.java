package de.bsommerfeld.catalog.core.config;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link CatalogConfig} from a TOML file. A missing file is created with
 * the defaults so the user has something to edit on the next start.
 *
 * <p>
 * Unknown keys are ignored, missing keys keep their field defaults.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final TomlMapper MAPPER = new TomlMapper();

    private ConfigLoader() {
    }

    /**
     * @param configPath location of {@code config.toml}
     * @return the parsed configuration, or defaults if the file did not exist
     * @throws IllegalStateException if the file exists but cannot be read or
     *                               parsed, or the defaults cannot be written
     */
    public static CatalogConfig load(Path configPath) {
        if (Files.exists(configPath)) {
            try {
                CatalogConfig config = MAPPER.readValue(configPath.toFile(), CatalogConfig.class);
                LOG.info("Loaded configuration from {}", configPath.toAbsolutePath());
                return config;
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read configuration: " + configPath, e);
            }
        }

        CatalogConfig defaults = new CatalogConfig();
        try {
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(configPath.toFile(), defaults);
            LOG.info("Wrote default configuration to {}", configPath.toAbsolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write default configuration: " + configPath, e);
        }
        return defaults;
    }
}
