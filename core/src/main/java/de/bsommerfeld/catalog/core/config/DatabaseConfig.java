package de.bsommerfeld.catalog.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code [database]} section of {@code config.toml}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatabaseConfig {

    /** SQLite file name, resolved against the application data directory. */
    @JsonProperty("file")
    private String file = "catalog.db";

    public String getFile() {
        return file;
    }

    /**
     * @throws IllegalArgumentException for a {@code null} or blank name, which
     *                                  would otherwise resolve to the data
     *                                  directory itself
     */
    public void setFile(String file) {
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException("database.file must name a file");
        }
        this.file = file.trim();
    }
}
