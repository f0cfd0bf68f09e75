package com.faastrace.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the record store.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "faas.storage")
public class StorageConfig {

    /**
     * Store implementation: {@code filesystem} or {@code memory}.
     */
    private String type = "filesystem";

    /**
     * Filesystem store settings.
     */
    private FileSystemConfig filesystem = new FileSystemConfig();

    @Getter
    @Setter
    public static class FileSystemConfig {

        /**
         * Directory holding the record, trace and profile folders.
         */
        private String baseDir = "./faas-trace-data";
    }
}
