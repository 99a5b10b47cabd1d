package com.g11macro.manager.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "g11.macro")
@Validated
public record MacroConfigProperties(
    @NotBlank
    String configDirectory,

    @NotBlank
    String bindingsFile,

    @NotBlank
    String recordingsFile
) {

    public static final String DAEMON_DIRECTORY = "g11-macro-daemon";

    public MacroConfigProperties {
        if (configDirectory == null || configDirectory.isBlank()) {
            configDirectory = defaultConfigDirectory();
        }
        if (bindingsFile == null) {
            bindingsFile = "key_bindings.ron";
        }
        if (recordingsFile == null) {
            recordingsFile = "key_recordings.ron";
        }
    }

    public Path bindingsPath() {
        return Path.of(configDirectory, bindingsFile);
    }

    public Path recordingsPath() {
        return Path.of(configDirectory, recordingsFile);
    }

    private static String defaultConfigDirectory() {
        String xdgConfig = System.getenv("XDG_CONFIG_HOME");
        Path base = xdgConfig != null && !xdgConfig.isBlank()
            ? Path.of(xdgConfig)
            : Path.of(System.getProperty("user.home"), ".config");
        return base.resolve(DAEMON_DIRECTORY).toString();
    }
}
