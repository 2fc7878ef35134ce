package com.eainde.literature.config;

import com.eainde.literature.exception.PipelineConfigurationException;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Locates user-overridable config files (record schema, prompts).
 *
 * <p>Lookup order:</p>
 * <ol>
 *   <li>explicit path, which must exist</li>
 *   <li>{@code <configDirectory>/<name>}</li>
 *   <li>{@code ./literature_<name>} in the working directory</li>
 *   <li>bundled classpath default</li>
 * </ol>
 */
@Log4j2
@Component
public class ConfigFileResolver {

    static final String WORKING_DIR_PREFIX = "literature_";

    private final Path configDirectory;
    private final Path workingDirectory;

    @Autowired
    public ConfigFileResolver(PipelineProperties properties) {
        this(Paths.get(properties.getConfigDirectory()), Paths.get("").toAbsolutePath());
    }

    ConfigFileResolver(Path configDirectory, Path workingDirectory) {
        this.configDirectory = workingDirectory.resolve(configDirectory);
        this.workingDirectory = workingDirectory;
    }

    /**
     * Reads the first config file found in priority order.
     *
     * @param explicitPath      user-supplied path, may be null
     * @param fileName          file name looked up in the override locations
     * @param classpathLocation bundled default
     * @return file content
     */
    public String read(String explicitPath, String fileName, String classpathLocation) {
        if (explicitPath != null && !explicitPath.isBlank()) {
            Path path = workingDirectory.resolve(explicitPath);
            if (!Files.isRegularFile(path)) {
                throw new PipelineConfigurationException("Config file not found: " + path);
            }
            return readFile(path);
        }

        Path projectFile = configDirectory.resolve(fileName);
        if (Files.isRegularFile(projectFile)) {
            log.debug("Using project config file {}", projectFile);
            return readFile(projectFile);
        }

        Path prefixed = workingDirectory.resolve(WORKING_DIR_PREFIX + fileName);
        if (Files.isRegularFile(prefixed)) {
            log.debug("Using working-directory config file {}", prefixed);
            return readFile(prefixed);
        }

        ClassPathResource resource = new ClassPathResource(classpathLocation);
        if (!resource.exists()) {
            throw new PipelineConfigurationException(
                    "No config file '" + fileName + "' found and no bundled default at " + classpathLocation);
        }
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PipelineConfigurationException("Failed to read bundled config " + classpathLocation, e);
        }
    }

    private static String readFile(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PipelineConfigurationException("Failed to read config file " + path, e);
        }
    }
}
