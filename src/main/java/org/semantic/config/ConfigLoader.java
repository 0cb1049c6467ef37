package org.semantic.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Locates and composes the HOCON configuration of the evaluation engine.
 * <p>
 * Layers, highest precedence first: JVM system properties, environment variables, the user file
 * (if one is found), and the {@code reference.conf} shipped with the engine. The user file is the
 * first of:
 * <ol>
 *   <li>the file passed by the caller,</li>
 *   <li>the file named by {@code -Dconfig.file},</li>
 *   <li>{@code config/semantic.conf} below the working directory.</li>
 * </ol>
 * Substitutions are resolved after all layers are stacked, so an override of a referenced value
 * reaches every key that refers to it.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "semantic.conf";
    static final String EVALUATOR_BLOCK = "evaluator";

    private ConfigLoader() {
    }

    /**
     * Loads the {@code evaluator} block, ready for {@link EvaluatorSettings#fromConfig} and
     * {@link org.semantic.analysis.AnalysisStackBuilder#build}.
     *
     * @param explicitFile File chosen by the caller, or {@code null} to search for one.
     * @param workingDir   Directory searched for {@code config/semantic.conf}.
     * @return The resolved {@code evaluator} block.
     * @throws IllegalArgumentException            if a named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config loadEvaluatorConfig(Path explicitFile, Path workingDir) {
        return resolve(explicitFile, workingDir).getConfig(EVALUATOR_BLOCK);
    }

    /**
     * Composes the full configuration tree.
     *
     * @param explicitFile File chosen by the caller, or {@code null} to search for one.
     * @param workingDir   Directory searched for {@code config/semantic.conf}.
     * @return The resolved configuration.
     */
    public static Config resolve(Path explicitFile, Path workingDir) {
        Optional<Path> userFile = locate(explicitFile, workingDir);
        if (userFile.isPresent()) {
            LOG.info("Evaluator configuration read from {}", userFile.get().toAbsolutePath());
        } else {
            LOG.debug("No {}/{} below {}, using engine defaults", CONFIG_DIR, CONFIG_FILE_NAME, workingDir.toAbsolutePath());
        }
        Config user = userFile.map(path -> ConfigFactory.parseFile(path.toFile())).orElseGet(ConfigFactory::empty);
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(user)
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    static Optional<Path> locate(Path explicitFile, Path workingDir) {
        if (explicitFile != null) {
            return Optional.of(existing(explicitFile, "Configuration file not found: "));
        }
        String property = System.getProperty("config.file");
        if (property != null && !property.isBlank()) {
            return Optional.of(existing(Path.of(property), "Configuration file named by -Dconfig.file not found: "));
        }
        Path discovered = workingDir.resolve(CONFIG_DIR).resolve(CONFIG_FILE_NAME);
        return Files.isRegularFile(discovered) ? Optional.of(discovered) : Optional.empty();
    }

    private static Path existing(Path file, String message) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException(message + file.toAbsolutePath());
        }
        return file;
    }
}
