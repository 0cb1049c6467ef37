package org.semantic.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.semantic.data.EmptyExportsPolicy;
import org.semantic.data.MergePolicy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for locating and layering the evaluator configuration.
 */
@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("config.file");
        System.clearProperty("evaluator.modules.merge-policy");
        ConfigFactory.invalidateCaches();
    }

    @Test
    void explicitFileOverridesEngineDefaults() throws IOException {
        Path file = Files.writeString(tempDir.resolve("custom.conf"), "evaluator.modules.merge-policy = LAST_WINS\n");

        Config evaluator = ConfigLoader.loadEvaluatorConfig(file, tempDir);

        assertThat(evaluator.getString("modules.merge-policy")).isEqualTo("LAST_WINS");
        assertThat(evaluator.getString("exports.empty-policy")).isEqualTo("EXPORT_ALL");
        assertThat(evaluator.getConfigList("analysis.layers")).isEmpty();
    }

    @Test
    void missingExplicitFileIsRejected() {
        Path missing = tempDir.resolve("missing.conf");

        assertThatThrownBy(() -> ConfigLoader.resolve(missing, tempDir))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing.conf");
    }

    @Test
    void discoversFileBelowWorkingDirectory() throws IOException {
        Path configDir = Files.createDirectories(tempDir.resolve(ConfigLoader.CONFIG_DIR));
        Path file = Files.writeString(configDir.resolve(ConfigLoader.CONFIG_FILE_NAME),
                "evaluator.exports.empty-policy = EXPORT_NONE\n");

        assertThat(ConfigLoader.locate(null, tempDir)).contains(file);
        assertThat(EvaluatorSettings.load(null, tempDir).emptyExportsPolicy()).isEqualTo(EmptyExportsPolicy.EXPORT_NONE);
    }

    @Test
    void systemPropertyFileWinsOverWorkingDirectory() throws IOException {
        Path configDir = Files.createDirectories(tempDir.resolve(ConfigLoader.CONFIG_DIR));
        Files.writeString(configDir.resolve(ConfigLoader.CONFIG_FILE_NAME), "evaluator.modules.merge-policy = FIRST_WINS\n");
        Path named = Files.writeString(tempDir.resolve("named.conf"), "evaluator.modules.merge-policy = LAST_WINS\n");
        System.setProperty("config.file", named.toString());

        assertThat(ConfigLoader.locate(null, tempDir)).contains(named);
        assertThat(EvaluatorSettings.load(null, tempDir).mergePolicy()).isEqualTo(MergePolicy.LAST_WINS);
    }

    @Test
    void systemPropertyOverridesFileValue() throws IOException {
        Path file = Files.writeString(tempDir.resolve("custom.conf"), "evaluator.modules.merge-policy = LAST_WINS\n");
        System.setProperty("evaluator.modules.merge-policy", "FIRST_WINS");
        ConfigFactory.invalidateCaches();

        assertThat(EvaluatorSettings.load(file, tempDir).mergePolicy()).isEqualTo(MergePolicy.FIRST_WINS);
    }

    @Test
    void fallsBackToEngineDefaults() {
        assertThat(ConfigLoader.locate(null, tempDir)).isEmpty();
        assertThat(EvaluatorSettings.load(null, tempDir)).isEqualTo(EvaluatorSettings.defaults());
    }
}
