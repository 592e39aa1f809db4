package org.opencraft.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.opencraft.junit.extensions.logging.LogWatchExtension;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Verifies the configuration precedence: system properties, then the configuration file, then
 * reference.conf.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("bootstrap.thin-clients");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Should fall back to reference.conf when no file is given")
    void load_withoutFile_shouldUseReferenceDefaults() throws Exception {
        final Config config = ConfigLoader.load(null);

        assertThat(config.getString("bootstrap.play-type")).isEqualTo("ClientAndServer");
        assertThat(config.getInt("engine.tick-rate-hz")).isEqualTo(30);
    }

    @Test
    void load_fileShouldOverrideReference() throws Exception {
        final File file = write("""
            bootstrap {
              play-type = "Server"
              server.port = 8000
            }
            """);

        final Config config = ConfigLoader.load(file);

        assertThat(config.getString("bootstrap.play-type")).isEqualTo("Server");
        assertThat(config.getInt("bootstrap.server.port")).isEqualTo(8000);
        assertThat(config.getString("bootstrap.server.url")).isEqualTo("127.0.0.1");
    }

    @Test
    void load_systemPropertyShouldOverrideFile() throws Exception {
        final File file = write("bootstrap.thin-clients = 2");
        System.setProperty("bootstrap.thin-clients", "7");
        ConfigFactory.invalidateCaches();

        final Config config = ConfigLoader.load(file);

        assertThat(config.getInt("bootstrap.thin-clients")).isEqualTo(7);
    }

    @Test
    void load_shouldResolveSubstitutions() throws Exception {
        final File file = write("""
            shared-host = "game.example.org"
            bootstrap.server.url = ${shared-host}
            bootstrap.deployment.url = ${shared-host}
            """);

        final Config config = ConfigLoader.load(file);

        assertThat(config.getString("bootstrap.server.url")).isEqualTo("game.example.org");
        assertThat(config.getString("bootstrap.deployment.url")).isEqualTo("game.example.org");
    }

    @Test
    void load_missingExplicitFile_shouldFail() {
        final File missing = tempDir.resolve("missing.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.load(missing))
            .isInstanceOf(ConfigResolutionException.class)
            .hasMessageContaining("missing.conf");
    }

    @Test
    void load_malformedFile_shouldFail() throws Exception {
        final File file = write("bootstrap { play-type = ");

        assertThatThrownBy(() -> ConfigLoader.load(file))
            .isInstanceOf(ConfigResolutionException.class);
    }

    private File write(final String content) throws IOException {
        final Path path = tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME);
        Files.writeString(path, content);
        return path.toFile();
    }
}
