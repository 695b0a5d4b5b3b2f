package com.fileprovider.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadCustomConfigFile() throws IOException {
        Path configFile = tempDir.resolve("custom.conf");
        Files.writeString(configFile, """
            provider {
              type = "custom"
            }
            server {
              port = 9090
            }
            """);

        Config config = ConfigLoader.load(configFile.toString());

        assertEquals("custom", config.getString("provider.type"));
        assertEquals(9090, config.getInt("server.port"));
    }

    @Test
    void loadMultipleConfigFiles_laterOverridesEarlier() throws IOException {
        Path baseConfig = tempDir.resolve("base.conf");
        Files.writeString(baseConfig, """
            server {
              host = "0.0.0.0"
              port = 8080
            }
            """);

        Path overrideConfig = tempDir.resolve("override.conf");
        Files.writeString(overrideConfig, """
            server {
              port = 9999
            }
            """);

        Config config = ConfigLoader.load(baseConfig.toString(), overrideConfig.toString());

        assertEquals("0.0.0.0", config.getString("server.host"));
        assertEquals(9999, config.getInt("server.port"));
    }

    @Test
    void substitutionsAcrossFilesAreResolved() throws IOException {
        Path baseConfig = tempDir.resolve("base.conf");
        Files.writeString(baseConfig, """
            defaults.root = "/srv/configs"
            """);
        Path overrideConfig = tempDir.resolve("override.conf");
        Files.writeString(overrideConfig, """
            instances.local.directory = ${defaults.root}"/local"
            """);

        Config config = ConfigLoader.load(baseConfig.toString(), overrideConfig.toString());

        assertEquals("/srv/configs/local", config.getString("instances.local.directory"));
    }

    @Test
    void systemPropertiesOverrideFiles() throws IOException {
        Path configFile = tempDir.resolve("props.conf");
        Files.writeString(configFile, "loader-test.value = from-file\n");

        System.setProperty("loader-test.value", "from-property");
        ConfigFactory.invalidateCaches();
        try {
            Config config = ConfigLoader.load(configFile.toString());
            assertEquals("from-property", config.getString("loader-test.value"));

            Config withoutProps = ConfigLoader.builder()
                    .addFile(configFile.toString())
                    .withSystemProperties(false)
                    .build();
            assertEquals("from-file", withoutProps.getString("loader-test.value"));
        } finally {
            System.clearProperty("loader-test.value");
            ConfigFactory.invalidateCaches();
        }
    }

    @Test
    void applicationConfCanBeExcluded() {
        Config withApplication = ConfigLoader.builder()
                .withEnvironmentVariables(false)
                .build();
        assertEquals("from-application", withApplication.getString("loader-test.application"));

        Config withoutApplication = ConfigLoader.builder()
                .withApplicationConf(false)
                .withEnvironmentVariables(false)
                .build();
        assertFalse(withoutApplication.hasPath("loader-test.application"));
    }

    @Test
    void missingFileIsRejected() {
        String missing = tempDir.resolve("does-not-exist.conf").toString();

        ConfigLoader.ConfigurationException ex = assertThrows(
                ConfigLoader.ConfigurationException.class,
                () -> ConfigLoader.load(missing));
        assertTrue(ex.getMessage().contains("does-not-exist.conf"));
    }

    @Test
    void malformedFileIsRejected() throws IOException {
        Path configFile = tempDir.resolve("broken.conf");
        Files.writeString(configFile, "server { port = 8080\n");

        assertThrows(ConfigLoader.ConfigurationException.class,
                () -> ConfigLoader.load(configFile.toString()));
    }

    @Test
    void unresolvedSubstitutionIsRejected() throws IOException {
        Path configFile = tempDir.resolve("unresolved.conf");
        Files.writeString(configFile, "a = ${no.such.key.anywhere}\n");

        assertThrows(ConfigLoader.ConfigurationException.class,
                () -> ConfigLoader.builder()
                        .addFile(configFile.toString())
                        .withEnvironmentVariables(false)
                        .build());
    }
}
