package com.github.acprelay.services;

import com.github.acprelay.bridge.CliAgentType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelaySettingsTest {

    private static RelaySettings settings(Map<String, String> env, String... pairs) {
        Properties props = new Properties();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            props.setProperty(pairs[i], pairs[i + 1]);
        }
        return RelaySettings.fromProperties(props, env);
    }

    @Test
    void testDefaults() {
        RelaySettings settings = settings(Map.of());

        assertEquals(CliAgentType.GEMINI, settings.getAgentType());
        assertEquals("allow_once", settings.getPermissionStrategy());
        assertEquals(RelaySettings.DEFAULT_TIMEOUT_MS, settings.getTimeoutMs());
        assertEquals(RelaySettings.DEFAULT_NO_OUTPUT_TIMEOUT_MS, settings.getNoOutputTimeoutMs());
        assertEquals(RelaySettings.DEFAULT_PREWARM_MAX_RETRIES, settings.getPrewarmMaxRetries());
        assertEquals(4000, settings.getMaxResponseLength());
        assertEquals(3, settings.getMaxRetries());
        assertFalse(settings.isLiveMessages());
        assertFalse(settings.isStreamStdout());
        assertNull(settings.getModel());
        assertNull(settings.getMcpServersJson());
        assertTrue(settings.getIncludeDirectories().isEmpty());
    }

    @Test
    void testPropertiesOverrideDefaults() {
        RelaySettings settings = settings(Map.of(),
            RelaySettings.KEY_TIMEOUT_MS, "5000",
            RelaySettings.KEY_LIVE_MESSAGES, "true",
            RelaySettings.KEY_INCLUDE_DIRECTORIES, " /a, ,/b ");

        assertEquals(5000, settings.getTimeoutMs());
        assertTrue(settings.isLiveMessages());
        assertEquals(List.of("/a", "/b"), settings.getIncludeDirectories());
    }

    @Test
    void testEnvironmentWinsOverProperties() {
        RelaySettings settings = settings(
            Map.of("ACP_TIMEOUT_MS", "9000", "CLI_AGENT_MODEL", "gemini-2.5-pro", "AGENT_MAX_RETRIES", " "),
            RelaySettings.KEY_TIMEOUT_MS, "5000",
            RelaySettings.KEY_MAX_RETRIES, "7");

        assertEquals(9000, settings.getTimeoutMs());
        assertEquals("gemini-2.5-pro", settings.getModel());
        assertEquals(7, settings.getMaxRetries());
    }

    @Test
    void testInvalidNumberFallsBackToDefault() {
        RelaySettings settings = settings(Map.of("ACP_NO_OUTPUT_TIMEOUT_MS", "soon"));

        assertEquals(RelaySettings.DEFAULT_NO_OUTPUT_TIMEOUT_MS, settings.getNoOutputTimeoutMs());
    }

    @Test
    void testHomeOverride() {
        assertEquals(Paths.get("/tmp/relay-home"), settings(Map.of("RELAY_HOME", "/tmp/relay-home")).getHome());
    }

    @Test
    void testExternalFileIsLoaded(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("relay.properties");
        Files.writeString(file, RelaySettings.KEY_RETRY_DELAY_MS + "=42\n", StandardCharsets.UTF_8);

        RelaySettings settings = RelaySettings.load(file);

        assertEquals(42, settings.getRetryDelayMs());
    }
}
