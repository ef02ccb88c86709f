package com.github.acprelay.services;

import com.github.acprelay.bridge.CliAgent;
import com.github.acprelay.bridge.CliAgentType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Relay configuration: built-in defaults, overlaid by {@code relay.properties} from the classpath,
 * an optional external properties file, and finally environment variables.
 */
public final class RelaySettings {
    private static final Logger LOG = LoggerFactory.getLogger(RelaySettings.class);
    private static final String RESOURCE_NAME = "relay.properties";

    public static final String KEY_AGENT_TYPE = "relay.agent.type";
    public static final String KEY_AGENT_COMMAND = "relay.agent.command";
    public static final String KEY_APPROVAL_MODE = "relay.agent.approvalMode";
    public static final String KEY_MODEL = "relay.agent.model";
    public static final String KEY_INCLUDE_DIRECTORIES = "relay.agent.includeDirectories";
    public static final String KEY_KILL_GRACE_MS = "relay.agent.killGraceMs";
    public static final String KEY_PERMISSION_STRATEGY = "relay.acp.permissionStrategy";
    public static final String KEY_TIMEOUT_MS = "relay.acp.timeoutMs";
    public static final String KEY_NO_OUTPUT_TIMEOUT_MS = "relay.acp.noOutputTimeoutMs";
    public static final String KEY_PREWARM_RETRY_MS = "relay.acp.prewarmRetryMs";
    public static final String KEY_PREWARM_MAX_RETRIES = "relay.acp.prewarmMaxRetries";
    public static final String KEY_REQUEST_TIMEOUT_MS = "relay.acp.requestTimeoutMs";
    public static final String KEY_MCP_SERVERS_JSON = "relay.acp.mcpServersJson";
    public static final String KEY_STREAM_STDOUT = "relay.acp.streamStdout";
    public static final String KEY_DEBUG_STREAM = "relay.acp.debugStream";
    public static final String KEY_STDERR_TAIL_MAX_CHARS = "relay.acp.stderrTailMaxChars";
    public static final String KEY_MAX_RESPONSE_LENGTH = "relay.delivery.maxResponseLength";
    public static final String KEY_STREAM_UPDATE_INTERVAL_MS = "relay.delivery.streamUpdateIntervalMs";
    public static final String KEY_LIVE_MESSAGES = "relay.delivery.liveMessages";
    public static final String KEY_MAX_RETRIES = "relay.delivery.maxRetries";
    public static final String KEY_RETRY_DELAY_MS = "relay.delivery.retryDelayMs";
    public static final String KEY_HOME = "relay.home";

    public static final String DEFAULT_AGENT_TYPE = "gemini";
    public static final long DEFAULT_KILL_GRACE_MS = CliAgent.DEFAULT_KILL_GRACE_MS;
    public static final String DEFAULT_PERMISSION_STRATEGY = "allow_once";
    public static final long DEFAULT_TIMEOUT_MS = 120_000;
    public static final long DEFAULT_NO_OUTPUT_TIMEOUT_MS = 60_000;
    public static final long DEFAULT_PREWARM_RETRY_MS = 30_000;
    public static final int DEFAULT_PREWARM_MAX_RETRIES = 10;
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_STDERR_TAIL_MAX_CHARS = 4000;
    public static final int DEFAULT_MAX_RESPONSE_LENGTH = 4000;
    public static final long DEFAULT_STREAM_UPDATE_INTERVAL_MS = 1000;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_RETRY_DELAY_MS = 5000;

    /** Environment variable that overrides each property key. */
    private static final Map<String, String> ENV_OVERRIDES = Map.ofEntries(
        Map.entry(KEY_AGENT_TYPE, "CLI_AGENT"),
        Map.entry(KEY_AGENT_COMMAND, "CLI_AGENT_COMMAND"),
        Map.entry(KEY_APPROVAL_MODE, "CLI_AGENT_APPROVAL_MODE"),
        Map.entry(KEY_MODEL, "CLI_AGENT_MODEL"),
        Map.entry(KEY_INCLUDE_DIRECTORIES, "CLI_AGENT_INCLUDE_DIRECTORIES"),
        Map.entry(KEY_KILL_GRACE_MS, "CLI_AGENT_KILL_GRACE_MS"),
        Map.entry(KEY_PERMISSION_STRATEGY, "ACP_PERMISSION_STRATEGY"),
        Map.entry(KEY_TIMEOUT_MS, "ACP_TIMEOUT_MS"),
        Map.entry(KEY_NO_OUTPUT_TIMEOUT_MS, "ACP_NO_OUTPUT_TIMEOUT_MS"),
        Map.entry(KEY_PREWARM_RETRY_MS, "ACP_PREWARM_RETRY_MS"),
        Map.entry(KEY_PREWARM_MAX_RETRIES, "ACP_PREWARM_MAX_RETRIES"),
        Map.entry(KEY_REQUEST_TIMEOUT_MS, "ACP_REQUEST_TIMEOUT_MS"),
        Map.entry(KEY_MCP_SERVERS_JSON, "ACP_MCP_SERVERS_JSON"),
        Map.entry(KEY_STREAM_STDOUT, "ACP_STREAM_STDOUT"),
        Map.entry(KEY_DEBUG_STREAM, "ACP_DEBUG_STREAM"),
        Map.entry(KEY_STDERR_TAIL_MAX_CHARS, "ACP_STDERR_TAIL_MAX_CHARS"),
        Map.entry(KEY_MAX_RESPONSE_LENGTH, "MAX_RESPONSE_LENGTH"),
        Map.entry(KEY_STREAM_UPDATE_INTERVAL_MS, "STREAM_UPDATE_INTERVAL_MS"),
        Map.entry(KEY_LIVE_MESSAGES, "LIVE_MESSAGES"),
        Map.entry(KEY_MAX_RETRIES, "AGENT_MAX_RETRIES"),
        Map.entry(KEY_RETRY_DELAY_MS, "AGENT_RETRY_DELAY_MS"),
        Map.entry(KEY_HOME, "RELAY_HOME")
    );

    private final Properties values;

    private RelaySettings(Properties values) {
        this.values = values;
    }

    /**
     * Load from the classpath resource, the optional file, and the process environment.
     */
    @NotNull
    public static RelaySettings load(@Nullable Path externalFile) {
        Properties props = new Properties();
        try (InputStream in = RelaySettings.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            LOG.warn("Failed to read classpath {}: {}", RESOURCE_NAME, e.getMessage());
        }
        if (externalFile != null && Files.isRegularFile(externalFile)) {
            try (Reader reader = Files.newBufferedReader(externalFile, StandardCharsets.UTF_8)) {
                props.load(reader);
                LOG.info("Loaded relay settings from {}", externalFile);
            } catch (IOException e) {
                LOG.warn("Failed to read settings file {}: {}", externalFile, e.getMessage());
            }
        }
        return fromProperties(props, System.getenv());
    }

    /**
     * Build settings from explicit properties; non-blank entries in {@code env} win.
     */
    @NotNull
    public static RelaySettings fromProperties(@NotNull Properties props, @NotNull Map<String, String> env) {
        Properties merged = new Properties();
        merged.putAll(props);
        for (Map.Entry<String, String> override : ENV_OVERRIDES.entrySet()) {
            String value = env.get(override.getValue());
            if (value != null && !value.isBlank()) {
                merged.setProperty(override.getKey(), value);
            }
        }
        return new RelaySettings(merged);
    }

    // ---- Agent ----

    @NotNull
    public CliAgentType getAgentType() {
        return CliAgentType.fromId(getString(KEY_AGENT_TYPE, DEFAULT_AGENT_TYPE));
    }

    @Nullable
    public String getAgentCommand() {
        return getString(KEY_AGENT_COMMAND, null);
    }

    @Nullable
    public String getApprovalMode() {
        return getString(KEY_APPROVAL_MODE, null);
    }

    @Nullable
    public String getModel() {
        return getString(KEY_MODEL, null);
    }

    /** Comma-separated list, blanks dropped. */
    @NotNull
    public List<String> getIncludeDirectories() {
        String raw = getString(KEY_INCLUDE_DIRECTORIES, "");
        List<String> dirs = new ArrayList<>();
        Arrays.stream(raw.split(",")).map(String::trim).filter(s -> !s.isEmpty()).forEach(dirs::add);
        return dirs;
    }

    public long getKillGraceMs() {
        return getLong(KEY_KILL_GRACE_MS, DEFAULT_KILL_GRACE_MS);
    }

    @NotNull
    public CliAgent createCliAgent() {
        return new CliAgent(getAgentType(), getAgentCommand(), getApprovalMode(), getModel(),
            getIncludeDirectories(), getKillGraceMs());
    }

    // ---- ACP runtime ----

    @NotNull
    public String getPermissionStrategy() {
        return getString(KEY_PERMISSION_STRATEGY, DEFAULT_PERMISSION_STRATEGY);
    }

    /** Overall prompt deadline. */
    public long getTimeoutMs() {
        return getLong(KEY_TIMEOUT_MS, DEFAULT_TIMEOUT_MS);
    }

    /** Silence window before a prompt is abandoned (0 = disabled). */
    public long getNoOutputTimeoutMs() {
        return getLong(KEY_NO_OUTPUT_TIMEOUT_MS, DEFAULT_NO_OUTPUT_TIMEOUT_MS);
    }

    /** Delay between prewarm attempts (0 = no automatic retry). */
    public long getPrewarmRetryMs() {
        return getLong(KEY_PREWARM_RETRY_MS, DEFAULT_PREWARM_RETRY_MS);
    }

    /** Max consecutive prewarm failures before automatic retries stop (0 = unlimited). */
    public int getPrewarmMaxRetries() {
        return (int) getLong(KEY_PREWARM_MAX_RETRIES, DEFAULT_PREWARM_MAX_RETRIES);
    }

    public long getRequestTimeoutMs() {
        return getLong(KEY_REQUEST_TIMEOUT_MS, DEFAULT_REQUEST_TIMEOUT_MS);
    }

    @Nullable
    public String getMcpServersJson() {
        return getString(KEY_MCP_SERVERS_JSON, null);
    }

    public boolean isStreamStdout() {
        return getBoolean(KEY_STREAM_STDOUT);
    }

    public boolean isDebugStream() {
        return getBoolean(KEY_DEBUG_STREAM);
    }

    public int getStderrTailMaxChars() {
        return (int) getLong(KEY_STDERR_TAIL_MAX_CHARS, DEFAULT_STDERR_TAIL_MAX_CHARS);
    }

    // ---- Delivery ----

    public int getMaxResponseLength() {
        return (int) getLong(KEY_MAX_RESPONSE_LENGTH, DEFAULT_MAX_RESPONSE_LENGTH);
    }

    public long getStreamUpdateIntervalMs() {
        return getLong(KEY_STREAM_UPDATE_INTERVAL_MS, DEFAULT_STREAM_UPDATE_INTERVAL_MS);
    }

    public boolean isLiveMessages() {
        return getBoolean(KEY_LIVE_MESSAGES);
    }

    public int getMaxRetries() {
        return (int) getLong(KEY_MAX_RETRIES, DEFAULT_MAX_RETRIES);
    }

    public long getRetryDelayMs() {
        return getLong(KEY_RETRY_DELAY_MS, DEFAULT_RETRY_DELAY_MS);
    }

    /** Directory for the memory file and the context queue. */
    @NotNull
    public Path getHome() {
        String configured = getString(KEY_HOME, null);
        return configured != null ? Paths.get(configured) : Paths.get(System.getProperty("user.home"), ".acp-relay");
    }

    // ---- Parsing ----

    @Nullable
    private String getString(@NotNull String key, @Nullable String defaultValue) {
        String value = values.getProperty(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private long getLong(@NotNull String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            LOG.warn("Invalid value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBoolean(@NotNull String key) {
        return Boolean.parseBoolean(getString(key, "false"));
    }
}
