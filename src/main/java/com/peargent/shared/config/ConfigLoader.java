package com.peargent.shared.config;

import com.peargent.tools.ErrorPolicy;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".peargent", "config.yaml"
    );

    public static PeargentConfig load() {
        return load(DEFAULT_PATH);
    }

    @SuppressWarnings("unchecked")
    public static PeargentConfig load(Path path) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var pool = (Map<String, Object>) raw.getOrDefault("pool", Map.of());
        var history = (Map<String, Object>) raw.getOrDefault("history", Map.of());
        var tools = (Map<String, Object>) raw.getOrDefault("tools", Map.of());
        var agent = (Map<String, Object>) raw.getOrDefault("agent", Map.of());

        return new PeargentConfig(
            parsePoolSettings(pool),
            parseHistoryConfig(history),
            parseToolsConfig(tools),
            parseAgentSettings(agent)
        );
    }

    private static PoolSettings parsePoolSettings(Map<String, Object> pool) {
        var defaults = PoolSettings.defaults();
        return new PoolSettings(
            Integer.parseInt(envOrDefault("PEARGENT_MAX_ITER",
                String.valueOf(pool.getOrDefault("max-iter", defaults.maxIter())))),
            Boolean.parseBoolean(envOrDefault("PEARGENT_TRACING",
                String.valueOf(pool.getOrDefault("tracing", defaults.tracing()))))
        );
    }

    private static HistoryConfig parseHistoryConfig(Map<String, Object> history) {
        var defaults = HistoryConfig.defaults();
        return new HistoryConfig(
            Boolean.TRUE.equals(history.getOrDefault("auto-manage-context", defaults.autoManageContext())),
            Integer.parseInt(String.valueOf(history.getOrDefault("max-context-messages", defaults.maxContextMessages()))),
            ContextStrategy.parse(String.valueOf(history.getOrDefault("strategy", defaults.strategy().wireName()))),
            Boolean.TRUE.equals(history.getOrDefault("compact-store", defaults.compactStore()))
        );
    }

    @SuppressWarnings("unchecked")
    private static ToolsConfig parseToolsConfig(Map<String, Object> tools) {
        var defaultsRaw = (Map<String, Object>) tools.getOrDefault("defaults", Map.of());
        var http = (Map<String, Object>) tools.getOrDefault("http-request", Map.of());

        var toolDef = ToolsConfig.ToolDefaults.defaults();
        var httpDef = ToolsConfig.HttpRequestConfig.defaults();

        var timeout = defaultsRaw.get("timeout");
        var builtin = ((List<?>) tools.getOrDefault("builtin", List.of())).stream()
                .map(String::valueOf)
                .toList();

        return new ToolsConfig(
            new ToolsConfig.ToolDefaults(
                timeout != null ? Double.valueOf(String.valueOf(timeout)) : toolDef.timeoutSeconds(),
                Integer.parseInt(String.valueOf(defaultsRaw.getOrDefault("max-retries", toolDef.maxRetries()))),
                Double.parseDouble(String.valueOf(defaultsRaw.getOrDefault("retry-delay", toolDef.retryDelaySeconds()))),
                Boolean.TRUE.equals(defaultsRaw.getOrDefault("retry-backoff", toolDef.retryBackoff())),
                ErrorPolicy.parse(String.valueOf(defaultsRaw.getOrDefault("on-error", toolDef.onError().wireName())))
            ),
            builtin,
            new ToolsConfig.HttpRequestConfig(
                Double.parseDouble(String.valueOf(http.getOrDefault("timeout", httpDef.timeoutSeconds()))),
                Integer.parseInt(String.valueOf(http.getOrDefault("max-response-size", httpDef.maxResponseSize())))
            )
        );
    }

    private static AgentSettings parseAgentSettings(Map<String, Object> agent) {
        var defaults = AgentSettings.defaults();
        var modelTimeout = agent.get("model-timeout");
        return new AgentSettings(
            Integer.parseInt(String.valueOf(agent.getOrDefault("max-tool-rounds", defaults.maxToolRounds()))),
            modelTimeout != null ? Double.valueOf(String.valueOf(modelTimeout)) : defaults.modelTimeoutSeconds()
        );
    }

    private static String envOrDefault(String env, String fallback) {
        var val = System.getenv(env);
        return val != null ? val : fallback;
    }
}
