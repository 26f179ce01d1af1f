package com.peargent.shared.config;

import com.peargent.tools.ErrorPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileYieldsDefaults() {
        var cfg = ConfigLoader.load(tempDir.resolve("absent.yaml"));

        assertEquals(PeargentConfig.defaults().history(), cfg.history());
        assertEquals(PeargentConfig.defaults().tools(), cfg.tools());
        assertEquals(PeargentConfig.defaults().agent(), cfg.agent());
    }

    @Test
    void emptyFileYieldsDefaults() throws IOException {
        var cfg = writeAndLoad("");

        assertEquals(20, cfg.history().maxContextMessages());
        assertEquals(ContextStrategy.NONE, cfg.history().strategy());
        assertNull(cfg.tools().defaults().timeoutSeconds());
        assertEquals(0, cfg.tools().defaults().maxRetries());
        assertEquals(1.0, cfg.tools().defaults().retryDelaySeconds());
        assertTrue(cfg.tools().defaults().retryBackoff());
        assertEquals(ErrorPolicy.RAISE, cfg.tools().defaults().onError());
        assertEquals(10.0, cfg.tools().httpRequest().timeoutSeconds());
        assertEquals(1_000_000, cfg.tools().httpRequest().maxResponseSize());
        assertEquals(5, cfg.agent().maxToolRounds());
        assertNull(cfg.agent().modelTimeoutSeconds());
    }

    @Test
    void parsesFullConfig() throws IOException {
        var yaml = """
            pool:
              max-iter: 8
              tracing: true
            history:
              auto-manage-context: true
              max-context-messages: 12
              strategy: truncate-oldest
              compact-store: true
            tools:
              defaults:
                timeout: 15
                max-retries: 2
                retry-delay: 0.5
                retry-backoff: false
                on-error: return-error
              builtin: [http_request]
              http-request:
                timeout: 30
                max-response-size: 2048
            agent:
              max-tool-rounds: 3
              model-timeout: 45
            """;
        var cfg = writeAndLoad(yaml);

        if (System.getenv("PEARGENT_MAX_ITER") == null) assertEquals(8, cfg.pool().maxIter());
        if (System.getenv("PEARGENT_TRACING") == null) assertTrue(cfg.pool().tracing());
        assertEquals(new HistoryConfig(true, 12, ContextStrategy.TRUNCATE_OLDEST, true), cfg.history());
        var defaults = cfg.tools().defaults();
        assertEquals(Double.valueOf(15.0), defaults.timeoutSeconds());
        assertEquals(2, defaults.maxRetries());
        assertEquals(0.5, defaults.retryDelaySeconds());
        assertFalse(defaults.retryBackoff());
        assertEquals(ErrorPolicy.RETURN_ERROR, defaults.onError());
        assertEquals(List.of("http_request"), cfg.tools().builtin());
        assertEquals(30.0, cfg.tools().httpRequest().timeoutSeconds());
        assertEquals(2048, cfg.tools().httpRequest().maxResponseSize());
        assertEquals(3, cfg.agent().maxToolRounds());
        assertEquals(java.time.Duration.ofSeconds(45), cfg.agent().modelTimeout());
    }

    @Test
    void partialConfigFallsBackToDefaults() throws IOException {
        var yaml = """
            history:
              strategy: smart
            """;
        var cfg = writeAndLoad(yaml);

        assertEquals(ContextStrategy.SMART, cfg.history().strategy());
        assertFalse(cfg.history().autoManageContext());
        assertEquals(20, cfg.history().maxContextMessages());
        assertTrue(cfg.tools().builtin().isEmpty());
    }

    @Test
    void unsetTimeoutsStayUnbounded() throws IOException {
        var yaml = """
            tools:
              defaults:
                max-retries: 1
            agent:
              max-tool-rounds: 2
            """;
        var cfg = writeAndLoad(yaml);

        assertNull(cfg.tools().defaults().timeoutSeconds());
        assertEquals(1, cfg.tools().defaults().maxRetries());
        assertNull(cfg.agent().modelTimeoutSeconds());
        assertNull(cfg.agent().modelTimeout());
        assertEquals(2, cfg.agent().maxToolRounds());
    }

    @Test
    void rejectsInvalidValues() throws IOException {
        assertThrows(IllegalArgumentException.class, () -> writeAndLoad("history:\n  strategy: random\n"));
        assertThrows(IllegalArgumentException.class, () -> writeAndLoad("history:\n  max-context-messages: 0\n"));
        assertThrows(IllegalArgumentException.class, () -> writeAndLoad("tools:\n  defaults:\n    on-error: ignore\n"));
    }

    private PeargentConfig writeAndLoad(String yaml) throws IOException {
        var file = tempDir.resolve("config.yaml");
        Files.writeString(file, yaml);
        return ConfigLoader.load(file);
    }
}
