package com.peargent.tools;

import com.peargent.observability.PoolMetrics;
import com.peargent.shared.error.OperationTimeoutException;
import com.peargent.shared.error.PeargentException;
import com.peargent.shared.error.ToolExecutionException;
import com.peargent.shared.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes tools: validation, time bound, retry with optional exponential backoff,
 * and the on-error policy. Holds no per-call state.
 */
public class ToolRuntime {

    private static final Logger log = LoggerFactory.getLogger(ToolRuntime.class);

    // Shared by every runtime that is not given its own executor; threads are daemons.
    private static final ExecutorService SHARED_EXECUTOR = daemonExecutor();
    private static final ToolRuntime DEFAULT = new ToolRuntime();

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final ExecutorService executor;
    private final Sleeper sleeper;
    private final PoolMetrics metrics;

    public ToolRuntime() {
        this(SHARED_EXECUTOR, d -> Thread.sleep(d.toMillis()), null);
    }

    public ToolRuntime(PoolMetrics metrics) {
        this(SHARED_EXECUTOR, d -> Thread.sleep(d.toMillis()), metrics);
    }

    public ToolRuntime(ExecutorService executor, Sleeper sleeper, PoolMetrics metrics) {
        this.executor = executor;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    public static ToolRuntime defaultRuntime() {
        return DEFAULT;
    }

    ExecutorService executor() {
        return executor;
    }

    public ToolResult execute(Tool tool, Map<String, Object> args, Duration timeoutOverride) {
        Map<String, Object> validated;
        try {
            validated = tool.validate(args);
        } catch (ValidationException e) {
            return fail(tool, e);
        }

        var timeout = timeoutOverride != null ? timeoutOverride : tool.timeout();
        PeargentException last = null;
        for (int attempt = 0; ; attempt++) {
            if (metrics != null) metrics.toolInvocations().increment();
            try {
                return toResult(invoke(tool, validated, timeout));
            } catch (OperationTimeoutException | ToolExecutionException e) {
                last = e;
                if (attempt >= tool.maxRetries()) break;
                var delay = backoffDelay(tool, attempt);
                log.warn("Tool '{}' attempt {}/{} failed: {}; retrying in {}ms",
                        tool.name(), attempt + 1, tool.maxRetries() + 1, e.getMessage(), delay.toMillis());
                if (metrics != null) metrics.toolRetries().increment();
                pause(tool, delay);
            }
        }
        return fail(tool, last);
    }

    static Duration backoffDelay(Tool tool, int attempt) {
        var base = tool.retryDelay();
        return tool.retryBackoff() ? base.multipliedBy(1L << Math.min(attempt, 30)) : base;
    }

    private Object invoke(Tool tool, Map<String, Object> args, Duration timeout) {
        if (timeout == null) {
            try {
                return tool.function().apply(args);
            } catch (Exception e) {
                throw wrap(tool, e);
            }
        }
        var future = executor.submit(() -> tool.function().apply(args));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new OperationTimeoutException("Tool '" + tool.name() + "'", timeout);
        } catch (ExecutionException e) {
            var cause = e.getCause() instanceof Exception ex ? ex : e;
            throw wrap(tool, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ToolExecutionException(tool.name(), "Tool '" + tool.name() + "' interrupted", e);
        }
    }

    private void pause(Tool tool, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolExecutionException(tool.name(), "Interrupted during retry of tool '" + tool.name() + "'", e);
        }
    }

    private ToolResult fail(Tool tool, PeargentException failure) {
        if (metrics != null) metrics.toolFailures().increment();
        if (tool.onError() == ErrorPolicy.RETURN_ERROR) {
            log.warn("Tool '{}' failed, returning error result: {}", tool.name(), failure.getMessage());
            return ToolResult.failure(failure.getMessage());
        }
        throw failure;
    }

    private static ToolResult toResult(Object value) {
        return value instanceof ToolResult result ? result : ToolResult.success(value);
    }

    private static ToolExecutionException wrap(Tool tool, Exception e) {
        if (e instanceof ToolExecutionException tee) return tee;
        return new ToolExecutionException(tool.name(),
                "Tool '" + tool.name() + "' failed: " + e.getMessage(), e);
    }

    private static ExecutorService daemonExecutor() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "peargent-tool-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
