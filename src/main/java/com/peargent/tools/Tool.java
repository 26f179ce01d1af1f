package com.peargent.tools;

import com.peargent.shared.error.ValidationException;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, schema-validated, retry- and timeout-wrapped operation an agent may
 * invoke. Instances are produced by {@link ToolBuilder}.
 */
public final class Tool {

    private final String name;
    private final String description;
    private final List<ToolParameter> parameters;
    private final ToolFunction function;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration retryDelay;
    private final boolean retryBackoff;
    private final ErrorPolicy onError;
    private final ToolRuntime runtime;

    Tool(String name, String description, List<ToolParameter> parameters, ToolFunction function,
         Duration timeout, int maxRetries, Duration retryDelay, boolean retryBackoff,
         ErrorPolicy onError, ToolRuntime runtime) {
        this.name = name;
        this.description = description;
        this.parameters = List.copyOf(parameters);
        this.function = function;
        this.timeout = timeout;
        this.maxRetries = maxRetries;
        this.retryDelay = retryDelay;
        this.retryBackoff = retryBackoff;
        this.onError = onError;
        this.runtime = runtime;
    }

    public String name() { return name; }

    public String description() { return description; }

    public List<ToolParameter> parameters() { return parameters; }

    public ToolFunction function() { return function; }

    /** Declared time bound, or null when unbounded. */
    public Duration timeout() { return timeout; }

    public int maxRetries() { return maxRetries; }

    public Duration retryDelay() { return retryDelay; }

    public boolean retryBackoff() { return retryBackoff; }

    public ErrorPolicy onError() { return onError; }

    ToolRuntime runtime() { return runtime; }

    public ToolResult run(Map<String, Object> args) {
        return run(args, null);
    }

    /**
     * Validates {@code args}, then invokes the operation under the effective timeout,
     * retrying timeouts and operation failures as configured.
     *
     * @param timeoutOverride replaces the declared timeout for this call when not null
     * @throws com.peargent.shared.error.PeargentException when retries are exhausted
     *         and the policy is {@link ErrorPolicy#RAISE}
     */
    public ToolResult run(Map<String, Object> args, Duration timeoutOverride) {
        return runtime.execute(this, args, timeoutOverride);
    }

    /**
     * Returns a copy of {@code args} with defaults filled in.
     *
     * @throws ValidationException on a missing required parameter or a type mismatch
     */
    public Map<String, Object> validate(Map<String, Object> args) {
        var input = args != null ? args : Map.<String, Object>of();
        var validated = new LinkedHashMap<String, Object>(input);
        for (var p : parameters) {
            var value = input.get(p.name());
            if (value == null) {
                if (p.required()) {
                    throw new ValidationException(p.name(),
                            "Tool '" + name + "' missing required parameter '" + p.name() + "'");
                }
                validated.put(p.name(), p.defaultValue());
                value = p.defaultValue();
                if (value == null) continue;
            }
            if (!p.type().accepts(value)) {
                throw new ValidationException(p.name(), "Tool '" + name + "' parameter '" + p.name()
                        + "' expects " + p.type().wireName() + " but got " + value.getClass().getSimpleName());
            }
        }
        return Collections.unmodifiableMap(validated);
    }

    @Override
    public String toString() {
        return "Tool[" + name + "]";
    }
}
