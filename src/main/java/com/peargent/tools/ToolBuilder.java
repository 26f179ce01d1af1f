package com.peargent.tools;

import com.peargent.shared.config.ToolsConfig;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Builds immutable {@link Tool}s. All inference (names, parameter types, defaults)
 * happens here, once, never at invocation time.
 */
public class ToolBuilder {

    private final String name;
    private String description = "";
    private final List<ToolParameter> parameters = new ArrayList<>();
    private ToolFunction function;
    private Duration timeout;
    private int maxRetries;
    private Duration retryDelay = Duration.ofSeconds(1);
    private boolean retryBackoff = true;
    private ErrorPolicy onError = ErrorPolicy.RAISE;
    private ToolRuntime runtime = ToolRuntime.defaultRuntime();

    private ToolBuilder(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Tool name must not be blank");
        this.name = name;
    }

    public static ToolBuilder builder(String name) {
        return new ToolBuilder(name);
    }

    /** Copies every setting of {@code tool} into a new builder. */
    public static ToolBuilder from(Tool tool) {
        return builder(tool.name())
                .description(tool.description())
                .parameters(tool.parameters())
                .function(tool.function())
                .timeout(tool.timeout())
                .maxRetries(tool.maxRetries())
                .retryDelay(tool.retryDelay())
                .retryBackoff(tool.retryBackoff())
                .onError(tool.onError())
                .runtime(tool.runtime());
    }

    public static Tool fromFunction(String name, String description, List<ToolParameter> parameters,
                                    ToolFunction function) {
        return builder(name).description(description).parameters(parameters).function(function).build();
    }

    public static Tool fromMethod(Object target, String methodName) {
        return fromMethod(target, methodName, ToolsConfig.ToolDefaults.defaults());
    }

    /**
     * Derives a tool from a {@link ToolSpec}-annotated method: name and description
     * from the annotation (falling back to the method name), parameters from the Java
     * signature and {@link Param} annotations.
     */
    public static Tool fromMethod(Object target, String methodName, ToolsConfig.ToolDefaults defaults) {
        Objects.requireNonNull(target, "target");
        var method = Arrays.stream(target.getClass().getMethods())
                .filter(m -> m.getName().equals(methodName))
                .filter(m -> m.isAnnotationPresent(ToolSpec.class))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "No @ToolSpec method '" + methodName + "' on " + target.getClass().getName()));
        return fromMethod(target, method, defaults);
    }

    static Tool fromMethod(Object target, Method method, ToolsConfig.ToolDefaults defaults) {
        if (Modifier.isStatic(method.getModifiers())) target = null;
        var spec = method.getAnnotation(ToolSpec.class);
        var builder = builder(spec.name().isBlank() ? method.getName() : spec.name())
                .defaults(defaults)
                .description(spec.description());

        var names = new ArrayList<String>();
        for (var p : method.getParameters()) {
            var ann = p.getAnnotation(Param.class);
            var paramName = ann != null && !ann.name().isBlank() ? ann.name() : p.getName();
            var type = ParamType.fromJavaType(p.getType());
            var hasDefault = ann != null && !Param.NO_DEFAULT.equals(ann.defaultValue());
            var param = hasDefault
                    ? ToolParameter.optional(paramName, type, coerce(ann.defaultValue(), p.getType()))
                    : ToolParameter.required(paramName, type);
            builder.parameter(ann != null ? param.describedAs(ann.description()) : param);
            names.add(paramName);
        }

        if (spec.timeout() >= 0) builder.timeoutSeconds(spec.timeout());
        if (spec.maxRetries() >= 0) builder.maxRetries(spec.maxRetries());
        if (spec.retryDelay() >= 0) builder.retryDelaySeconds(spec.retryDelay());
        if (spec.maxRetries() >= 0 || spec.retryDelay() >= 0) builder.retryBackoff(spec.retryBackoff());
        if (spec.onError() != ErrorPolicy.RAISE) builder.onError(spec.onError());

        method.trySetAccessible();
        var receiver = target;
        var types = method.getParameterTypes();
        return builder.function(args -> {
            var values = new Object[names.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = adapt(args.get(names.get(i)), types[i]);
            }
            try {
                return method.invoke(receiver, values);
            } catch (InvocationTargetException e) {
                throw e.getCause() instanceof Exception ex ? ex : e;
            }
        }).build();
    }

    public ToolBuilder defaults(ToolsConfig.ToolDefaults defaults) {
        if (defaults == null) return this;
        if (defaults.timeoutSeconds() != null) timeoutSeconds(defaults.timeoutSeconds());
        maxRetries(defaults.maxRetries());
        retryDelaySeconds(defaults.retryDelaySeconds());
        retryBackoff(defaults.retryBackoff());
        onError(defaults.onError());
        return this;
    }

    public ToolBuilder description(String description) {
        this.description = description != null ? description : "";
        return this;
    }

    public ToolBuilder parameter(ToolParameter parameter) {
        parameters.add(parameter);
        return this;
    }

    public ToolBuilder parameters(List<ToolParameter> parameters) {
        this.parameters.clear();
        this.parameters.addAll(parameters);
        return this;
    }

    public ToolBuilder function(ToolFunction function) {
        this.function = function;
        return this;
    }

    public ToolBuilder timeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    public ToolBuilder timeoutSeconds(double seconds) {
        return timeout(Duration.ofMillis(Math.round(seconds * 1000)));
    }

    public ToolBuilder maxRetries(int maxRetries) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        this.maxRetries = maxRetries;
        return this;
    }

    public ToolBuilder retryDelay(Duration retryDelay) {
        this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay");
        return this;
    }

    public ToolBuilder retryDelaySeconds(double seconds) {
        return retryDelay(Duration.ofMillis(Math.round(seconds * 1000)));
    }

    public ToolBuilder retryBackoff(boolean retryBackoff) {
        this.retryBackoff = retryBackoff;
        return this;
    }

    public ToolBuilder onError(ErrorPolicy onError) {
        this.onError = Objects.requireNonNull(onError, "onError");
        return this;
    }

    public ToolBuilder runtime(ToolRuntime runtime) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        return this;
    }

    public Tool build() {
        Objects.requireNonNull(function, "Tool '" + name + "' has no function");
        var seen = new HashSet<String>();
        for (var p : parameters) {
            if (!seen.add(p.name())) {
                throw new IllegalArgumentException("Tool '" + name + "' declares parameter '" + p.name() + "' twice");
            }
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("Tool '" + name + "' timeout must be positive");
        }
        return new Tool(name, description, parameters, function, timeout, maxRetries,
                retryDelay, retryBackoff, onError, runtime);
    }

    private static Object coerce(String text, Class<?> type) {
        if (type == String.class || type == Object.class) return text;
        return switch (ParamType.fromJavaType(type)) {
            case INTEGER -> Long.parseLong(text);
            case NUMBER -> Double.parseDouble(text);
            case BOOLEAN -> Boolean.parseBoolean(text);
            default -> text;
        };
    }

    // Numeric arguments arrive as whatever the JSON parser produced; narrow them to the signature.
    private static Object adapt(Object value, Class<?> type) {
        if (!(value instanceof Number n)) return value;
        if (type == int.class || type == Integer.class) return n.intValue();
        if (type == long.class || type == Long.class) return n.longValue();
        if (type == short.class || type == Short.class) return n.shortValue();
        if (type == byte.class || type == Byte.class) return n.byteValue();
        if (type == double.class || type == Double.class) return n.doubleValue();
        if (type == float.class || type == Float.class) return n.floatValue();
        if (type == BigDecimal.class) return new BigDecimal(n.toString());
        if (type == BigInteger.class) return BigInteger.valueOf(n.longValue());
        return value;
    }
}
