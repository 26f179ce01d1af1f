package com.peargent.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.peargent.shared.config.ToolsConfig;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Built-in {@code http_request} tool: REST calls with headers, query parameters,
 * JSON or raw bodies, a response size cap, and rejection of local/private targets.
 */
public class HttpRequestTool implements ToolFunction {

    public static final String NAME = "http_request";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Set<String> ALLOWED_METHODS = Set.of(
            "GET", "POST", "PUT", "DELETE", "PATCH", "HEAD");
    private static final Set<String> BLOCKED_HOSTS = Set.of(
            "localhost", "127.0.0.1", "::1", "[::1]", "0.0.0.0");

    static final int MAX_REDIRECTS = 5;

    /** Checks a request target before any connection is made to it. */
    @FunctionalInterface
    interface TargetGuard {
        void check(String url);
    }

    private final ToolsConfig.HttpRequestConfig config;
    private final HttpClient client;
    private final TargetGuard guard;

    public HttpRequestTool(ToolsConfig.HttpRequestConfig config) {
        this(config, HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(Duration.ofMillis(Math.round(config.timeoutSeconds() * 1000)))
                .build());
    }

    /**
     * @param client must not follow redirects itself; every hop is validated here
     */
    public HttpRequestTool(ToolsConfig.HttpRequestConfig config, HttpClient client) {
        this(config, client, HttpRequestTool::validateUrl);
    }

    HttpRequestTool(ToolsConfig.HttpRequestConfig config, HttpClient client, TargetGuard guard) {
        if (client.followRedirects() != HttpClient.Redirect.NEVER) {
            throw new IllegalArgumentException("HTTP client must use Redirect.NEVER");
        }
        this.config = config;
        this.client = client;
        this.guard = guard;
    }

    public static Tool create(ToolsConfig.HttpRequestConfig config, ToolsConfig.ToolDefaults defaults) {
        return ToolBuilder.builder(NAME)
                .defaults(defaults)
                .description("Make HTTP requests. Methods: GET, POST, PUT, DELETE, PATCH, HEAD")
                .parameter(ToolParameter.required("url", ParamType.STRING).describedAs("http or https URL"))
                .parameter(ToolParameter.optional("method", ParamType.STRING, "GET"))
                .parameter(ToolParameter.optional("headers", ParamType.OBJECT, null))
                .parameter(ToolParameter.optional("params", ParamType.OBJECT, null))
                .parameter(ToolParameter.optional("json_body", ParamType.OBJECT, null))
                .parameter(ToolParameter.optional("data_body", ParamType.ANY, null))
                .parameter(ToolParameter.optional("timeout", ParamType.NUMBER, config.timeoutSeconds()))
                .parameter(ToolParameter.optional("max_response_size", ParamType.INTEGER, config.maxResponseSize()))
                .function(new HttpRequestTool(config))
                .build();
    }

    @Override
    public ToolResult apply(Map<String, Object> args) throws Exception {
        var url = String.valueOf(args.get("url"));
        try {
            guard.check(url);
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(e.getMessage());
        }

        var method = String.valueOf(args.getOrDefault("method", "GET")).toUpperCase(Locale.ROOT);
        if (!ALLOWED_METHODS.contains(method)) {
            return ToolResult.failure("Unsupported method: " + method);
        }
        if (args.get("json_body") != null && args.get("data_body") != null) {
            return ToolResult.failure("Cannot provide both 'json_body' and 'data_body'");
        }

        var timeout = args.get("timeout") instanceof Number n ? n.doubleValue() : config.timeoutSeconds();
        var maxSize = args.get("max_response_size") instanceof Number n ? n.longValue() : config.maxResponseSize();
        var requestTimeout = Duration.ofMillis(Math.round(timeout * 1000));

        var builder = HttpRequest.newBuilder()
                .uri(URI.create(withQuery(url, asMap(args.get("params")))))
                .timeout(requestTimeout);
        asMap(args.get("headers")).forEach((k, v) -> builder.header(k, String.valueOf(v)));
        builder.method(method, bodyPublisher(args, builder));

        // Manual redirect loop so every hop passes the same target check
        var request = builder.build();
        HttpResponse<InputStream> response;
        int hops = 0;
        try {
            while (true) {
                response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
                int status = response.statusCode();
                var location = response.headers().firstValue("location").orElse(null);
                if (status < 300 || status >= 400 || location == null) break;
                response.body().close();
                if (++hops > MAX_REDIRECTS) {
                    return ToolResult.failure("Too many redirects", status);
                }
                var next = request.uri().resolve(location);
                try {
                    guard.check(next.toString());
                } catch (IllegalArgumentException e) {
                    return ToolResult.failure("Redirect blocked: " + e.getMessage(), status);
                }
                var redirected = HttpRequest.newBuilder(next).timeout(requestTimeout);
                request = "HEAD".equals(method) ? redirected.method("HEAD", HttpRequest.BodyPublishers.noBody()).build()
                        : redirected.GET().build();
            }
        } catch (HttpTimeoutException e) {
            return ToolResult.failure("Request timed out");
        } catch (IOException e) {
            return ToolResult.failure("Network connection error: " + e.getMessage());
        }

        var declared = response.headers().firstValueAsLong("content-length").orElse(-1L);
        if (declared > maxSize) {
            response.body().close();
            return ToolResult.failure("Response size exceeded limit", response.statusCode());
        }
        var bytes = readBounded(response.body(), maxSize);
        if (bytes.length > maxSize) {
            return ToolResult.failure("Response size exceeded limit", response.statusCode());
        }
        var text = new String(bytes, StandardCharsets.UTF_8);
        var contentType = response.headers().firstValue("content-type").orElse("");
        Object data = contentType.contains("application/json") && !text.isBlank()
                ? MAPPER.readValue(text, Object.class)
                : text;

        return new ToolResult(true, response.statusCode(), data, null,
                response.uri().toString(), flattenHeaders(response.headers().map()));
    }

    // Reads at most maxSize + 1 bytes so an oversized body is detected without buffering all of it.
    private static byte[] readBounded(InputStream body, long maxSize) throws IOException {
        try (body) {
            return body.readNBytes((int) Math.min(maxSize + 1, Integer.MAX_VALUE - 8));
        }
    }

    static void validateUrl(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid URL: " + url, e);
        }
        var scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("Only HTTP and HTTPS URLs are allowed, got: " + scheme);
        }
        var host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("URL must have a valid hostname");
        }
        if (BLOCKED_HOSTS.contains(host.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Access to localhost is not allowed");
        }
        if (isIpLiteral(host)) {
            InetAddress addr;
            try {
                addr = InetAddress.getByName(host);
            } catch (IOException e) {
                throw new IllegalArgumentException("Invalid URL host: " + host, e);
            }
            if (addr.isLoopbackAddress() || addr.isSiteLocalAddress() || addr.isLinkLocalAddress()
                    || addr.isMulticastAddress() || addr.isAnyLocalAddress()) {
                throw new IllegalArgumentException("Access to private/internal IP addresses is not allowed: " + host);
            }
        }
    }

    // Only literal addresses are checked; hostnames are not resolved.
    private static boolean isIpLiteral(String host) {
        return host.startsWith("[") || host.matches("\\d{1,3}(\\.\\d{1,3}){3}");
    }

    private static HttpRequest.BodyPublisher bodyPublisher(Map<String, Object> args, HttpRequest.Builder builder)
            throws IOException {
        var json = args.get("json_body");
        if (json != null) {
            builder.header("Content-Type", "application/json");
            return HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(json));
        }
        var data = args.get("data_body");
        if (data instanceof Map<?, ?> form) {
            builder.header("Content-Type", "application/x-www-form-urlencoded");
            return HttpRequest.BodyPublishers.ofString(encode(form));
        }
        if (data != null) {
            return HttpRequest.BodyPublishers.ofString(String.valueOf(data));
        }
        return HttpRequest.BodyPublishers.noBody();
    }

    private static String withQuery(String url, Map<String, Object> params) {
        if (params.isEmpty()) return url;
        return url + (url.contains("?") ? "&" : "?") + encode(params);
    }

    private static String encode(Map<?, ?> values) {
        return values.entrySet().stream()
                .map(e -> URLEncoder.encode(String.valueOf(e.getKey()), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(String.valueOf(e.getValue()), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }

    private static Map<String, String> flattenHeaders(Map<String, List<String>> headers) {
        var flat = new LinkedHashMap<String, String>();
        headers.forEach((k, vals) -> flat.put(k, String.join(", ", vals)));
        return flat;
    }
}
