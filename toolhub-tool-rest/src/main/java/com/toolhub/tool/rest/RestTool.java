package com.toolhub.tool.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolhub.tools.ExecutionContext;
import com.toolhub.tools.Tool;
import com.toolhub.tools.error.ExecutionFailure;
import com.toolhub.tools.error.ToolAuthException;
import com.toolhub.tools.error.ToolConfigException;
import com.toolhub.tools.error.ToolException;
import com.toolhub.tools.error.ToolRateLimitException;
import com.toolhub.tools.error.ToolServerException;
import com.toolhub.tools.error.ToolTimeoutException;
import com.toolhub.tools.error.ToolValidationException;
import com.toolhub.tools.spec.ToolSpec;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Calls an HTTP JSON API described entirely by catalog settings.
 * <p>
 * Settings: {@code endpoint} (required; URL template whose {@code {name}} placeholders are filled
 * from arguments), {@code method} (GET, POST, PUT, DELETE; default GET), {@code apiKeyEnv}
 * (environment variable holding a credential), {@code apiKeyHeader} (default Authorization, sent as
 * a bearer token), {@code timeoutSeconds} (default 30) and {@code headers} (static headers).
 * <p>
 * Arguments not used by placeholders become the query string for GET and DELETE, or the JSON body
 * for POST and PUT. The result is {@code {"data": <parsed body>, "metadata": {...}}}.
 */
public final class RestTool implements Tool {

    static final String SETTING_ENDPOINT = "endpoint";
    static final String SETTING_METHOD = "method";
    static final String SETTING_API_KEY_ENV = "apiKeyEnv";
    static final String SETTING_API_KEY_HEADER = "apiKeyHeader";
    static final String SETTING_TIMEOUT_SECONDS = "timeoutSeconds";
    static final String SETTING_HEADERS = "headers";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+)}");
    private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "DELETE");
    private static final int DEFAULT_TIMEOUT_SECONDS = 30;
    private static final int MAX_ERROR_BODY = 500;

    private final String name;
    private final String endpoint;
    private final String method;
    private final Map<String, String> headers;
    private final Duration timeout;
    private final HttpClient httpClient;

    RestTool(String name, String endpoint, String method, Map<String, String> headers, Duration timeout, HttpClient httpClient) {
        this.name = name;
        this.endpoint = endpoint;
        this.method = method;
        this.headers = Map.copyOf(headers);
        this.timeout = timeout;
        this.httpClient = httpClient;
    }

    /**
     * Builds a tool from its spec.
     *
     * @param env environment lookup for {@code apiKeyEnv}
     * @throws ToolConfigException if a setting is missing or invalid, or the credential variable is unset
     */
    static RestTool create(ToolSpec spec, Function<String, String> env, HttpClient httpClient) throws ToolConfigException {
        String name = spec.getName();
        String endpoint = spec.getStringSetting(SETTING_ENDPOINT, null);
        if (endpoint == null) {
            throw new ToolConfigException("Tool " + name + " has no '" + SETTING_ENDPOINT + "' setting",
                    List.of("Add an 'endpoint' URL to the tool definition"), Map.of("setting", SETTING_ENDPOINT), null);
        }
        checkEndpoint(name, endpoint);

        String method = spec.getStringSetting(SETTING_METHOD, "GET").toUpperCase(Locale.ROOT);
        if (!METHODS.contains(method)) {
            throw new ToolConfigException("Tool " + name + " has unsupported method " + method,
                    List.of("Use one of " + METHODS), Map.of("setting", SETTING_METHOD), null);
        }

        Map<String, String> headers = new LinkedHashMap<>();
        Object configured = spec.getSetting(SETTING_HEADERS);
        if (configured instanceof Map) {
            ((Map<?, ?>) configured).forEach((k, v) -> {
                if (k != null && v != null) headers.put(k.toString(), v.toString());
            });
        }
        String apiKeyEnv = spec.getStringSetting(SETTING_API_KEY_ENV, null);
        if (apiKeyEnv != null) {
            String key = env.apply(apiKeyEnv);
            if (key == null || key.isBlank()) {
                throw ToolConfigException.missingEnv(name, apiKeyEnv);
            }
            String header = spec.getStringSetting(SETTING_API_KEY_HEADER, "Authorization");
            headers.put(header, "Authorization".equalsIgnoreCase(header) ? "Bearer " + key.trim() : key.trim());
        }

        int seconds = parseTimeout(name, spec.getSetting(SETTING_TIMEOUT_SECONDS));
        return new RestTool(name, endpoint, method, headers, Duration.ofSeconds(seconds), httpClient);
    }

    @Override
    public Object execute(Map<String, Object> arguments, ExecutionContext context) throws Exception {
        Map<String, Object> remaining = new LinkedHashMap<>(arguments);
        String path = expand(remaining);
        boolean hasBody = "POST".equals(method) || "PUT".equals(method);
        String url = hasBody ? path : withQuery(path, query(remaining));

        Duration requestTimeout = context.remaining()
                .map(left -> left.compareTo(timeout) < 0 ? left : timeout)
                .orElse(timeout);
        if (requestTimeout.isZero()) {
            throw new ToolTimeoutException("Deadline exceeded before calling " + name);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                .timeout(requestTimeout)
                .header("Accept", "application/json");
        headers.forEach(builder::header);
        if (hasBody) {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(remaining), StandardCharsets.UTF_8));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw statusError(status, response.body());
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("endpoint", path);
        metadata.put("status", status);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("data", parseBody(response.body()));
        out.put("metadata", metadata);
        return out;
    }

    private String expand(Map<String, Object> remaining) throws ToolValidationException {
        Matcher m = PLACEHOLDER.matcher(endpoint);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String param = m.group(1);
            Object value = remaining.remove(param);
            if (value == null) {
                throw new ToolValidationException("Missing value for path parameter '" + param + "'",
                        Map.of("parameter", param));
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(encode(value.toString()).replace("+", "%20")));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String query(Map<String, Object> params) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Object> e : params.entrySet()) {
            Object v = e.getValue();
            if (v == null) continue;
            if (v instanceof Collection) {
                for (Object item : (Collection<?>) v) {
                    if (item != null) appendParam(sb, e.getKey(), item);
                }
            } else {
                appendParam(sb, e.getKey(), v);
            }
        }
        return sb.toString();
    }

    /** Appends {@code query} to {@code path}, after any query string the endpoint already has. */
    static String withQuery(String path, String query) {
        if (query.isEmpty()) return path;
        if (path.indexOf('?') < 0) return path + "?" + query;
        return path.endsWith("?") || path.endsWith("&") ? path + query : path + "&" + query;
    }

    private static void appendParam(StringBuilder sb, String key, Object value) {
        if (sb.length() > 0) sb.append('&');
        sb.append(encode(key)).append('=').append(encode(value.toString()));
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static Object parseBody(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            return MAPPER.readValue(body, Object.class);
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    private ToolException statusError(int status, String body) {
        String snippet = body == null ? "" : body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) : body;
        String message = name + " returned HTTP " + status;
        Map<String, Object> details = Map.of("status", status, "body", snippet);
        if (status == 401 || status == 403) {
            return new ToolAuthException(message, null, details, null);
        }
        if (status == 429) {
            return new ToolRateLimitException(message, null, details, null);
        }
        if (status >= 500) {
            return new ToolServerException(message, null, details, null);
        }
        return new ToolException(message, ExecutionFailure.TRANSIENT, false,
                List.of("Check the request arguments", "Check the endpoint path"), details, null);
    }

    private static void checkEndpoint(String name, String endpoint) throws ToolConfigException {
        try {
            URI uri = URI.create(PLACEHOLDER.matcher(endpoint).replaceAll("x"));
            String scheme = uri.getScheme();
            if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new IllegalArgumentException("expected an absolute http(s) URL");
            }
        } catch (IllegalArgumentException e) {
            throw new ToolConfigException("Tool " + name + " has an invalid endpoint '" + endpoint + "': " + e.getMessage(),
                    List.of("Fix the 'endpoint' URL in the tool definition"), Map.of("setting", SETTING_ENDPOINT), e);
        }
    }

    private static int parseTimeout(String name, Object value) throws ToolConfigException {
        if (value == null) return DEFAULT_TIMEOUT_SECONDS;
        try {
            int seconds = value instanceof Number ? ((Number) value).intValue() : Integer.parseInt(value.toString().trim());
            if (seconds <= 0) throw new NumberFormatException("must be positive");
            return seconds;
        } catch (NumberFormatException e) {
            throw new ToolConfigException("Tool " + name + " has an invalid timeoutSeconds: " + value,
                    List.of("Set timeoutSeconds to a positive integer"), Map.of("setting", SETTING_TIMEOUT_SECONDS), e);
        }
    }
}
