package com.toolhub.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Engine configuration loaded from environment variables.
 * <p>
 * Catalog: TOOLHUB_CATALOG_PATHS (comma-separated files or directories of JSON tool definitions).
 * Filtering: TOOLHUB_INCLUDE_TOOLS, TOOLHUB_EXCLUDE_TOOLS, TOOLHUB_INCLUDE_CATEGORIES.
 * Execution: TOOLHUB_DEFAULT_TIMEOUT_SECONDS (0 = none), TOOLHUB_EXECUTOR_THREADS.
 * Result cache: TOOLHUB_RESULT_CACHE_SIZE (0 = disabled), TOOLHUB_RESULT_CACHE_TTL_SECONDS.
 * Health: TOOLHUB_HEALTH_MAX_RECORDS.
 */
public final class ToolhubConfig {

    static final String ENV_CATALOG_PATHS = "TOOLHUB_CATALOG_PATHS";
    static final String ENV_INCLUDE_TOOLS = "TOOLHUB_INCLUDE_TOOLS";
    static final String ENV_EXCLUDE_TOOLS = "TOOLHUB_EXCLUDE_TOOLS";
    static final String ENV_INCLUDE_CATEGORIES = "TOOLHUB_INCLUDE_CATEGORIES";
    static final String ENV_DEFAULT_TIMEOUT_SECONDS = "TOOLHUB_DEFAULT_TIMEOUT_SECONDS";
    static final String ENV_EXECUTOR_THREADS = "TOOLHUB_EXECUTOR_THREADS";
    static final String ENV_RESULT_CACHE_SIZE = "TOOLHUB_RESULT_CACHE_SIZE";
    static final String ENV_RESULT_CACHE_TTL_SECONDS = "TOOLHUB_RESULT_CACHE_TTL_SECONDS";
    static final String ENV_HEALTH_MAX_RECORDS = "TOOLHUB_HEALTH_MAX_RECORDS";

    private static final int DEFAULT_TIMEOUT_SECONDS = 0;
    private static final int DEFAULT_EXECUTOR_THREADS = Math.max(4, Runtime.getRuntime().availableProcessors());
    private static final int DEFAULT_RESULT_CACHE_SIZE = 256;
    private static final int DEFAULT_RESULT_CACHE_TTL_SECONDS = 300;
    private static final int DEFAULT_HEALTH_MAX_RECORDS = 10_000;

    private final List<String> catalogPaths;
    private final List<String> includeTools;
    private final List<String> excludeTools;
    private final List<String> includeCategories;
    private final Duration defaultTimeout;
    private final int executorThreads;
    private final int resultCacheSize;
    private final Duration resultCacheTtl;
    private final int healthMaxRecords;

    private ToolhubConfig(Builder b) {
        this.catalogPaths = Collections.unmodifiableList(new ArrayList<>(b.catalogPaths));
        this.includeTools = Collections.unmodifiableList(new ArrayList<>(b.includeTools));
        this.excludeTools = Collections.unmodifiableList(new ArrayList<>(b.excludeTools));
        this.includeCategories = Collections.unmodifiableList(new ArrayList<>(b.includeCategories));
        this.defaultTimeout = b.defaultTimeout;
        this.executorThreads = b.executorThreads > 0 ? b.executorThreads : DEFAULT_EXECUTOR_THREADS;
        this.resultCacheSize = Math.max(0, b.resultCacheSize);
        this.resultCacheTtl = b.resultCacheTtl;
        this.healthMaxRecords = b.healthMaxRecords > 0 ? b.healthMaxRecords : DEFAULT_HEALTH_MAX_RECORDS;
    }

    public static ToolhubConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Reads configuration from the given variables (tests pass a map instead of the process environment). */
    public static ToolhubConfig fromEnvironment(Map<String, String> env) {
        Map<String, String> e = env != null ? env : Map.of();
        return builder()
                .catalogPaths(parseCommaSeparated(e.get(ENV_CATALOG_PATHS)))
                .includeTools(parseCommaSeparated(e.get(ENV_INCLUDE_TOOLS)))
                .excludeTools(parseCommaSeparated(e.get(ENV_EXCLUDE_TOOLS)))
                .includeCategories(parseCommaSeparated(e.get(ENV_INCLUDE_CATEGORIES)))
                .defaultTimeout(Duration.ofSeconds(parseInt(e.get(ENV_DEFAULT_TIMEOUT_SECONDS), DEFAULT_TIMEOUT_SECONDS)))
                .executorThreads(parseInt(e.get(ENV_EXECUTOR_THREADS), DEFAULT_EXECUTOR_THREADS))
                .resultCacheSize(parseInt(e.get(ENV_RESULT_CACHE_SIZE), DEFAULT_RESULT_CACHE_SIZE))
                .resultCacheTtl(Duration.ofSeconds(parseInt(e.get(ENV_RESULT_CACHE_TTL_SECONDS), DEFAULT_RESULT_CACHE_TTL_SECONDS)))
                .healthMaxRecords(parseInt(e.get(ENV_HEALTH_MAX_RECORDS), DEFAULT_HEALTH_MAX_RECORDS))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Catalog files or directories, loaded in order. */
    public List<String> getCatalogPaths() {
        return catalogPaths;
    }

    /** Tool names or glob patterns to keep; empty = all. */
    public List<String> getIncludeTools() {
        return includeTools;
    }

    public List<String> getExcludeTools() {
        return excludeTools;
    }

    /** Categories to keep; empty = all. */
    public List<String> getIncludeCategories() {
        return includeCategories;
    }

    /** Timeout applied to calls that carry none; zero = no deadline. */
    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public int getResultCacheSize() {
        return resultCacheSize;
    }

    public Duration getResultCacheTtl() {
        return resultCacheTtl;
    }

    public int getHealthMaxRecords() {
        return healthMaxRecords;
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static final class Builder {
        private List<String> catalogPaths = List.of();
        private List<String> includeTools = List.of();
        private List<String> excludeTools = List.of();
        private List<String> includeCategories = List.of();
        private Duration defaultTimeout = Duration.ZERO;
        private int executorThreads = DEFAULT_EXECUTOR_THREADS;
        private int resultCacheSize = DEFAULT_RESULT_CACHE_SIZE;
        private Duration resultCacheTtl = Duration.ofSeconds(DEFAULT_RESULT_CACHE_TTL_SECONDS);
        private int healthMaxRecords = DEFAULT_HEALTH_MAX_RECORDS;

        public Builder catalogPaths(List<String> catalogPaths) {
            this.catalogPaths = Objects.requireNonNull(catalogPaths, "catalogPaths");
            return this;
        }

        public Builder includeTools(List<String> includeTools) {
            this.includeTools = includeTools != null ? includeTools : List.of();
            return this;
        }

        public Builder excludeTools(List<String> excludeTools) {
            this.excludeTools = excludeTools != null ? excludeTools : List.of();
            return this;
        }

        public Builder includeCategories(List<String> includeCategories) {
            this.includeCategories = includeCategories != null ? includeCategories : List.of();
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout != null && !defaultTimeout.isNegative() ? defaultTimeout : Duration.ZERO;
            return this;
        }

        public Builder executorThreads(int executorThreads) {
            this.executorThreads = executorThreads;
            return this;
        }

        public Builder resultCacheSize(int resultCacheSize) {
            this.resultCacheSize = resultCacheSize;
            return this;
        }

        public Builder resultCacheTtl(Duration resultCacheTtl) {
            this.resultCacheTtl = resultCacheTtl != null ? resultCacheTtl : Duration.ZERO;
            return this;
        }

        public Builder healthMaxRecords(int healthMaxRecords) {
            this.healthMaxRecords = healthMaxRecords;
            return this;
        }

        public ToolhubConfig build() {
            return new ToolhubConfig(this);
        }
    }
}
