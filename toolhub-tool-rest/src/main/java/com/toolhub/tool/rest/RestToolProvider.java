package com.toolhub.tool.rest;

import com.toolhub.tools.ToolFactory;
import com.toolhub.tools.ToolProvider;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Provider for the {@value #TYPE_ID} type: generic HTTP JSON tools configured by catalog settings.
 * All tools of this type share one {@link HttpClient}, created when the type is first resolved.
 */
public final class RestToolProvider implements ToolProvider {

    public static final String TYPE_ID = "RESTTool";

    private final Function<String, String> env;

    public RestToolProvider() {
        this(System::getenv);
    }

    /** @param env environment lookup for credential variables */
    public RestToolProvider(Function<String, String> env) {
        this.env = Objects.requireNonNull(env, "env");
    }

    @Override
    public String getTypeId() {
        return TYPE_ID;
    }

    @Override
    public ToolFactory createFactory() {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        return spec -> RestTool.create(spec, env, httpClient);
    }

    @Override
    public String getDescription() {
        return "Calls an HTTP JSON API (endpoint template, method and credential from settings).";
    }

    @Override
    public List<String> getRequiredClasses() {
        return List.of("java.net.http.HttpClient");
    }
}
