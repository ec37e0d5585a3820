package com.toolhub.tool.echo;

import com.toolhub.tools.ExecutionContext;
import com.toolhub.tools.Tool;

import java.util.Map;

/**
 * Returns the {@code text} argument unchanged, optionally prefixed with the {@code prefix} setting.
 * Useful as a smoke test of the call path.
 */
public final class EchoTool implements Tool {

    static final String ARG_TEXT = "text";
    static final String SETTING_PREFIX = "prefix";

    private final String prefix;

    public EchoTool(String prefix) {
        this.prefix = prefix != null ? prefix : "";
    }

    @Override
    public Object execute(Map<String, Object> arguments, ExecutionContext context) {
        Object text = arguments.get(ARG_TEXT);
        String value = text != null ? text.toString() : "";
        return prefix.isEmpty() ? value : prefix + value;
    }
}
