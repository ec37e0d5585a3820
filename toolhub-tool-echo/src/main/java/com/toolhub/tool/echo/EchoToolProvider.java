package com.toolhub.tool.echo;

import com.toolhub.tools.ToolFactory;
import com.toolhub.tools.ToolProvider;

/**
 * Provider for the {@value #TYPE_ID} type. Catalog entries of this type echo their {@code text}
 * argument; the optional {@code prefix} setting is prepended.
 */
public final class EchoToolProvider implements ToolProvider {

    public static final String TYPE_ID = "EchoTool";

    @Override
    public String getTypeId() {
        return TYPE_ID;
    }

    @Override
    public ToolFactory createFactory() {
        return spec -> {
            Object prefix = spec.getSetting(EchoTool.SETTING_PREFIX);
            return new EchoTool(prefix != null ? prefix.toString() : "");
        };
    }

    @Override
    public String getDescription() {
        return "Echoes the given text. Use for testing or simple passthrough.";
    }
}
