package com.toolhub.internal.tools;

import com.toolhub.registry.TypeRegistry;
import com.toolhub.tool.echo.EchoToolProvider;
import com.toolhub.tool.rest.RestToolProvider;
import com.toolhub.tools.ToolProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Registers the built-in tool types with a {@link TypeRegistry}. Each provider is registered
 * lazily, so a built-in type nobody uses is never resolved. Call before discovering additional
 * providers so built-in type ids take precedence.
 */
public final class InternalTools {

    private static final Logger log = LoggerFactory.getLogger(InternalTools.class);

    private InternalTools() {
    }

    /** Built-in providers, in registration order. */
    public static List<ToolProvider> providers() {
        return List.of(new EchoToolProvider(), new RestToolProvider());
    }

    /**
     * Registers all enabled built-in providers whose type is not registered yet.
     *
     * @return number of types registered
     */
    public static int registerInternalTools(TypeRegistry typeRegistry) {
        if (typeRegistry == null) return 0;
        int registered = 0;
        for (ToolProvider provider : providers()) {
            if (register(typeRegistry, provider)) registered++;
        }
        log.info("Registered {} internal tool type(s)", registered);
        return registered;
    }

    private static boolean register(TypeRegistry typeRegistry, ToolProvider provider) {
        if (!provider.isEnabled()) {
            log.debug("Internal tool type {} is disabled", provider.getTypeId());
            return false;
        }
        if (typeRegistry.isRegistered(provider.getTypeId())) {
            log.debug("Internal tool type {} already registered; keeping existing registration", provider.getTypeId());
            return false;
        }
        typeRegistry.registerProvider(provider);
        return true;
    }
}
