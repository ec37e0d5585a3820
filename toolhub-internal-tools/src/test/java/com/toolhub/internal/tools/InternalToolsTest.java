package com.toolhub.internal.tools;

import com.toolhub.catalog.LoadMode;
import com.toolhub.catalog.ToolCatalog;
import com.toolhub.health.HealthTracker;
import com.toolhub.registry.InstanceOutcome;
import com.toolhub.registry.ToolInstanceCache;
import com.toolhub.registry.TypeRegistry;
import com.toolhub.tools.ExecutionContext;
import com.toolhub.tools.Tool;
import com.toolhub.tools.error.ErrorKind;
import com.toolhub.tools.spec.ToolSpec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InternalToolsTest {

    @Test
    void registersBuiltInTypes() {
        TypeRegistry types = new TypeRegistry();

        assertEquals(2, InternalTools.registerInternalTools(types));
        assertEquals(Set.of("EchoTool", "RESTTool"), types.registeredTypes());
    }

    @Test
    void existingRegistrationsAreKept() {
        TypeRegistry types = new TypeRegistry();
        types.registerEager("EchoTool", spec -> (Tool) (args, ctx) -> "custom");

        assertEquals(1, InternalTools.registerInternalTools(types));
        assertEquals(0, InternalTools.registerInternalTools(types));
    }

    @Test
    void builtInEchoIsUsableThroughTheInstanceCache() throws Exception {
        TypeRegistry types = new TypeRegistry();
        InternalTools.registerInternalTools(types);
        ToolCatalog catalog = new ToolCatalog();
        catalog.load(List.of(ToolSpec.builder("Echo", "EchoTool").build()), LoadMode.MERGE);
        ToolInstanceCache cache = new ToolInstanceCache(catalog, types, new HealthTracker());

        Tool echo = cache.getOrCreate("Echo").getInstance().orElseThrow();

        assertEquals("hi", echo.execute(Map.of("text", "hi"), ExecutionContext.unbounded("Echo")));
    }

    @Test
    void restToolWithoutEndpointIsConstructionError() {
        TypeRegistry types = new TypeRegistry();
        InternalTools.registerInternalTools(types);
        ToolCatalog catalog = new ToolCatalog();
        catalog.load(List.of(ToolSpec.builder("Broken", "RESTTool").build()), LoadMode.MERGE);
        HealthTracker health = new HealthTracker();

        InstanceOutcome outcome = new ToolInstanceCache(catalog, types, health).getOrCreate("Broken");

        assertEquals(ErrorKind.CONSTRUCTION, outcome.getError().orElseThrow().getKind());
        assertTrue(health.allUnhealthy().stream().anyMatch(r -> r.getName().equals("Broken")));
    }
}
