package com.toolhub.bootstrap;

import com.toolhub.catalog.CatalogLoadException;
import com.toolhub.engine.CallResult;
import com.toolhub.engine.ToolEngine;
import com.toolhub.engine.ToolhubConfig;
import com.toolhub.registry.TypeRegistry;
import com.toolhub.tools.error.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolhubBootstrapTest {

    private static final String TOOLS_JSON = "["
            + "{\"name\": \"Echo\", \"type\": \"EchoTool\", \"description\": \"Echoes text\", \"category\": \"util\","
            + " \"parameter\": {\"type\": \"object\", \"properties\": {\"text\": {\"type\": \"string\"}}, \"required\": [\"text\"]}},"
            + "{\"name\": \"Shout\", \"type\": \"UppercaseTool\", \"description\": \"Upper-cases text\", \"category\": \"util\","
            + " \"parameter\": {\"type\": \"object\", \"properties\": {\"text\": {\"type\": \"string\"}}, \"required\": [\"text\"]}},"
            + "{\"name\": \"PubMedSearch\", \"type\": \"RESTTool\", \"description\": \"Searches articles\", \"category\": \"literature\","
            + " \"settings\": {\"endpoint\": \"http://localhost:1/search\"}}"
            + "]";

    @TempDir
    Path dir;

    private Path writeCatalog(String fileName, String json) throws IOException {
        Path file = dir.resolve(fileName);
        Files.write(file, json.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static ClassLoader loader() {
        return ToolhubBootstrapTest.class.getClassLoader();
    }

    @Test
    void initializeLoadsCatalogAndCallsBuiltInAndDiscoveredTools() throws IOException {
        Path file = writeCatalog("tools.json", TOOLS_JSON);
        ToolhubConfig config = ToolhubConfig.builder().catalogPaths(List.of(file.toString())).build();

        try (BootstrapContext ctx = ToolhubBootstrap.initialize(config, loader())) {
            ToolEngine engine = ctx.getEngine();
            assertEquals(3, engine.catalog().size());
            assertTrue(ctx.getInternalTypes().containsAll(List.of("EchoTool", "RESTTool")));
            assertEquals(List.of(UppercaseToolProvider.TYPE_ID), ctx.getDiscoveredTypes());

            CallResult echo = engine.call("Echo", Map.of("text", "hi"));
            assertTrue(echo.isSuccess(), echo::toString);
            assertEquals("hi", echo.getPayload());

            CallResult shout = engine.call("Shout", Map.of("text", "hi"));
            assertTrue(shout.isSuccess(), shout::toString);
            assertEquals("HI", shout.getPayload());
        }
    }

    @Test
    void builtInTypeWinsOverDiscoveredProviderWithSameId() throws IOException {
        Path file = writeCatalog("tools.json", TOOLS_JSON);
        ToolhubConfig config = ToolhubConfig.builder().catalogPaths(List.of(file.toString())).build();

        try (BootstrapContext ctx = ToolhubBootstrap.initialize(config, loader())) {
            CallResult echo = ctx.getEngine().call("Echo", Map.of("text", "original"));
            assertEquals("original", echo.getPayload());
        }
    }

    @Test
    void includeExcludeAndCategoryFiltersApplyBeforeLoading() throws IOException {
        Path file = writeCatalog("tools.json", TOOLS_JSON);

        ToolhubConfig byCategory = ToolhubConfig.builder()
                .catalogPaths(List.of(file.toString()))
                .includeCategories(List.of("util"))
                .excludeTools(List.of("Shout"))
                .build();
        try (BootstrapContext ctx = ToolhubBootstrap.initialize(byCategory, loader())) {
            assertEquals(List.of("Echo"), List.copyOf(ctx.getEngine().catalog().names()));
            CallResult excluded = ctx.getEngine().call("Shout", Map.of("text", "hi"));
            assertEquals(ErrorKind.NOT_FOUND, excluded.getError().orElseThrow().getKind());
        }

        ToolhubConfig byName = ToolhubConfig.builder()
                .catalogPaths(List.of(file.toString()))
                .includeTools(List.of("PubMedSearch", "Shout"))
                .build();
        try (BootstrapContext ctx = ToolhubBootstrap.initialize(byName, loader())) {
            assertEquals(List.of("Shout", "PubMedSearch"), List.copyOf(ctx.getEngine().catalog().names()));
        }
    }

    @Test
    void laterCatalogFileRedefinesEarlierEntry() throws IOException {
        Path first = writeCatalog("a.json", TOOLS_JSON);
        Path second = writeCatalog("b.json", "[{\"name\": \"Echo\", \"type\": \"EchoTool\", \"description\": \"Prefixed\","
                + " \"settings\": {\"prefix\": \">> \"}}]");
        ToolhubConfig config = ToolhubConfig.builder()
                .catalogPaths(List.of(first.toString(), second.toString()))
                .build();

        try (BootstrapContext ctx = ToolhubBootstrap.initialize(config, loader())) {
            assertEquals(3, ctx.getEngine().catalog().size());
            assertEquals("Prefixed", ctx.getEngine().catalog().lookup("Echo").orElseThrow().getDescription());
            assertEquals(">> x", ctx.getEngine().call("Echo", Map.of("text", "x")).getPayload());
        }
    }

    @Test
    void missingCatalogPathFailsStartup() {
        ToolhubConfig config = ToolhubConfig.builder()
                .catalogPaths(List.of(dir.resolve("nope.json").toString()))
                .build();
        assertThrows(CatalogLoadException.class, () -> ToolhubBootstrap.initialize(config, loader()));
    }

    @Test
    void noCatalogPathsYieldsEmptyEngine() {
        try (BootstrapContext ctx = ToolhubBootstrap.initialize(ToolhubConfig.builder().build(), loader())) {
            assertEquals(0, ctx.getEngine().catalog().size());
            assertFalse(ctx.getEngine().types().registeredTypes().isEmpty());
        }
    }

    @Test
    void discoverySkipsUnloadableAndAlreadyRegisteredProviders() {
        TypeRegistry types = new TypeRegistry();
        types.registerEager(UppercaseToolProvider.TYPE_ID, spec -> (arguments, context) -> "kept");

        List<String> registered = ToolhubBootstrap.discoverProviders(types, loader());

        assertEquals(List.of("EchoTool"), registered);
        assertTrue(types.isRegistered(UppercaseToolProvider.TYPE_ID));
    }
}
