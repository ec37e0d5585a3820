package com.toolhub.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolhub.tools.spec.ParameterSchema;
import com.toolhub.tools.spec.ToolSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads tool definitions from JSON: a single file, every {@code *.json} file of a directory
 * (sorted by file name), or a classpath resource. A file holds an array of tool objects or a
 * single tool object:
 * <pre>
 * [{"name": "PubMed_search_articles", "type": "PubMedRESTTool", "description": "...",
 *   "parameter": {"type": "object", "properties": {...}, "required": [...]},
 *   "endpoint": "https://eutils.ncbi.nlm.nih.gov/..."}]
 * </pre>
 * Unknown top-level fields are tool settings (merged with an explicit {@code settings} object).
 * The category defaults to the file stem ({@code pubmed_tools.json} gives {@code pubmed_tools}).
 */
public final class JsonCatalogSource implements CatalogSource {

    private static final Logger log = LoggerFactory.getLogger(JsonCatalogSource.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final Set<String> KNOWN_FIELDS = Set.of(
            "name", "type", "description", "category", "parameter", "settings", "concurrentExecute", "cacheable");

    private final Path path;
    private final String resource;
    private final ClassLoader classLoader;

    private JsonCatalogSource(Path path, String resource, ClassLoader classLoader) {
        this.path = path;
        this.resource = resource;
        this.classLoader = classLoader;
    }

    /** Source for a JSON file or a directory of JSON files. */
    public static JsonCatalogSource fromPath(Path path) {
        return new JsonCatalogSource(Objects.requireNonNull(path, "path"), null, null);
    }

    /** Source for a JSON classpath resource (e.g. {@code catalog/builtin_tools.json}). */
    public static JsonCatalogSource fromClasspath(String resource, ClassLoader classLoader) {
        Objects.requireNonNull(resource, "resource");
        ClassLoader cl = classLoader != null ? classLoader : JsonCatalogSource.class.getClassLoader();
        return new JsonCatalogSource(null, resource, cl);
    }

    @Override
    public String getName() {
        return path != null ? path.toString() : "classpath:" + resource;
    }

    @Override
    public List<ToolSpec> read() {
        if (resource != null) {
            return readResource();
        }
        if (!Files.exists(path)) {
            throw new CatalogLoadException("Catalog path does not exist: " + path);
        }
        if (Files.isDirectory(path)) {
            return readDirectory();
        }
        return readFile(path);
    }

    private List<ToolSpec> readDirectory() {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(path, "*.json")) {
            for (Path file : stream) files.add(file);
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to list catalog directory " + path + ": " + e.getMessage(), e);
        }
        files.sort(null);
        List<ToolSpec> out = new ArrayList<>();
        for (Path file : files) {
            out.addAll(readFile(file));
        }
        log.info("Read {} tool definition(s) from {} file(s) in {}", out.size(), files.size(), path);
        return out;
    }

    private List<ToolSpec> readFile(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(MAPPER.readTree(in), stem(file.getFileName().toString()), file.toString());
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to read catalog file " + file + ": " + e.getMessage(), e);
        }
    }

    private List<ToolSpec> readResource() {
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new CatalogLoadException("Catalog resource not found on classpath: " + resource);
            }
            String fileName = resource.contains("/") ? resource.substring(resource.lastIndexOf('/') + 1) : resource;
            return parse(MAPPER.readTree(in), stem(fileName), "classpath:" + resource);
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to read catalog resource " + resource + ": " + e.getMessage(), e);
        }
    }

    static List<ToolSpec> parse(JsonNode root, String defaultCategory, String origin) {
        List<ToolSpec> out = new ArrayList<>();
        if (root == null || root.isNull() || root.isMissingNode()) {
            return out;
        }
        if (root.isArray()) {
            int index = 0;
            for (JsonNode node : root) {
                out.add(parseTool(node, defaultCategory, origin + "[" + index++ + "]"));
            }
        } else if (root.isObject()) {
            out.add(parseTool(root, defaultCategory, origin));
        } else {
            throw new CatalogLoadException("Catalog " + origin + " must contain a tool object or an array of tool objects");
        }
        return out;
    }

    private static ToolSpec parseTool(JsonNode node, String defaultCategory, String origin) {
        if (!node.isObject()) {
            throw new CatalogLoadException("Tool definition at " + origin + " is not an object");
        }
        String name = text(node, "name");
        String type = text(node, "type");
        if (name == null || type == null) {
            throw new CatalogLoadException("Tool definition at " + origin + " must have non-blank name and type");
        }
        ToolSpec.Builder b = ToolSpec.builder(name, type)
                .description(text(node, "description"))
                .category(text(node, "category") != null ? text(node, "category") : defaultCategory);
        try {
            JsonNode parameter = node.get("parameter");
            if (parameter != null && parameter.isObject()) {
                b.parameterSchema(MAPPER.treeToValue(parameter, ParameterSchema.class));
            }
            Map<String, Object> settings = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                if (!KNOWN_FIELDS.contains(f.getKey())) {
                    settings.put(f.getKey(), MAPPER.treeToValue(f.getValue(), Object.class));
                }
            }
            JsonNode explicit = node.get("settings");
            if (explicit != null && explicit.isObject()) {
                settings.putAll(MAPPER.convertValue(explicit, MAP_TYPE));
            }
            b.settings(settings);
        } catch (IOException | IllegalArgumentException e) {
            throw new CatalogLoadException("Invalid tool definition " + name + " at " + origin + ": " + e.getMessage(), e);
        }
        JsonNode concurrent = node.get("concurrentExecute");
        if (concurrent != null && concurrent.isBoolean()) b.concurrentExecute(concurrent.booleanValue());
        JsonNode cacheable = node.get("cacheable");
        if (cacheable != null && cacheable.isBoolean()) b.cacheable(cacheable.booleanValue());
        return b.build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || !v.isValueNode()) return null;
        String s = v.asText().trim();
        return s.isEmpty() ? null : s;
    }

    private static String stem(String fileName) {
        return fileName.endsWith(".json") ? fileName.substring(0, fileName.length() - 5) : fileName;
    }
}
