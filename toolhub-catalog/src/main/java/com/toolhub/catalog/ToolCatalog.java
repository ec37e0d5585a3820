package com.toolhub.catalog;

import com.toolhub.tools.spec.ToolSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Catalog of tool specifications indexed by unique tool name.
 * <p>
 * Loading is expected once at startup; each {@link #load} builds a new immutable snapshot and
 * publishes it atomically, so readers ({@link #lookup}, {@link #list}) never lock and never see
 * a partially applied load. A failed load leaves the catalog unchanged.
 */
public final class ToolCatalog {

    private static final Logger log = LoggerFactory.getLogger(ToolCatalog.class);

    private final Object loadLock = new Object();
    private volatile Map<String, ToolSpec> specs = Map.of();

    /**
     * Adds specs to the catalog.
     *
     * @param toLoad specs to add; null entries are rejected
     * @param mode   {@link LoadMode#MERGE} to add to the current content, {@link LoadMode#REPLACE} to start empty
     * @throws DuplicateToolNameException if a name is redefined with a different type
     */
    public void load(Collection<ToolSpec> toLoad, LoadMode mode) {
        Objects.requireNonNull(mode, "mode");
        List<ToolSpec> batch = toLoad != null ? new ArrayList<>(toLoad) : List.of();
        synchronized (loadLock) {
            Map<String, ToolSpec> next = mode == LoadMode.MERGE ? new LinkedHashMap<>(specs) : new LinkedHashMap<>();
            int added = 0;
            int redefined = 0;
            for (ToolSpec spec : batch) {
                Objects.requireNonNull(spec, "spec");
                ToolSpec existing = next.get(spec.getName());
                if (existing != null) {
                    if (!existing.getType().equals(spec.getType())) {
                        throw new DuplicateToolNameException(spec.getName(), existing.getType(), spec.getType());
                    }
                    redefined++;
                } else {
                    added++;
                }
                next.put(spec.getName(), spec);
            }
            specs = Collections.unmodifiableMap(next);
            log.info("Catalog load ({}): {} added, {} redefined, {} total", mode, added, redefined, next.size());
        }
    }

    /** Reads the source and loads its specs. */
    public void load(CatalogSource source, LoadMode mode) {
        Objects.requireNonNull(source, "source");
        List<ToolSpec> read = source.read();
        log.debug("Read {} tool definition(s) from {}", read.size(), source.getName());
        load(read, mode);
    }

    /** Returns the spec for {@code name}, or empty if the name is not in the catalog. */
    public Optional<ToolSpec> lookup(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(specs.get(name));
    }

    public boolean contains(String name) {
        return name != null && specs.containsKey(name);
    }

    /** All specs in load order. */
    public List<ToolSpec> list() {
        return List.copyOf(specs.values());
    }

    /** Specs matching the filter, in load order. Side-effect free. */
    public List<ToolSpec> list(CatalogFilter filter) {
        if (filter == null) return list();
        List<ToolSpec> out = new ArrayList<>();
        for (ToolSpec spec : specs.values()) {
            if (filter.matches(spec)) out.add(spec);
        }
        return Collections.unmodifiableList(out);
    }

    /** Tool names in load order. */
    public Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(specs.keySet()));
    }

    /** Distinct types referenced by the catalog. */
    public Set<String> types() {
        Set<String> out = new LinkedHashSet<>();
        for (ToolSpec spec : specs.values()) out.add(spec.getType());
        return Collections.unmodifiableSet(out);
    }

    /** Distinct categories (null categories are skipped). */
    public Set<String> categories() {
        Set<String> out = new LinkedHashSet<>();
        for (ToolSpec spec : specs.values()) {
            if (spec.getCategory() != null) out.add(spec.getCategory());
        }
        return Collections.unmodifiableSet(out);
    }

    public int size() {
        return specs.size();
    }
}
