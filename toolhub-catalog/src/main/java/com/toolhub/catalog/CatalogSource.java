package com.toolhub.catalog;

import com.toolhub.tools.spec.ToolSpec;

import java.util.List;

/**
 * Supplier of tool specifications for the catalog (configuration files, category subsets,
 * generated definitions). Sources only read; {@link ToolCatalog} owns deduplication.
 */
public interface CatalogSource {

    /** Source name for logging (e.g. file path). */
    String getName();

    /**
     * Reads all tool specifications of this source.
     *
     * @throws CatalogLoadException if the source cannot be read or a definition is invalid
     */
    List<ToolSpec> read();
}
