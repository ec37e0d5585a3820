package com.toolhub.catalog;

import com.toolhub.tools.spec.ToolSpec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Predicate over catalog entries: by type, by category, by name glob ({@code *} and {@code ?}),
 * by keywords (every term must occur in name, description or category, case-insensitive), and by
 * explicit include/exclude name lists. Criteria combine with AND; an unset criterion matches all.
 */
public final class CatalogFilter {

    private static final CatalogFilter ALL = builder().build();

    private final Set<String> types;
    private final Set<String> categories;
    private final Pattern namePattern;
    private final List<String> keywords;
    private final Set<String> includeNames;
    private final Set<String> excludeNames;

    private CatalogFilter(Builder b) {
        this.types = Set.copyOf(b.types);
        this.categories = Set.copyOf(b.categories);
        this.namePattern = b.nameGlob != null ? globToPattern(b.nameGlob) : null;
        this.keywords = List.copyOf(b.keywords);
        this.includeNames = Set.copyOf(b.includeNames);
        this.excludeNames = Set.copyOf(b.excludeNames);
    }

    public static CatalogFilter all() {
        return ALL;
    }

    public static CatalogFilter byType(String... types) {
        return builder().types(List.of(types)).build();
    }

    public static CatalogFilter byCategory(String... categories) {
        return builder().categories(List.of(categories)).build();
    }

    public static CatalogFilter byNamePattern(String glob) {
        return builder().namePattern(glob).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean matches(ToolSpec spec) {
        if (spec == null) return false;
        String name = spec.getName();
        if (!includeNames.isEmpty() && !includeNames.contains(name)) return false;
        if (excludeNames.contains(name)) return false;
        if (!types.isEmpty() && !types.contains(spec.getType())) return false;
        if (!categories.isEmpty() && (spec.getCategory() == null || !categories.contains(spec.getCategory()))) return false;
        if (namePattern != null && !namePattern.matcher(name).matches()) return false;
        if (!keywords.isEmpty()) {
            String haystack = (name + " " + spec.getDescription() + " "
                    + (spec.getCategory() != null ? spec.getCategory() : "")).toLowerCase(Locale.ROOT);
            for (String k : keywords) {
                if (!haystack.contains(k)) return false;
            }
        }
        return true;
    }

    static Pattern globToPattern(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) regex.append(Pattern.quote(literal.toString()));
        return Pattern.compile(regex.toString());
    }

    public static final class Builder {
        private final Set<String> types = new LinkedHashSet<>();
        private final Set<String> categories = new LinkedHashSet<>();
        private String nameGlob;
        private final List<String> keywords = new ArrayList<>();
        private final Set<String> includeNames = new LinkedHashSet<>();
        private final Set<String> excludeNames = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder types(Collection<String> values) {
            addTrimmed(types, values);
            return this;
        }

        public Builder categories(Collection<String> values) {
            addTrimmed(categories, values);
            return this;
        }

        public Builder namePattern(String glob) {
            this.nameGlob = glob != null && !glob.isBlank() ? glob.trim() : null;
            return this;
        }

        /** Splits the query on whitespace; every term must match. */
        public Builder keywords(String query) {
            if (query != null) {
                for (String term : query.trim().split("\\s+")) {
                    if (!term.isEmpty()) keywords.add(term.toLowerCase(Locale.ROOT));
                }
            }
            return this;
        }

        public Builder include(Collection<String> names) {
            addTrimmed(includeNames, names);
            return this;
        }

        public Builder exclude(Collection<String> names) {
            addTrimmed(excludeNames, names);
            return this;
        }

        private static void addTrimmed(Set<String> target, Collection<String> values) {
            if (values == null) return;
            for (String v : values) {
                if (v != null && !v.isBlank()) target.add(v.trim());
            }
        }

        public CatalogFilter build() {
            return new CatalogFilter(this);
        }
    }
}
