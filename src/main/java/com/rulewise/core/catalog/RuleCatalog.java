package com.rulewise.core.catalog;

import com.rulewise.core.model.RuleCategory;
import com.rulewise.core.model.RuleDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, path-indexed set of rule descriptors in catalog order.
 */
public final class RuleCatalog {

    private final List<RuleDescriptor> descriptors;
    private final Map<String, RuleDescriptor> byPath;

    public RuleCatalog(List<RuleDescriptor> descriptors) {
        var index = new LinkedHashMap<String, RuleDescriptor>();
        for (var d : descriptors) {
            if (index.putIfAbsent(d.path(), d) != null) {
                throw new IllegalArgumentException("Duplicate rule path: " + d.path());
            }
        }
        this.descriptors = List.copyOf(descriptors);
        this.byPath = Collections.unmodifiableMap(index);
    }

    public static RuleCatalog of(RuleDescriptor... descriptors) {
        return new RuleCatalog(List.of(descriptors));
    }

    public List<RuleDescriptor> descriptors() {
        return descriptors;
    }

    public Optional<RuleDescriptor> find(String path) {
        return Optional.ofNullable(byPath.get(path));
    }

    public List<RuleDescriptor> byCategory(RuleCategory category) {
        return descriptors.stream().filter(d -> d.category() == category).toList();
    }

    public int size() {
        return descriptors.size();
    }

    public boolean isEmpty() {
        return descriptors.isEmpty();
    }
}
