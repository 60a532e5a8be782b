package dev.pagestack.engine.model;

import java.util.Set;
import java.util.TreeSet;

/**
 * Data tables a rendered page depends on, split by whether the rows read are user-specific.
 */
public record CacheDependencies(Set<String> userScopedTables, Set<String> sharedTables) {

    public CacheDependencies {
        userScopedTables = Set.copyOf(userScopedTables);
        sharedTables = Set.copyOf(sharedTables);
    }

    public boolean isUserScoped() {
        return !userScopedTables.isEmpty();
    }

    public Set<String> allTables() {
        Set<String> all = new TreeSet<>(userScopedTables);
        all.addAll(sharedTables);
        return all;
    }
}
