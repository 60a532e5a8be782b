package dev.pagestack.engine;

import dev.pagestack.engine.model.CacheDependencies;
import dev.pagestack.engine.model.DataSourceDeclaration;
import dev.pagestack.engine.model.SectionNode;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Derives the data tables a page render depends on by walking every declaration of the tree.
 * A table read with {@code current_user} makes the render user-specific.
 */
public final class CacheDependencyCollector {

    private CacheDependencyCollector() {}

    public static CacheDependencies collect(List<SectionNode> tree) {
        Set<String> userScoped = new TreeSet<>();
        Set<String> shared = new TreeSet<>();
        walk(tree, userScoped, shared);
        shared.removeAll(userScoped);
        return new CacheDependencies(userScoped, shared);
    }

    private static void walk(List<SectionNode> nodes, Set<String> userScoped, Set<String> shared) {
        for (SectionNode node : nodes) {
            for (DataSourceDeclaration declaration : node.dataSources()) {
                (declaration.currentUser() ? userScoped : shared).add(declaration.table());
            }
            walk(node.children(), userScoped, shared);
        }
    }
}
