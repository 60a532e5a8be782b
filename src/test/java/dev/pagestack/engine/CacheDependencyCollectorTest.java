package dev.pagestack.engine;

import dev.pagestack.engine.model.CacheDependencies;
import dev.pagestack.engine.model.DataSourceDeclaration;
import dev.pagestack.engine.model.RetrieveMode;
import dev.pagestack.engine.model.SectionNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CacheDependencyCollector")
class CacheDependencyCollectorTest {

    private static DataSourceDeclaration declaration(String table, boolean currentUser) {
        return new DataSourceDeclaration(table, null, null, currentUser, RetrieveMode.ALL, true, null, null);
    }

    @Test
    @DisplayName("should split tables by user scoping across the whole tree")
    void shouldCollectTables() {
        SectionNode child = SectionNode.builder().id(2L)
                .dataSources(List.of(declaration("orders", true), declaration("news", false)))
                .build();
        SectionNode root = SectionNode.builder().id(1L)
                .dataSources(List.of(declaration("orders", false), declaration("faq", false)))
                .children(List.of(child))
                .build();

        CacheDependencies dependencies = CacheDependencyCollector.collect(List.of(root));

        assertThat(dependencies.userScopedTables()).containsExactly("orders");
        assertThat(dependencies.sharedTables()).containsExactlyInAnyOrder("faq", "news");
        assertThat(dependencies.isUserScoped()).isTrue();
        assertThat(dependencies.allTables()).containsExactly("faq", "news", "orders");
    }

    @Test
    @DisplayName("should report no dependencies for a static page")
    void shouldHandleStaticPage() {
        CacheDependencies dependencies = CacheDependencyCollector.collect(List.of(SectionNode.builder().id(1L).build()));

        assertThat(dependencies.isUserScoped()).isFalse();
        assertThat(dependencies.allTables()).isEmpty();
    }
}
