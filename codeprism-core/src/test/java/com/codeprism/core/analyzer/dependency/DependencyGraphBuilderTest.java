package com.codeprism.core.analyzer.dependency;

import com.codeprism.core.analyzer.AnalyzerTestBase;
import com.codeprism.core.model.DependencyEdge;
import com.codeprism.core.model.DependencyEntry;
import com.codeprism.core.model.EdgeKind;
import com.codeprism.core.model.EntityInventory;
import com.codeprism.core.model.EntityKind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link DependencyGraphBuilder}.
 */
class DependencyGraphBuilderTest extends AnalyzerTestBase {

    private final DependencyGraphBuilder builder = new DependencyGraphBuilder();

    @Test
    void build_classWithMethods_addsStructuralEdgesBothWays() {
        // Given
        EntityInventory inventory = inventory("""
            class Stack:
                def push(self, item):
                    pass

                def pop(self):
                    pass
            """);

        // When
        DependencyGraph graph = builder.build(inventory);

        // Then
        assertThat(graph.edges(EdgeKind.CONTAINS))
            .extracting(DependencyEdge::source, DependencyEdge::target)
            .containsExactly(tuple("Stack", "Stack.push"), tuple("Stack", "Stack.pop"));
        assertThat(graph.dependsOn("Stack.pop")).containsExactly("Stack");
        assertThat(graph.dependedBy("Stack")).containsExactly("Stack.push", "Stack.pop");
    }

    @Test
    void build_selfMethodCall_referencesSameClassMethod() {
        // Given
        EntityInventory inventory = inventory("""
            class Stack:
                def push(self, item):
                    self.check()

                def check(self):
                    return self.size
            """);

        // When
        DependencyGraph graph = builder.build(inventory);

        // Then
        assertThat(graph.edges(EdgeKind.REFERENCES))
            .extracting(DependencyEdge::source, DependencyEdge::target)
            .containsExactly(tuple("Stack.push", "Stack.check"));
    }

    @Test
    void build_qualifiedMethodCall_referencesClassAndMethod() {
        // Given
        EntityInventory inventory = inventory("""
            class Repo:
                def load(self):
                    return 1

            def main():
                return Repo.load()
            """);

        // When
        DependencyGraph graph = builder.build(inventory);

        // Then
        assertThat(graph.dependsOn("main")).containsExactly("Repo", "Repo.load");
        assertThat(graph.dependedBy("Repo.load")).containsExactly("main");
    }

    @Test
    void build_inFileBaseClass_isReferenced() {
        // Given
        EntityInventory inventory = inventory("""
            class Base:
                pass

            class Child(Base):
                pass
            """);

        // When
        DependencyGraph graph = builder.build(inventory);

        // Then
        assertThat(graph.dependsOn("Child")).containsExactly("Base");
        assertThat(graph.dependedBy("Base")).containsExactly("Child");
    }

    @Test
    void build_recursionAndUnknownNames_addNoEdges() {
        // Given
        EntityInventory inventory = inventory("""
            import math

            def fact(n):
                return 1 if n < 2 else n * fact(n - 1) * math.floor(1.0)
            """);

        // When
        DependencyGraph graph = builder.build(inventory);

        // Then
        assertThat(graph.edges()).isEmpty();
        assertThat(graph.dependsOn("fact")).isEmpty();
    }

    @Test
    void build_repeatedReferences_collapseIntoOneEdge() {
        // Given
        EntityInventory inventory = inventory("""
            def helper():
                pass

            def run():
                helper()
                helper()
                return helper
            """);

        // When
        DependencyGraph graph = builder.build(inventory);

        // Then
        assertThat(graph.edges()).hasSize(1);
        assertThat(graph.dependsOn("run")).containsExactly("helper");
    }

    @Test
    void build_transformerFixture_findsReferenceEdgesInDiscoveryOrder() {
        // When
        DependencyGraph graph = builder.build(transformer());

        // Then
        assertThat(graph.edges(EdgeKind.REFERENCES))
            .extracting(DependencyEdge::source, DependencyEdge::target)
            .containsExactly(
                tuple("positional_encoding", "get_angles"),
                tuple("MultiHeadAttention.call", "MultiHeadAttention.split_heads"),
                tuple("EncoderLayer.__init__", "MultiHeadAttention"),
                tuple("Encoder.__init__", "positional_encoding"),
                tuple("Encoder.__init__", "EncoderLayer"));
    }

    @Test
    void build_transformerFixture_ordersNeighboursByInventory() {
        // When
        DependencyGraph graph = builder.build(transformer());

        // Then
        assertThat(graph.dependsOn("Encoder.__init__"))
            .containsExactly("positional_encoding", "EncoderLayer", "Encoder");
        assertThat(graph.dependedBy("MultiHeadAttention")).containsExactly(
            "MultiHeadAttention.__init__", "MultiHeadAttention.split_heads", "MultiHeadAttention.call",
            "EncoderLayer.__init__");
        assertThat(graph.dependedBy("get_angles")).containsExactly("positional_encoding");
    }

    @Test
    void toEntries_transformerFixture_coversEveryEntity() {
        // Given
        EntityInventory inventory = transformer();

        // When
        Map<String, DependencyEntry> entries = builder.build(inventory).toEntries(inventory);

        // Then
        assertThat(entries).hasSize(12);
        assertThat(entries.keySet()).first().isEqualTo("get_angles");
        assertThat(entries.get("MultiHeadAttention").type()).isEqualTo(EntityKind.CLASS);
        assertThat(entries.get("MultiHeadAttention.call").type()).isEqualTo(EntityKind.METHOD);
        assertThat(entries.get("MultiHeadAttention.call").dependsOn())
            .containsExactly("MultiHeadAttention", "MultiHeadAttention.split_heads");
        assertThat(entries.get("get_angles").dependsOn()).isEmpty();
    }

    @Test
    void toEntries_everyDependency_isMirrored() {
        // Given
        EntityInventory inventory = transformer();

        // When
        Map<String, DependencyEntry> entries = builder.build(inventory).toEntries(inventory);

        // Then
        entries.forEach((name, entry) -> {
            for (String target : entry.dependsOn()) {
                assertThat(entries.get(target).dependedBy()).contains(name);
            }
            for (String source : entry.dependedBy()) {
                assertThat(entries.get(source).dependsOn()).contains(name);
            }
        });
    }
}
