package com.codeprism.core.analyzer.dependency;

import com.codeprism.core.model.DependencyEdge;
import com.codeprism.core.model.DependencyEntry;
import com.codeprism.core.model.EdgeKind;
import com.codeprism.core.model.Entity;
import com.codeprism.core.model.EntityInventory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Directed graph of dependencies between the entities of one source unit.
 *
 * <p>Holds one canonical edge list. {@link #dependsOn(String)} and
 * {@link #dependedBy(String)} are two indices built from that list and are
 * never updated independently. Both return neighbours in inventory order.
 */
public final class DependencyGraph {

    private final List<String> nodes;
    private final List<DependencyEdge> edges;
    private final Map<String, List<String>> dependsOn;
    private final Map<String, List<String>> dependedBy;

    DependencyGraph(List<String> nodes, Collection<DependencyEdge> edges) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);

        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < this.nodes.size(); i++) {
            position.put(this.nodes.get(i), i);
        }
        for (DependencyEdge edge : this.edges) {
            if (!position.containsKey(edge.source()) || !position.containsKey(edge.target())) {
                throw new IllegalArgumentException("edge references an entity outside the inventory: " + edge);
            }
        }
        Comparator<String> inventoryOrder = Comparator.comparing(position::get);

        Map<String, List<String>> forward = new LinkedHashMap<>();
        Map<String, List<String>> backward = new LinkedHashMap<>();
        for (String node : this.nodes) {
            forward.put(node, new ArrayList<>());
            backward.put(node, new ArrayList<>());
        }
        for (DependencyEdge edge : this.edges) {
            forward.get(edge.source()).add(edge.target());
            backward.get(edge.target()).add(edge.source());
        }
        this.dependsOn = freeze(forward, inventoryOrder);
        this.dependedBy = freeze(backward, inventoryOrder);
    }

    /**
     * @return every edge, structural edges first, then references in discovery order
     */
    public List<DependencyEdge> edges() {
        return edges;
    }

    /**
     * @param kind edge kind
     * @return edges of the given kind
     */
    public List<DependencyEdge> edges(EdgeKind kind) {
        return edges.stream().filter(e -> e.kind() == kind).toList();
    }

    /**
     * @param node qualified entity name
     * @return entities the node depends on
     */
    public List<String> dependsOn(String node) {
        return dependsOn.getOrDefault(node, List.of());
    }

    /**
     * @param node qualified entity name
     * @return entities depending on the node
     */
    public List<String> dependedBy(String node) {
        return dependedBy.getOrDefault(node, List.of());
    }

    /**
     * Recomputes the reverse index from {@code dependsOn} and compares it with the stored one.
     *
     * @throws IllegalStateException if A is in B's depends_on but B is not in A's depended_by, or vice versa
     */
    public void verifySymmetry() {
        Map<String, List<String>> recomputed = new HashMap<>();
        for (String source : nodes) {
            for (String target : dependsOn(source)) {
                recomputed.computeIfAbsent(target, k -> new ArrayList<>()).add(source);
            }
        }
        for (String node : nodes) {
            List<String> expected = recomputed.getOrDefault(node, List.of());
            List<String> actual = dependedBy(node);
            if (expected.size() != actual.size() || !actual.containsAll(expected)) {
                throw new IllegalStateException("depended_by of " + node + " is " + actual
                    + " but depends_on implies " + expected);
            }
        }
    }

    /**
     * Builds the per-entity view used in reports.
     *
     * @param inventory inventory the graph was built from
     * @return entry per entity, in inventory order
     */
    public Map<String, DependencyEntry> toEntries(EntityInventory inventory) {
        Map<String, DependencyEntry> entries = new LinkedHashMap<>();
        for (Entity entity : inventory.entities()) {
            String name = entity.qualifiedName();
            entries.put(name, new DependencyEntry(entity.kind(), dependsOn(name), dependedBy(name)));
        }
        return entries;
    }

    private static Map<String, List<String>> freeze(Map<String, List<String>> index, Comparator<String> order) {
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        index.forEach((node, neighbours) -> {
            List<String> sorted = new ArrayList<>(neighbours);
            sorted.sort(order);
            frozen.put(node, List.copyOf(sorted));
        });
        return frozen;
    }
}
