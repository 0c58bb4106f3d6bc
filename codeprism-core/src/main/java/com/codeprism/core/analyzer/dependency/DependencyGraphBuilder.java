package com.codeprism.core.analyzer.dependency;

import com.codeprism.core.model.DependencyEdge;
import com.codeprism.core.model.EdgeKind;
import com.codeprism.core.model.Entity;
import com.codeprism.core.model.EntityInventory;
import com.codeprism.core.model.EntityKind;
import com.codeprism.core.parser.Statement;
import com.codeprism.core.parser.StatementKind;
import com.codeprism.core.parser.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives the dependency graph of a source unit from name co-occurrence.
 *
 * <p><b>Edges:</b></p>
 * <ul>
 *   <li>class to each of its methods ({@link EdgeKind#CONTAINS}) and back ({@link EdgeKind#MEMBER_OF})</li>
 *   <li>a bare name equal to a class or free function ({@link EdgeKind#REFERENCES})</li>
 *   <li>{@code self.m}/{@code cls.m} inside a method, to the same class's method {@code m}</li>
 *   <li>{@code C.m} for an analyzed class {@code C} with method {@code m}, to both {@code C} and {@code C.m}</li>
 * </ul>
 *
 * <p>A class body covers its decorators, header (so in-file base classes are
 * edges) and class-level statements; method bodies are scanned for the methods.
 * Names that resolve to nothing in the inventory are dropped, self-references
 * are ignored and repeated references collapse into one edge.
 */
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private static final Set<String> RECEIVERS = Set.of("self", "cls");

    /**
     * Builds and verifies the graph.
     *
     * @param inventory extracted entities
     * @return graph with symmetric indices
     * @throws IllegalStateException if the two indices disagree
     */
    public DependencyGraph build(EntityInventory inventory) {
        Map<String, DependencyEdge> edges = new LinkedHashMap<>();

        for (Entity cls : inventory.classes()) {
            for (Entity method : inventory.methodsOf(cls.name())) {
                addEdge(edges, cls.qualifiedName(), method.qualifiedName(), EdgeKind.CONTAINS);
                addEdge(edges, method.qualifiedName(), cls.qualifiedName(), EdgeKind.MEMBER_OF);
            }
        }

        NameTable names = new NameTable(inventory);
        for (Entity entity : inventory.entities()) {
            for (String target : references(entity, names)) {
                if (!target.equals(entity.qualifiedName())) {
                    addEdge(edges, entity.qualifiedName(), target, EdgeKind.REFERENCES);
                }
            }
        }

        List<String> nodes = inventory.entities().stream().map(Entity::qualifiedName).toList();
        DependencyGraph graph = new DependencyGraph(nodes, edges.values());
        graph.verifySymmetry();

        log.debug("Built dependency graph with {} nodes and {} edges", nodes.size(), edges.size());
        return graph;
    }

    private static void addEdge(Map<String, DependencyEdge> edges, String source, String target, EdgeKind kind) {
        edges.putIfAbsent(source + "->" + target, new DependencyEdge(source, target, kind));
    }

    private static Set<String> references(Entity entity, NameTable names) {
        List<Token> tokens = bodyTokens(entity);
        Set<String> targets = new LinkedHashSet<>();

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!token.isName() || (i > 0 && tokens.get(i - 1).isOp("."))) {
                continue;
            }
            String name = token.text();
            String member = null;
            if (i + 2 < tokens.size() && tokens.get(i + 1).isOp(".") && tokens.get(i + 2).isName()) {
                member = tokens.get(i + 2).text();
            }

            if (RECEIVERS.contains(name) && entity.kind() == EntityKind.METHOD) {
                if (member != null && names.hasMethod(entity.owner(), member)) {
                    targets.add(entity.owner() + "." + member);
                }
            } else if (names.isClass(name)) {
                targets.add(name);
                if (member != null && names.hasMethod(name, member)) {
                    targets.add(name + "." + member);
                }
            } else if (names.isFunction(name)) {
                targets.add(name);
            }
        }
        return targets;
    }

    private static List<Token> bodyTokens(Entity entity) {
        Statement definition = entity.definition();
        if (entity.kind() != EntityKind.CLASS) {
            return definition.allTokens();
        }
        List<Token> tokens = new ArrayList<>();
        for (Statement decorator : definition.decorators()) {
            tokens.addAll(decorator.tokens());
        }
        tokens.addAll(definition.tokens());
        for (Statement member : definition.body()) {
            if (member.kind() != StatementKind.DEF) {
                tokens.addAll(member.allTokens());
            }
        }
        return tokens;
    }

    /**
     * Lookup of the names an identifier can resolve to.
     */
    private static final class NameTable {
        private final Set<String> classes = new LinkedHashSet<>();
        private final Set<String> functions = new LinkedHashSet<>();
        private final Map<String, Set<String>> methods = new HashMap<>();

        private NameTable(EntityInventory inventory) {
            for (Entity entity : inventory.entities()) {
                switch (entity.kind()) {
                    case CLASS -> classes.add(entity.name());
                    case FUNCTION -> functions.add(entity.name());
                    case METHOD -> methods.computeIfAbsent(entity.owner(), k -> new LinkedHashSet<>()).add(entity.name());
                }
            }
        }

        private boolean isClass(String name) {
            return classes.contains(name);
        }

        private boolean isFunction(String name) {
            return functions.contains(name);
        }

        private boolean hasMethod(String className, String method) {
            return methods.getOrDefault(className, Set.of()).contains(method);
        }
    }
}
