package com.codeprism.core.model;

import com.codeprism.core.parser.SourceTree;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of everything the extractor found in one source unit.
 *
 * <p>Entities are kept in source order with each class followed by its methods.
 * Every later stage reads this value and none modifies it.
 *
 * @param entities classes, methods and functions in inventory order
 * @param importCount number of import statements at any depth
 * @param tree parsed source the entities were extracted from
 */
public record EntityInventory(
    List<Entity> entities,
    int importCount,
    SourceTree tree
) {
    public EntityInventory {
        Objects.requireNonNull(tree, "tree must not be null");
        entities = entities != null ? List.copyOf(entities) : List.of();
    }

    public List<Entity> classes() {
        return ofKind(EntityKind.CLASS);
    }

    public List<Entity> functions() {
        return ofKind(EntityKind.FUNCTION);
    }

    public List<Entity> methods() {
        return ofKind(EntityKind.METHOD);
    }

    /**
     * @return functions and methods in inventory order
     */
    public List<Entity> callables() {
        return entities.stream().filter(Entity::isCallable).toList();
    }

    /**
     * @param className owning class name
     * @return methods of the class in declaration order
     */
    public List<Entity> methodsOf(String className) {
        return entities.stream()
            .filter(e -> e.kind() == EntityKind.METHOD && e.owner().equals(className))
            .toList();
    }

    /**
     * @param qualifiedName bare name for classes and functions, {@code Class.method} for methods
     * @return the entity if present
     */
    public Optional<Entity> find(String qualifiedName) {
        return entities.stream()
            .filter(e -> e.qualifiedName().equals(qualifiedName))
            .findFirst();
    }

    /**
     * @param qualifiedName entity key
     * @return position in inventory order, or -1 if absent
     */
    public int indexOf(String qualifiedName) {
        for (int i = 0; i < entities.size(); i++) {
            if (entities.get(i).qualifiedName().equals(qualifiedName)) {
                return i;
            }
        }
        return -1;
    }

    private List<Entity> ofKind(EntityKind kind) {
        return entities.stream().filter(e -> e.kind() == kind).toList();
    }
}
