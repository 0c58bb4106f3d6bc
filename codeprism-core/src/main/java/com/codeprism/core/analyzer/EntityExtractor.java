package com.codeprism.core.analyzer;

import com.codeprism.core.model.Entity;
import com.codeprism.core.model.EntityInventory;
import com.codeprism.core.model.EntityKind;
import com.codeprism.core.parser.AstParser;
import com.codeprism.core.parser.PythonParser;
import com.codeprism.core.parser.SourceTree;
import com.codeprism.core.parser.Statement;
import com.codeprism.core.parser.StatementKind;
import com.codeprism.core.parser.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the entity inventory of a source unit.
 *
 * <p>Collects top-level functions, top-level classes and the methods defined
 * directly in a class body, plus the number of import statements at any depth.
 * Nested functions and classes belong to the body of their enclosing entity
 * and are not entities of their own.
 *
 * <p>A name defined twice at the same level keeps the later definition in the
 * position of the first, the way Python rebinds it.
 */
public class EntityExtractor {

    private static final Logger log = LoggerFactory.getLogger(EntityExtractor.class);

    private static final Set<String> RECEIVERS = Set.of("self", "cls");

    private final AstParser parser;

    public EntityExtractor() {
        this(new PythonParser());
    }

    public EntityExtractor(AstParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    /**
     * Parses and inventories a source text.
     *
     * @param source normalized source text
     * @return inventory of the unit
     * @throws com.codeprism.core.parser.MalformedSourceException if the text cannot be parsed
     */
    public EntityInventory extract(String source) {
        return extract(parser.parseString(source));
    }

    /**
     * Inventories an already parsed source unit.
     *
     * @param tree parsed source
     * @return inventory of the unit
     */
    public EntityInventory extract(SourceTree tree) {
        Map<String, List<Entity>> topLevel = new LinkedHashMap<>();

        for (Statement statement : tree.statements()) {
            if (statement.kind() == StatementKind.DEF) {
                Entity function = toEntity(statement, EntityKind.FUNCTION, null);
                rebind(topLevel, function.name(), List.of(function));
            } else if (statement.kind() == StatementKind.CLASS) {
                List<Entity> group = new ArrayList<>();
                Entity cls = toEntity(statement, EntityKind.CLASS, null);
                group.add(cls);
                group.addAll(extractMethods(statement, cls.name()));
                rebind(topLevel, cls.name(), group);
            }
        }

        List<Entity> entities = new ArrayList<>();
        topLevel.values().forEach(entities::addAll);

        int importCount = (int) tree.allStatements().stream()
            .filter(s -> s.kind() == StatementKind.IMPORT)
            .count();

        log.debug("Extracted {} entities and {} imports", entities.size(), importCount);
        return new EntityInventory(entities, importCount, tree);
    }

    private List<Entity> extractMethods(Statement classStatement, String className) {
        Map<String, Entity> methods = new LinkedHashMap<>();
        for (Statement member : classStatement.body()) {
            if (member.kind() == StatementKind.DEF) {
                Entity method = toEntity(member, EntityKind.METHOD, className);
                if (methods.put(method.name(), method) != null) {
                    log.debug("Method {}.{} redefined on line {}", className, method.name(), method.startLine());
                }
            }
        }
        return new ArrayList<>(methods.values());
    }

    private static void rebind(Map<String, List<Entity>> topLevel, String name, List<Entity> group) {
        if (topLevel.put(name, group) != null) {
            log.debug("Top-level name {} redefined on line {}", name, group.get(0).startLine());
        }
    }

    private static Entity toEntity(Statement statement, EntityKind kind, String owner) {
        List<String> decorators = decoratorNames(statement);
        List<String> parameters = List.of();
        List<String> baseClasses = List.of();

        if (kind == EntityKind.CLASS) {
            baseClasses = baseClasses(statement.tokens());
        } else {
            parameters = parameters(statement.tokens());
            boolean receiver = kind == EntityKind.METHOD && !decorators.contains("staticmethod");
            if (receiver && !parameters.isEmpty() && RECEIVERS.contains(parameters.get(0))) {
                parameters = parameters.subList(1, parameters.size());
            }
        }

        return new Entity(
            statement.declaredName(),
            kind,
            owner,
            parameters,
            statement.startLine(),
            statement.endLine(),
            statement.hasDocstring(),
            baseClasses,
            decorators,
            statement
        );
    }

    /**
     * Reads parameter names from a {@code def} header. Star markers are
     * stripped, and the bare {@code *} and {@code /} separators yield no name.
     */
    static List<String> parameters(List<Token> header) {
        List<String> names = new ArrayList<>();
        for (List<Token> segment : argumentSegments(header)) {
            for (Token token : segment) {
                if (token.isOp("*") || token.isOp("**")) {
                    continue;
                }
                if (token.isName()) {
                    names.add(token.text());
                }
                break;
            }
        }
        return names;
    }

    /**
     * Reads base class expressions from a {@code class} header, skipping keyword
     * arguments such as {@code metaclass=ABCMeta}.
     */
    static List<String> baseClasses(List<Token> header) {
        List<String> bases = new ArrayList<>();
        for (List<Token> segment : argumentSegments(header)) {
            if (segment.size() > 1 && segment.get(1).isOp("=")) {
                continue;
            }
            if (!segment.isEmpty() && !segment.get(0).isOp("*") && !segment.get(0).isOp("**")) {
                bases.add(join(segment));
            }
        }
        return bases;
    }

    /**
     * Splits the parenthesised list that follows the declared name into
     * comma-separated segments.
     */
    private static List<List<Token>> argumentSegments(List<Token> header) {
        List<List<Token>> segments = new ArrayList<>();
        if (header.size() < 3 || !header.get(2).isOp("(")) {
            return segments;
        }
        List<Token> current = new ArrayList<>();
        int depth = 0;
        for (int i = 3; i < header.size(); i++) {
            Token token = header.get(i);
            if (depth == 0 && (token.isOp(",") || token.isOp(")"))) {
                if (!current.isEmpty()) {
                    segments.add(current);
                }
                current = new ArrayList<>();
                if (token.isOp(")")) {
                    break;
                }
                continue;
            }
            if (token.isOp("(") || token.isOp("[") || token.isOp("{")) {
                depth++;
            } else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) {
                depth--;
            }
            current.add(token);
        }
        return segments;
    }

    private static List<String> decoratorNames(Statement statement) {
        List<String> names = new ArrayList<>();
        for (Statement decorator : statement.decorators()) {
            List<Token> nameTokens = new ArrayList<>();
            for (Token token : decorator.tokens()) {
                if (token.isOp("(")) {
                    break;
                }
                nameTokens.add(token);
            }
            names.add(join(nameTokens));
        }
        return names;
    }

    private static String join(List<Token> tokens) {
        StringBuilder text = new StringBuilder();
        for (Token token : tokens) {
            text.append(token.text());
        }
        return text.toString();
    }
}
