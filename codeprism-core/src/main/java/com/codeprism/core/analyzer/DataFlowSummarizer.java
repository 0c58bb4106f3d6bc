package com.codeprism.core.analyzer;

import com.codeprism.core.analyzer.dependency.DependencyGraph;
import com.codeprism.core.model.DataFlowSummary;
import com.codeprism.core.model.DataPath;
import com.codeprism.core.model.DependencyEdge;
import com.codeprism.core.model.EdgeKind;
import com.codeprism.core.model.Entity;
import com.codeprism.core.model.EntityInventory;
import com.codeprism.core.model.EntryPoint;
import com.codeprism.core.model.ExitPoint;
import com.codeprism.core.parser.Statement;
import com.codeprism.core.parser.StatementKind;
import com.codeprism.core.parser.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Summarizes what goes into and comes out of each function, without evaluating anything.
 *
 * <p>Entry points are the declared parameters. Exit points label each
 * {@code return}/{@code yield} by the head of its expression:
 * <ul>
 *   <li>the dotted name that starts the expression ({@code x}, {@code self.dense});
 *       for a call this is the callee</li>
 *   <li>{@code None} for a bare {@code return} or {@code yield}</li>
 *   <li>{@code unknown} for literals, operators and keywords</li>
 * </ul>
 * Returns of nested functions belong to those functions and are skipped.
 * Data paths are the reference edges between two functions or methods.
 */
public class DataFlowSummarizer {

    static final String UNKNOWN = "unknown";
    static final String NONE = "None";

    private static final Set<String> KEYWORDS = Set.of(
        "not", "lambda", "yield", "await", "if", "else", "and", "or", "in", "is", "from"
    );

    /**
     * @param inventory extracted entities
     * @param graph dependency graph of the same inventory
     * @return data flow block
     */
    public DataFlowSummary summarize(EntityInventory inventory, DependencyGraph graph) {
        List<EntryPoint> entryPoints = new ArrayList<>();
        List<ExitPoint> exitPoints = new ArrayList<>();

        for (Entity callable : inventory.callables()) {
            entryPoints.add(new EntryPoint(callable.qualifiedName(), callable.parameters()));

            List<String> labels = new ArrayList<>();
            collectExits(callable.definition().body(), labels);
            if (!labels.isEmpty()) {
                exitPoints.add(new ExitPoint(callable.qualifiedName(), labels));
            }
        }

        List<DataPath> dataPaths = new ArrayList<>();
        for (DependencyEdge edge : graph.edges(EdgeKind.REFERENCES)) {
            boolean fromCallable = inventory.find(edge.source()).map(Entity::isCallable).orElse(false);
            boolean toCallable = inventory.find(edge.target()).map(Entity::isCallable).orElse(false);
            if (fromCallable && toCallable) {
                dataPaths.add(new DataPath(edge.source(), edge.target()));
            }
        }

        return new DataFlowSummary(entryPoints, exitPoints, dataPaths);
    }

    private static void collectExits(List<Statement> block, List<String> labels) {
        for (Statement statement : block) {
            switch (statement.kind()) {
                case RETURN, YIELD -> labels.add(label(statement));
                case DEF, CLASS -> {
                    // own scope
                }
                default -> collectExits(statement.body(), labels);
            }
        }
    }

    /**
     * Labels one return-like statement.
     */
    static String label(Statement statement) {
        List<Token> tokens = statement.tokens();
        int i = 1;
        if (statement.kind() == StatementKind.YIELD && i < tokens.size() && tokens.get(i).isName("from")) {
            i++;
        }
        if (i < tokens.size() && tokens.get(i).isName("await")) {
            i++;
        }
        if (i >= tokens.size()) {
            return NONE;
        }
        if (!tokens.get(i).isName() || KEYWORDS.contains(tokens.get(i).text())) {
            return UNKNOWN;
        }

        StringBuilder head = new StringBuilder(tokens.get(i).text());
        while (i + 2 < tokens.size() && tokens.get(i + 1).isOp(".") && tokens.get(i + 2).isName()) {
            head.append('.').append(tokens.get(i + 2).text());
            i += 2;
        }
        return head.toString();
    }
}
