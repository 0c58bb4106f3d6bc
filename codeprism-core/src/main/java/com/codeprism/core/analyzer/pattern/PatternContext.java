package com.codeprism.core.analyzer.pattern;

import com.codeprism.core.model.Entity;
import com.codeprism.core.model.EntityInventory;
import com.codeprism.core.parser.Token;
import com.codeprism.core.parser.TokenType;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only view of a source unit handed to every pattern probe.
 *
 * @param inventory extracted entities
 * @param tokens full token stream
 * @param source raw source text
 */
public record PatternContext(
    EntityInventory inventory,
    List<Token> tokens,
    String source
) {
    public PatternContext {
        Objects.requireNonNull(inventory, "inventory must not be null");
        Objects.requireNonNull(source, "source must not be null");
        tokens = tokens != null ? List.copyOf(tokens) : List.of();
    }

    /**
     * @param inventory extracted entities
     * @return context over the inventory's own parse
     */
    public static PatternContext of(EntityInventory inventory) {
        return new PatternContext(inventory, inventory.tree().tokens(), inventory.tree().source());
    }

    /**
     * @param names identifiers to look for
     * @return true if any name token equals one of them
     */
    public boolean hasName(Set<String> names) {
        return tokens.stream().anyMatch(t -> t.isName() && names.contains(t.text()));
    }

    /**
     * Case-insensitive substring search over name tokens.
     *
     * @param fragments lowercase fragments
     * @return true if any name token contains one of them
     */
    public boolean hasNameContaining(String... fragments) {
        for (Token token : tokens) {
            if (!token.isName()) {
                continue;
            }
            String lower = token.text().toLowerCase(Locale.ROOT);
            for (String fragment : fragments) {
                if (lower.contains(fragment)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * @param values literal contents to look for, without quotes
     * @return true if a plain string literal holds exactly one of the values
     */
    public boolean hasStringLiteral(Set<String> values) {
        for (Token token : tokens) {
            if (token.type() != TokenType.STRING) {
                continue;
            }
            String text = token.text();
            int start = 0;
            while (start < text.length() && text.charAt(start) != '\'' && text.charAt(start) != '"') {
                start++;
            }
            if (start >= text.length() - 1) {
                continue;
            }
            if (values.contains(text.substring(start + 1, text.length() - 1))) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return functions and methods in inventory order
     */
    public List<Entity> callables() {
        return inventory.callables();
    }

    /**
     * @return classes in inventory order
     */
    public List<Entity> classes() {
        return inventory.classes();
    }
}
