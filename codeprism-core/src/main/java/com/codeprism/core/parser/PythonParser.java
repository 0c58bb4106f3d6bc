package com.codeprism.core.parser;

import com.codeprism.core.parser.antlr.Python3Lexer;
import com.codeprism.core.parser.antlr.Python3Parser;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parser for Python source units.
 *
 * <p>Runs the ANTLR-generated {@link Python3Lexer} and {@link Python3Parser}
 * over the text and walks the resulting parse tree into a statement tree.
 * Expressions are checked by the grammar but not kept as nodes; every
 * statement carries its raw tokens, which is all the analysis stages need
 * (names, operators and keywords in source order).
 *
 * <p>The first lexical or syntax error aborts the parse with a
 * {@link MalformedSourceException} carrying the offending line and column.
 * Blocks nested deeper than {@value com.codeprism.core.parser.antlr.Python3LexerBase#MAX_INDENT_LEVELS}
 * levels and brackets nested deeper than
 * {@value com.codeprism.core.parser.antlr.Python3LexerBase#MAX_OPEN_BRACKETS} are rejected the same way.
 *
 * <p>Instances are stateless and thread-safe.
 */
public class PythonParser implements AstParser {

    private static final Logger log = LoggerFactory.getLogger(PythonParser.class);

    private static final Map<String, StatementKind> CLAUSE_KEYWORDS = Map.ofEntries(
        Map.entry("if", StatementKind.IF),
        Map.entry("elif", StatementKind.ELIF),
        Map.entry("else", StatementKind.ELSE),
        Map.entry("for", StatementKind.FOR),
        Map.entry("while", StatementKind.WHILE),
        Map.entry("try", StatementKind.TRY),
        Map.entry("except", StatementKind.EXCEPT),
        Map.entry("finally", StatementKind.FINALLY),
        Map.entry("with", StatementKind.WITH),
        Map.entry("match", StatementKind.MATCH),
        Map.entry("case", StatementKind.CASE),
        Map.entry("def", StatementKind.DEF),
        Map.entry("class", StatementKind.CLASS)
    );

    @Override
    public SourceTree parseString(String sourceCode) {
        SyntaxErrorListener errors = new SyntaxErrorListener();

        Python3Lexer lexer = new Python3Lexer(CharStreams.fromString(sourceCode));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);
        CommonTokenStream stream = new CommonTokenStream(lexer);
        stream.fill();
        rejectUnknownCharacters(stream.getTokens());

        Python3Parser parser = new Python3Parser(stream);
        parser.removeErrorListeners();
        parser.addErrorListener(errors);
        Python3Parser.File_inputContext root;
        try {
            root = parser.file_input();
        } catch (StackOverflowError e) {
            // Only reachable through expressions; blocks and brackets are capped by the lexer
            org.antlr.v4.runtime.Token at = parser.getCurrentToken();
            throw new MalformedSourceException("expression nested too deeply",
                at.getLine(), at.getCharPositionInLine() + 1);
        }

        List<Token> tokens = new ArrayList<>();
        for (org.antlr.v4.runtime.Token token : stream.getTokens()) {
            tokens.add(convert(token));
        }
        List<Statement> statements = new TreeWalker(tokens).module(root);
        log.debug("Parsed {} tokens into {} top-level statements", tokens.size(), statements.size());
        return new SourceTree(sourceCode, tokens, statements);
    }

    @Override
    public String getLanguage() {
        return "python";
    }

    private static void rejectUnknownCharacters(List<org.antlr.v4.runtime.Token> tokens) {
        for (org.antlr.v4.runtime.Token token : tokens) {
            if (token.getType() != Python3Lexer.UNKNOWN_CHAR) {
                continue;
            }
            String text = token.getText();
            String reason;
            if (text.equals("'") || text.equals("\"")) {
                reason = "unterminated string literal";
            } else if (text.equals("\\")) {
                reason = "unexpected character after line continuation character";
            } else {
                reason = "invalid character '" + text + "'";
            }
            throw new MalformedSourceException(reason, token.getLine(), token.getCharPositionInLine() + 1);
        }
    }

    private static Token convert(org.antlr.v4.runtime.Token token) {
        int line = token.getLine();
        int column = token.getCharPositionInLine() + 1;
        String text = token.getText();
        return switch (token.getType()) {
            case org.antlr.v4.runtime.Token.EOF -> new Token(TokenType.ENDMARKER, "", line, column, line);
            case Python3Lexer.NEWLINE -> new Token(TokenType.NEWLINE, text, line, column, line);
            case Python3Lexer.INDENT -> new Token(TokenType.INDENT, "", line, column, line);
            case Python3Lexer.DEDENT -> new Token(TokenType.DEDENT, "", line, column, line);
            case Python3Lexer.STRING -> new Token(TokenType.STRING, text, line, column, line + lineBreaks(text));
            case Python3Lexer.NUMBER -> new Token(TokenType.NUMBER, text, line, column, line);
            default -> new Token(isWord(text) ? TokenType.NAME : TokenType.OP, text, line, column, line);
        };
    }

    // Keywords and identifiers both start with a letter or underscore
    private static boolean isWord(String text) {
        if (text.isEmpty()) {
            return false;
        }
        int first = text.codePointAt(0);
        return first == '_' || Character.isLetter(first);
    }

    private static int lineBreaks(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 == text.length() || text.charAt(i + 1) != '\n'))) {
                count++;
            }
        }
        return count;
    }

    /**
     * Turns the first reported error into a {@link MalformedSourceException}.
     */
    private static final class SyntaxErrorListener extends BaseErrorListener {

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            String reason = msg;
            if (recognizer instanceof Parser parser && offendingSymbol instanceof org.antlr.v4.runtime.Token offending) {
                reason = describe(parser, offending);
            }
            throw new MalformedSourceException(reason, line, charPositionInLine + 1);
        }

        private static String describe(Parser parser, org.antlr.v4.runtime.Token offending) {
            if (offending.getType() == Python3Lexer.INDENT) {
                return "unexpected indent";
            }
            IntervalSet expected = parser.getExpectedTokens();
            if (expected.contains(Python3Lexer.INDENT)) {
                return "expected an indented block";
            }
            if (offending.getType() == Python3Lexer.NEWLINE && expected.contains(Python3Lexer.COLON)) {
                return "expected ':'";
            }
            if (offending.getType() == org.antlr.v4.runtime.Token.EOF) {
                return "unexpected end of input";
            }
            return "invalid syntax";
        }
    }

    /**
     * Builds statements from one parse tree. Clause keywords of a compound
     * statement become sibling statements of their opener.
     */
    private static final class TreeWalker {

        private final List<Token> tokens;

        private TreeWalker(List<Token> tokens) {
            this.tokens = tokens;
        }

        private List<Statement> module(Python3Parser.File_inputContext root) {
            List<Statement> statements = new ArrayList<>();
            for (Python3Parser.StmtContext stmt : root.stmt()) {
                statement(stmt, statements);
            }
            return statements;
        }

        private void statement(Python3Parser.StmtContext stmt, List<Statement> out) {
            if (stmt.simple_stmts() != null) {
                simpleStatements(stmt.simple_stmts(), out);
            } else {
                compound((ParserRuleContext) stmt.compound_stmt().getChild(0), List.of(), out);
            }
        }

        private void compound(ParserRuleContext ctx, List<Statement> decorators, List<Statement> out) {
            if (ctx instanceof Python3Parser.DecoratedContext decorated) {
                List<Statement> lines = new ArrayList<>();
                for (Python3Parser.DecoratorContext decorator : decorated.decorators().decorator()) {
                    lines.add(decorator(decorator));
                }
                compound((ParserRuleContext) decorated.getChild(1), lines, out);
            } else if (ctx instanceof Python3Parser.Async_funcdefContext
                    || ctx instanceof Python3Parser.Async_stmtContext) {
                compound((ParserRuleContext) ctx.getChild(1), decorators, out);
            } else if (ctx instanceof Python3Parser.Match_stmtContext match) {
                out.add(match(match));
            } else {
                clauses(ctx, decorators, out);
            }
        }

        private void clauses(ParserRuleContext ctx, List<Statement> decorators, List<Statement> out) {
            List<Token> header = new ArrayList<>();
            List<Statement> pendingDecorators = decorators;
            for (int i = 0; i < ctx.getChildCount(); i++) {
                ParseTree child = ctx.getChild(i);
                if (child instanceof Python3Parser.BlockContext block) {
                    out.add(compoundStatement(header, block(block), pendingDecorators));
                    header = new ArrayList<>();
                    pendingDecorators = List.of();
                } else if (!isBlockColon(ctx, i)) {
                    header.addAll(tokensOf(child));
                }
            }
        }

        private Statement match(Python3Parser.Match_stmtContext ctx) {
            List<Token> header = new ArrayList<>(tokensOf(ctx.getChild(0)));
            header.addAll(tokensOf(ctx.subject_expr()));
            List<Statement> cases = new ArrayList<>();
            for (Python3Parser.Case_blockContext caseBlock : ctx.case_block()) {
                clauses(caseBlock, List.of(), cases);
            }
            return compoundStatement(header, cases, List.of());
        }

        private List<Statement> block(Python3Parser.BlockContext block) {
            List<Statement> body = new ArrayList<>();
            if (block.simple_stmts() != null) {
                simpleStatements(block.simple_stmts(), body);
            } else {
                for (Python3Parser.StmtContext stmt : block.stmt()) {
                    statement(stmt, body);
                }
            }
            return body;
        }

        private void simpleStatements(Python3Parser.Simple_stmtsContext ctx, List<Statement> out) {
            for (Python3Parser.Simple_stmtContext simple : ctx.simple_stmt()) {
                List<Token> statementTokens = tokensOf(simple);
                Token first = statementTokens.get(0);
                out.add(new Statement(simpleKind(first), statementTokens, List.of(), List.of(),
                    first.line(), lastLine(statementTokens)));
            }
        }

        private Statement decorator(Python3Parser.DecoratorContext ctx) {
            Token at = tokenAt(ctx.getStart());
            List<Token> expression = tokensOf(ctx.namedexpr_test());
            return new Statement(StatementKind.DECORATOR, expression, List.of(), List.of(),
                at.line(), lastLine(expression));
        }

        private static Statement compoundStatement(List<Token> header, List<Statement> body, List<Statement> decorators) {
            Token keyword = header.get(0);
            StatementKind kind = CLAUSE_KEYWORDS.get(keyword.text());
            if (kind == null) {
                throw new IllegalStateException("No statement kind for block keyword " + keyword);
            }
            int endLine = body.isEmpty() ? lastLine(header) : body.get(body.size() - 1).endLine();
            return new Statement(kind, header, body, decorators, keyword.line(), endLine);
        }

        private static StatementKind simpleKind(Token first) {
            if (first.isName("return")) {
                return StatementKind.RETURN;
            }
            if (first.isName("yield")) {
                return StatementKind.YIELD;
            }
            if (first.isName("import") || first.isName("from")) {
                return StatementKind.IMPORT;
            }
            return StatementKind.SIMPLE;
        }

        private static boolean isBlockColon(ParserRuleContext ctx, int index) {
            ParseTree child = ctx.getChild(index);
            return child instanceof TerminalNode terminal
                && terminal.getSymbol().getType() == Python3Lexer.COLON
                && index + 1 < ctx.getChildCount()
                && ctx.getChild(index + 1) instanceof Python3Parser.BlockContext;
        }

        private List<Token> tokensOf(ParseTree node) {
            if (node instanceof TerminalNode terminal) {
                return List.of(tokenAt(terminal.getSymbol()));
            }
            ParserRuleContext ctx = (ParserRuleContext) node;
            if (ctx.getStop() == null || ctx.getStop().getTokenIndex() < ctx.getStart().getTokenIndex()) {
                return List.of();
            }
            return tokens.subList(ctx.getStart().getTokenIndex(), ctx.getStop().getTokenIndex() + 1);
        }

        private Token tokenAt(org.antlr.v4.runtime.Token token) {
            return tokens.get(token.getTokenIndex());
        }

        private static int lastLine(List<Token> statementTokens) {
            int line = 0;
            for (Token token : statementTokens) {
                line = Math.max(line, token.endLine());
            }
            return line;
        }
    }
}
