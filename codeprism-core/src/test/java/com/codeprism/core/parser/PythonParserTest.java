package com.codeprism.core.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PythonParser}.
 */
class PythonParserTest {

    private PythonParser parser;

    @BeforeEach
    void setUp() {
        parser = new PythonParser();
    }

    @Test
    void getLanguage_returnsPython() {
        assertThat(parser.getLanguage()).isEqualTo("python");
    }

    @Test
    void parseString_classWithMethods_buildsNestedStatements() {
        // Given
        String source = """
            class Greeter(Base):
                \"\"\"Says hello.\"\"\"

                def greet(self, name):
                    return "hi " + name
            """;

        // When
        SourceTree tree = parser.parseString(source);

        // Then
        assertThat(tree.statements()).hasSize(1);
        Statement cls = tree.statements().get(0);
        assertThat(cls.kind()).isEqualTo(StatementKind.CLASS);
        assertThat(cls.declaredName()).isEqualTo("Greeter");
        assertThat(cls.hasDocstring()).isTrue();
        assertThat(cls.startLine()).isEqualTo(1);
        assertThat(cls.endLine()).isEqualTo(5);

        Statement method = cls.body().get(1);
        assertThat(method.kind()).isEqualTo(StatementKind.DEF);
        assertThat(method.declaredName()).isEqualTo("greet");
        assertThat(method.hasDocstring()).isFalse();
        assertThat(method.body()).extracting(Statement::kind).containsExactly(StatementKind.RETURN);
    }

    @Test
    void parseString_ifElifElse_keepsClausesAsSiblings() {
        // Given
        String source = """
            if a:
                x = 1
            elif b:
                x = 2
            else:
                x = 3
            """;

        // When
        SourceTree tree = parser.parseString(source);

        // Then
        assertThat(tree.statements()).extracting(Statement::kind)
            .containsExactly(StatementKind.IF, StatementKind.ELIF, StatementKind.ELSE);
    }

    @Test
    void parseString_tryExceptElseFinally_isAccepted() {
        // Given
        String source = """
            try:
                run()
            except ValueError:
                pass
            except Exception:
                pass
            else:
                done()
            finally:
                close()
            """;

        // When
        SourceTree tree = parser.parseString(source);

        // Then
        assertThat(tree.statements()).extracting(Statement::kind).containsExactly(
            StatementKind.TRY, StatementKind.EXCEPT, StatementKind.EXCEPT, StatementKind.ELSE, StatementKind.FINALLY);
    }

    @Test
    void parseString_decoratedFunction_attachesDecorators() {
        // Given
        String source = """
            @staticmethod
            @cache(maxsize=2)
            def f():
                pass
            """;

        // When
        Statement def = parser.parseString(source).statements().get(0);

        // Then
        assertThat(def.kind()).isEqualTo(StatementKind.DEF);
        assertThat(def.decorators()).hasSize(2);
        assertThat(def.startLine()).isEqualTo(3);
    }

    @Test
    void parseString_asyncDef_isParsedAsDef() {
        // When
        Statement def = parser.parseString("async def fetch(url):\n    return await get(url)\n")
            .statements().get(0);

        // Then
        assertThat(def.kind()).isEqualTo(StatementKind.DEF);
        assertThat(def.declaredName()).isEqualTo("fetch");
    }

    @Test
    void parseString_matchStatement_parsesCases() {
        // Given
        String source = """
            match command:
                case "go":
                    move()
                case _:
                    stop()
            """;

        // When
        Statement match = parser.parseString(source).statements().get(0);

        // Then
        assertThat(match.kind()).isEqualTo(StatementKind.MATCH);
        assertThat(match.body()).extracting(Statement::kind)
            .containsExactly(StatementKind.CASE, StatementKind.CASE);
    }

    @Test
    void parseString_matchAsIdentifier_isSimpleStatement() {
        // When
        SourceTree tree = parser.parseString("match = pattern.search(text)\nmatch.group(0)\n");

        // Then
        assertThat(tree.statements()).extracting(Statement::kind)
            .containsExactly(StatementKind.SIMPLE, StatementKind.SIMPLE);
    }

    @Test
    void parseString_lambdaInHeader_findsBlockColon() {
        // When
        Statement statement = parser.parseString("if any(map(lambda v: v > 0, xs)):\n    pass\n")
            .statements().get(0);

        // Then
        assertThat(statement.kind()).isEqualTo(StatementKind.IF);
        assertThat(statement.body()).hasSize(1);
    }

    @Test
    void parseString_semicolons_splitSimpleStatements() {
        // When
        SourceTree tree = parser.parseString("import os; x = 1; return_value = x\n");

        // Then
        assertThat(tree.statements()).extracting(Statement::kind)
            .containsExactly(StatementKind.IMPORT, StatementKind.SIMPLE, StatementKind.SIMPLE);
    }

    @Test
    void parseString_inlineBody_isAccepted() {
        // When
        Statement def = parser.parseString("def f(x): return x\n").statements().get(0);

        // Then
        assertThat(def.body()).extracting(Statement::kind).containsExactly(StatementKind.RETURN);
        assertThat(def.endLine()).isEqualTo(1);
    }

    @Test
    void parseString_nestedImports_areCollectedByAllStatements() {
        // Given
        String source = """
            import os

            def load():
                from json import loads
                return loads
            """;

        // When
        List<Statement> all = parser.parseString(source).allStatements();

        // Then
        assertThat(all).filteredOn(s -> s.kind() == StatementKind.IMPORT).hasSize(2);
    }

    @Test
    void parseString_tokens_markLogicalLinesAndBlocks() {
        // When
        List<Token> tokens = parser.parseString("if a:\n    b\n").tokens();

        // Then
        assertThat(tokens).extracting(Token::type).containsExactly(
            TokenType.NAME, TokenType.NAME, TokenType.OP, TokenType.NEWLINE,
            TokenType.INDENT, TokenType.NAME, TokenType.NEWLINE,
            TokenType.DEDENT, TokenType.ENDMARKER);
        assertThat(tokens.get(0)).isEqualTo(new Token(TokenType.NAME, "if", 1, 1, 1));
        assertThat(tokens.get(5)).isEqualTo(new Token(TokenType.NAME, "b", 2, 5, 2));
    }

    @Test
    void parseString_blankLinesCommentsAndBrackets_addNoLineStructure() {
        // Given
        String source = """
            # header

            total = (1 +
                2)  # trailing
            """;

        // When
        List<Token> tokens = parser.parseString(source).tokens();

        // Then
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.NEWLINE).hasSize(1);
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.INDENT).isEmpty();
        assertThat(tokens).extracting(Token::text).doesNotContain("# header", "# trailing");
    }

    @Test
    void parseString_multiLineString_spansLines() {
        // When
        Statement assignment = parser.parseString("text = \"\"\"a\nb\nc\"\"\"\n").statements().get(0);

        // Then
        Token literal = assignment.tokens().get(2);
        assertThat(literal.type()).isEqualTo(TokenType.STRING);
        assertThat(literal.endLine()).isEqualTo(3);
        assertThat(assignment.endLine()).isEqualTo(3);
    }

    @Test
    void parseString_prefixedLiteralsAndNumbers_areSingleTokens() {
        // When
        List<Token> tokens = parser.parseString("x = f'{y}' + rb\"raw\" + 1_000 + 0x1F + 3.5j + 1e-6\n")
            .statements().get(0).tokens();

        // Then
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.STRING)
            .extracting(Token::text).containsExactly("f'{y}'", "rb\"raw\"");
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.NUMBER)
            .extracting(Token::text).containsExactly("1_000", "0x1F", "3.5j", "1e-6");
    }

    @Test
    void parseString_bytesLiteralFirst_isNotDocstring() {
        // Given
        String source = """
            def f():
                b"raw bytes"

            def g():
                Rb'raw bytes'

            def h():
                r'''raw text'''
            """;

        // When
        List<Statement> functions = parser.parseString(source).statements();

        // Then
        assertThat(functions).extracting(Statement::hasDocstring).containsExactly(false, false, true);
    }

    @Test
    void parseString_formatStringFirst_isNotDocstring() {
        // When
        Statement def = parser.parseString("def f():\n    f\"{x}\"\n").statements().get(0);

        // Then
        assertThat(def.hasDocstring()).isFalse();
    }

    @Test
    void parseString_modernSyntax_isAccepted() {
        // Given
        String source = """
            from . import sibling
            from ..pkg import (a, b as c,)

            async def f(a, /, b: int = 1, *args, key, **kw) -> list[int]:
                if (n := len(args)) > 1:
                    return [x async for x in stream if x]
                with (open(a) as fa, open(b) as fb):
                    pass
                try:
                    pass
                except* ValueError as e:
                    raise RuntimeError("bad") from e
                return lambda *xs, **kws: {**kw, 'n': n}

            match point:
                case Point(x=0, y=0) | [1, *rest] | {"k": v, **others} if v:
                    pass
                case -1 + 2j | None | a.b.c:
                    pass
            """;

        // When
        SourceTree tree = parser.parseString(source);

        // Then
        assertThat(tree.statements()).extracting(Statement::kind).containsExactly(
            StatementKind.IMPORT, StatementKind.IMPORT, StatementKind.DEF, StatementKind.MATCH);
    }

    @Test
    void parseString_emptyAndCommentOnlySource_haveNoStatements() {
        assertThat(parser.parseString("").tokens()).extracting(Token::type).containsExactly(TokenType.ENDMARKER);
        assertThat(parser.parseString("# only a comment\n\n").statements()).isEmpty();
    }

    @Test
    void parseString_missingColon_throwsWithPosition() {
        assertThatThrownBy(() -> parser.parseString("def f(x)\n    return x\n"))
            .isInstanceOf(MalformedSourceException.class)
            .hasMessageContaining("expected ':'")
            .satisfies(e -> assertThat(((MalformedSourceException) e).getLine()).isEqualTo(1));
    }

    @Test
    void parseString_missingIndentedBlock_throws() {
        assertThatThrownBy(() -> parser.parseString("def f():\nx = 1\n"))
            .isInstanceOf(MalformedSourceException.class)
            .hasMessageContaining("expected an indented block")
            .satisfies(e -> assertThat(((MalformedSourceException) e).getLine()).isEqualTo(2));
    }

    @Test
    void parseString_unexpectedIndent_throws() {
        assertThatThrownBy(() -> parser.parseString("x = 1\n    y = 2\n"))
            .isInstanceOf(MalformedSourceException.class)
            .hasMessageContaining("unexpected indent")
            .satisfies(e -> assertThat(((MalformedSourceException) e).getLine()).isEqualTo(2));
    }

    @Test
    void parseString_inconsistentDedent_throws() {
        assertThatThrownBy(() -> parser.parseString("if x:\n        a = 1\n    b = 2\n"))
            .isInstanceOf(MalformedSourceException.class)
            .hasMessageContaining("unindent does not match any outer indentation level")
            .satisfies(e -> assertThat(((MalformedSourceException) e).getLine()).isEqualTo(3));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "else:\n    pass\n",
        "x = 1\nelif y:\n    pass\n",
        "for i in xs:\n    pass\nexcept E:\n    pass\n",
        "try:\n    pass\nelse:\n    pass\n"
    })
    void parseString_clauseWithoutOpener_throws(String source) {
        assertThatThrownBy(() -> parser.parseString(source))
            .isInstanceOf(MalformedSourceException.class)
            .hasMessageContaining("invalid syntax");
    }

    @Test
    void parseString_decoratorOnAssignment_throws() {
        assertThatThrownBy(() -> parser.parseString("@decorator\nx = 1\n"))
            .isInstanceOf(MalformedSourceException.class)
            .hasMessageContaining("invalid syntax")
            .satisfies(e -> assertThat(((MalformedSourceException) e).getLine()).isEqualTo(2));
    }

    @Test
    void parseString_defWithoutName_throws() {
        assertThatThrownBy(() -> parser.parseString("def (x):\n    pass\n"))
            .isInstanceOf(MalformedSourceException.class)
            .hasMessage("line 1, column 5: invalid syntax");
    }

    @Test
    void parseString_defWithoutParameterList_throws() {
        assertThatThrownBy(() -> parser.parseString("def f:\n    pass\n"))
            .isInstanceOf(MalformedSourceException.class)
            .hasMessage("line 1, column 6: invalid syntax");
    }

    @Test
    void parseString_statementInMatchBody_mustBeCase() {
        assertThatThrownBy(() -> parser.parseString("match x:\n    y = 1\n"))
            .isInstanceOf(MalformedSourceException.class)
            .hasMessageContaining("invalid syntax")
            .satisfies(e -> assertThat(((MalformedSourceException) e).getLine()).isEqualTo(2));
    }

    @Test
    void parseString_unterminatedString_throws() {
        assertThatThrownBy(() -> parser.parseString("x = 'open\n"))
            .isInstanceOf(MalformedSourceException.class)
            .hasMessage("line 1, column 5: unterminated string literal");
    }

    @Test
    void parseString_invalidCharacter_throws() {
        assertThatThrownBy(() -> parser.parseString("x = $y\n"))
            .isInstanceOf(MalformedSourceException.class)
            .hasMessage("line 1, column 5: invalid character '$'");
    }

    @Test
    void parseString_unclosedBracket_throws() {
        assertThatThrownBy(() -> parser.parseString("x = (1,\n2\n"))
            .isInstanceOf(MalformedSourceException.class);
    }

    @Test
    void parseString_hundredIndentationLevels_isAccepted() {
        // When
        SourceTree tree = parser.parseString(nestedIfs(100));

        // Then
        assertThat(tree.allStatements()).hasSize(101);
    }

    @Test
    void parseString_tooManyIndentationLevels_throws() {
        assertThatThrownBy(() -> parser.parseString(nestedIfs(101)))
            .isInstanceOf(MalformedSourceException.class)
            .hasMessageContaining("too many levels of indentation")
            .satisfies(e -> assertThat(((MalformedSourceException) e).getLine()).isEqualTo(102));
    }

    @Test
    void parseString_tooManyNestedBrackets_throws() {
        String source = "x = " + "(".repeat(201) + "1" + ")".repeat(201) + "\n";

        assertThatThrownBy(() -> parser.parseString(source))
            .isInstanceOf(MalformedSourceException.class)
            .hasMessageContaining("too many nested parentheses");
    }

    @Test
    void parseString_deeplyNestedExpression_throwsInsteadOfOverflowing() {
        String source = "x = " + "-".repeat(100_000) + "1\n";

        assertThatThrownBy(() -> parser.parseString(source))
            .isInstanceOf(MalformedSourceException.class)
            .hasMessageContaining("expression nested too deeply");
    }

    private static String nestedIfs(int levels) {
        StringBuilder source = new StringBuilder();
        for (int level = 0; level < levels; level++) {
            source.append("    ".repeat(level)).append("if x:\n");
        }
        source.append("    ".repeat(levels)).append("pass\n");
        return source.toString();
    }
}
