package com.syntaxforge.parser;

import com.syntaxforge.ast.BlockStatement;
import com.syntaxforge.ast.ExpressionStatement;
import com.syntaxforge.ast.FunctionDeclaration;
import com.syntaxforge.ast.Identifier;
import com.syntaxforge.ast.Program;
import com.syntaxforge.ast.ReturnStatement;
import com.syntaxforge.ast.SourceType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class AbstractParserTest {

    @Test
    void testMetadataOfSuccessfulParse() {
        StubParser parser = new StubParser("toy", Set.of("toy"), context -> new Program(List.of(
            new FunctionDeclaration("f", List.of(), new BlockStatement(List.of(
                new ReturnStatement(new Identifier("x"))))),
            new ExpressionStatement(new Identifier("y"))), SourceType.SCRIPT));

        ParseResult result = parser.parse("a\nb\nc", "file.toy");

        assertTrue(result.isSuccess());
        assertFalse(result.hasErrors());
        assertEquals("toy", result.metadata().language());
        assertEquals("file.toy", result.metadata().filename());
        assertEquals(3, result.metadata().lineCount());
        // Program, function, return, identifier, expression statement, identifier
        assertEquals(6, result.metadata().nodeCount());
        assertTrue(result.metadata().parseTime() >= 0);
    }

    @Test
    void testEmptySourceHasOneLine() {
        ParseResult result = new StubParser("toy").parse("");
        assertEquals(1, result.metadata().lineCount());
        assertEquals(1, result.metadata().nodeCount());
        assertNull(result.metadata().filename());
    }

    @Test
    void testSyntaxExceptionBecomesError() {
        StubParser parser = new StubParser("toy", Set.of(), context -> {
            throw new SyntaxException("Unexpected token", 4);
        });

        ParseResult result = parser.parse("ab\ncd");

        assertFalse(result.isSuccess());
        assertTrue(result.ast().body().isEmpty());
        assertEquals(SourceType.MODULE, result.ast().sourceType());
        ParseError error = result.errors().get(0);
        assertEquals("Unexpected token", error.message());
        assertEquals("error", error.severity());
        assertEquals(2, error.location().start().line());
        assertEquals(1, error.location().start().column());
    }

    @Test
    void testRecoveredErrorsDiscardThePartialTree() {
        StubParser parser = new StubParser("toy", Set.of(), context -> {
            context.error("Missing semicolon", -1);
            return new Program(List.of(new ExpressionStatement(new Identifier("x"))));
        });

        ParseResult result = parser.parse("x");

        assertEquals(1, result.errors().size());
        assertNull(result.errors().get(0).location());
        assertTrue(result.ast().body().isEmpty());
    }

    @Test
    void testUnexpectedFailureIsReported() {
        StubParser parser = new StubParser("toy", Set.of(), context -> {
            throw new IllegalStateException("boom");
        });

        ParseResult result = assertDoesNotThrow(() -> parser.parse("x"));

        assertEquals("Internal parser error: boom", result.errors().get(0).message());
    }

    @Test
    void testNullProgramIsAnError() {
        ParseResult result = new StubParser("toy", Set.of(), context -> null).parse("x");
        assertEquals("Parser produced no program", result.errors().get(0).message());
    }

    @Test
    void testUpdateConfigMergesPartialConfig() {
        StubParser parser = new StubParser("toy");
        parser.updateConfig(ParserConfig.builder().sourceType(SourceType.SCRIPT).build());
        parser.updateConfig(ParserConfig.builder().ranges(false).build());

        ParserConfig config = parser.getConfig();
        assertEquals(SourceType.SCRIPT, config.sourceType());
        assertFalse(config.rangesEnabled());
        assertTrue(config.locationsEnabled());
        assertEquals(2020, config.ecmaVersion());
    }

    @Test
    void testEcmaYear() {
        assertEquals(2015, ParserConfig.builder().ecmaVersion(6).build().ecmaYear());
        assertEquals(2024, ParserConfig.builder().ecmaVersion(15).build().ecmaYear());
        assertEquals(2009, ParserConfig.builder().ecmaVersion(5).build().ecmaYear());
        assertEquals(2022, ParserConfig.builder().ecmaVersion(2022).build().ecmaYear());
        assertEquals(2020, ParserConfig.builder().build().ecmaYear());
    }

    @Test
    void testParseResultRequiresEmptyProgramWithErrors() {
        Program program = new Program(List.of(new ExpressionStatement(new Identifier("x"))));
        assertThrows(IllegalArgumentException.class,
            () -> new ParseResult(program, List.of(new ParseError("bad")), null, null));
        assertThrows(IllegalArgumentException.class, () -> new ParseResult(null, null, null, null));

        ParseResult ok = new ParseResult(program, null, null, null);
        assertTrue(ok.errors().isEmpty());
        assertTrue(ok.warnings().isEmpty());
    }
}
