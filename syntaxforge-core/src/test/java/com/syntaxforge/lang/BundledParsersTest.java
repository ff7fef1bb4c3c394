package com.syntaxforge.lang;

import com.syntaxforge.ast.ForLoop;
import com.syntaxforge.ast.WhileLoop;
import com.syntaxforge.metrics.AstMetrics;
import com.syntaxforge.parser.ParseResult;
import com.syntaxforge.parser.Parser;
import com.syntaxforge.parser.ParserConfig;
import com.syntaxforge.parser.ParserRegistry;
import com.syntaxforge.traverse.AstQueries;
import com.syntaxforge.traverse.AstWalker;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties every bundled parser shares, checked over well-formed and hostile input.
 */
public class BundledParsersTest {

    private static final List<String> LANGUAGES = List.of("javascript", "python", "java", "rust");

    private static final Map<String, String> SAMPLES = Map.of(
        "javascript", String.join("\n",
            "import { a } from './a.js';",
            "export function sum(xs) {",
            "  let total = 0;",
            "  for (const x of xs) {",
            "    if (x > 0 && x < 10) { total += x; }",
            "  }",
            "  while (total > 100) total--;",
            "  return total;",
            "}"),
        "python", String.join("\n",
            "import os",
            "def total(xs):",
            "    result = 0",
            "    for x in xs:",
            "        if x > 0 and x < 10:",
            "            result += x",
            "    while result > 100:",
            "        result -= 1",
            "    return result",
            ""),
        "java", String.join("\n",
            "import java.util.List;",
            "public class Sum {",
            "    static int total(List<Integer> xs) {",
            "        int total = 0;",
            "        for (int x : xs) {",
            "            if (x > 0 && x < 10) { total += x; }",
            "        }",
            "        while (total > 100) total--;",
            "        return total;",
            "    }",
            "}"),
        "rust", String.join("\n",
            "use std::fmt;",
            "fn total(xs: &[i32]) -> i32 {",
            "    let mut total = 0;",
            "    for x in xs {",
            "        if x > 0 && x < 10 { total += x; }",
            "    }",
            "    while total > 100 { total -= 1; }",
            "    total",
            "}"));

    private static final List<String> HOSTILE = List.of(
        "",
        "   \n\t\n",
        "}}}",
        "{{{",
        "((((",
        ")",
        "\"never closed",
        "/* never closed",
        "def f(:\n",
        "class {",
        "if (x",
        "else { }",
        "x = = = 1;",
        "fn (",
        "\u0000\uFFFF ",
        "\t    mixed\n  indentation\n\t\tlevels\n",
        "(".repeat(5000) + "1" + ")".repeat(5000),
        "{".repeat(3000) + "}".repeat(3000));

    private static final ParserRegistry REGISTRY = ParserRegistry.discover();

    static Stream<Arguments> hostileInputs() {
        return LANGUAGES.stream().flatMap(language -> HOSTILE.stream().map(source -> Arguments.of(language, source)));
    }

    static Stream<String> languages() {
        return LANGUAGES.stream();
    }

    @ParameterizedTest
    @MethodSource("hostileInputs")
    void testNeverThrowsAndErrorsImplyEmptyProgram(String language, String source) {
        ParseResult result = assertDoesNotThrow(() -> REGISTRY.parse(source, language));

        assertNotNull(result.ast());
        if (result.hasErrors()) {
            assertTrue(result.ast().body().isEmpty());
            assertEquals(1, result.metadata().nodeCount());
        }
        assertEquals(source.split("\n", -1).length, result.metadata().lineCount());
    }

    @ParameterizedTest
    @MethodSource("languages")
    void testLongFlatOperatorChain(String language) {
        int terms = 100_000;
        String chain = "a" + " + a".repeat(terms);
        String source = switch (language) {
            case "python" -> "x = " + chain + "\n";
            case "java" -> "class A { int x = " + chain + "; }";
            case "rust" -> "fn f() { let x = " + chain + "; }";
            default -> "let x = " + chain + ";";
        };

        ParseResult result = assertDoesNotThrow(() -> REGISTRY.parse(source, language));

        if (result.isSuccess()) {
            assertTrue(result.metadata().nodeCount() > 2 * terms, () -> language + ": " + result.metadata());
            assertTrue(AstQueries.getDepth(result.ast()) > terms);
        } else {
            assertEquals(1, result.metadata().nodeCount());
        }
    }

    @ParameterizedTest
    @MethodSource("languages")
    void testNullSource(String language) {
        ParseResult result = assertDoesNotThrow(() -> REGISTRY.requireParser(language).parse(null));

        assertTrue(result.isSuccess());
        assertTrue(result.ast().body().isEmpty());
        assertEquals(1, result.metadata().lineCount());
    }

    @ParameterizedTest
    @MethodSource("languages")
    void testEmptySource(String language) {
        ParseResult result = REGISTRY.parse("", language);

        assertTrue(result.isSuccess());
        assertTrue(result.ast().body().isEmpty());
        assertTrue(result.warnings().isEmpty());
        assertEquals(1, result.metadata().lineCount());
        assertEquals(language, result.metadata().language());
    }

    @ParameterizedTest
    @MethodSource("languages")
    void testSampleParsesDeterministically(String language) {
        Parser parser = REGISTRY.requireParser(language);
        ParseResult first = parser.parse(SAMPLES.get(language));
        ParseResult second = parser.parse(SAMPLES.get(language));

        assertTrue(first.isSuccess(), () -> language + ": " + first.errors());
        assertEquals(first.ast(), second.ast());
        assertEquals(first.metadata().nodeCount(), second.metadata().nodeCount());
    }

    @ParameterizedTest
    @MethodSource("languages")
    void testWalkVisitsEveryCountedNode(String language) {
        ParseResult result = REGISTRY.parse(SAMPLES.get(language), language);
        int[] visits = {0};
        AstWalker.walk(result.ast(), (node, parent) -> visits[0]++);

        assertEquals(AstQueries.countNodes(result.ast()), visits[0]);
        assertTrue(visits[0] >= result.metadata().nodeCount());
    }

    @ParameterizedTest
    @MethodSource("languages")
    void testSampleMetrics(String language) {
        ParseResult result = REGISTRY.parse(SAMPLES.get(language), language);

        int loops = AstQueries.findNodesByType(result.ast(), WhileLoop.class).size()
            + AstQueries.findNodesByType(result.ast(), ForLoop.class).size();
        assertEquals(2, loops);
        assertEquals(loops, AstMetrics.extractMetrics(result.ast()).loops());
        // if, for, while and one logical and
        assertEquals(5, AstMetrics.calculateComplexity(result.ast()));
    }

    @ParameterizedTest
    @MethodSource("languages")
    void testLocationsCanBeDisabled(String language) {
        Parser parser = ParserRegistry.discover().requireParser(language);
        parser.updateConfig(ParserConfig.builder().locations(false).build());
        ParseResult result = parser.parse(SAMPLES.get(language));

        assertTrue(result.isSuccess());
        AstWalker.walk(result.ast(), (node, parent) -> {
            assertNull(node.loc(), node::type);
        });
    }

    @ParameterizedTest
    @ValueSource(strings = {"a.js", "b.mjs", "c.py", "D.JAVA", "e.rs"})
    void testDispatchByFilename(String filename) {
        ParseResult result = REGISTRY.parseByFilename("", filename);

        assertTrue(result.isSuccess());
        assertEquals(filename, result.metadata().filename());
    }

    @Test
    void testRegisteredLanguages() {
        assertTrue(REGISTRY.getRegisteredLanguages().containsAll(LANGUAGES));
    }
}
