package com.syntaxforge.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserRegistryTest {

    @Test
    void testRegisterAndLookupIgnoreCase() {
        ParserRegistry registry = new ParserRegistry();
        StubParser parser = new StubParser("toy", "toy");
        registry.register("Toy", parser);

        assertSame(parser, registry.getParser("TOY").orElseThrow());
        assertSame(parser, registry.requireParser("toy"));
        assertEquals(List.of("toy"), registry.getRegisteredLanguages());
    }

    @Test
    void testReplacingKeepsRegistrationOrder() {
        ParserRegistry registry = new ParserRegistry();
        registry.register("a", new StubParser("a", "a"));
        registry.register("b", new StubParser("b", "b"));
        StubParser replacement = new StubParser("a", "aa");
        registry.register("A", replacement);

        assertEquals(List.of("a", "b"), registry.getRegisteredLanguages());
        assertSame(replacement, registry.requireParser("a"));
    }

    @Test
    void testUnregister() {
        ParserRegistry registry = new ParserRegistry();
        registry.register("toy", new StubParser("toy", "toy"));

        assertTrue(registry.unregister("TOY"));
        assertFalse(registry.unregister("toy"));
        assertTrue(registry.getParser("toy").isEmpty());
    }

    @Test
    void testFilenameDispatchUsesFirstMatchingParser() {
        ParserRegistry registry = new ParserRegistry();
        StubParser first = new StubParser("first", "txt");
        StubParser second = new StubParser("second", "txt", "md");
        registry.register("first", first);
        registry.register("second", second);

        assertSame(first, registry.getParserByFilename("notes.TXT").orElseThrow());
        assertSame(second, registry.getParserByFilename("README.md").orElseThrow());
        assertTrue(registry.getParserByFilename("Makefile").isEmpty());
        assertTrue(registry.getParserByFilename("trailing.").isEmpty());

        ParseResult result = registry.parseByFilename("", "dir/readme.md");
        assertEquals("second", result.metadata().language());
        assertEquals("dir/readme.md", result.metadata().filename());
    }

    @Test
    void testUnknownLanguage() {
        ParserRegistry registry = new ParserRegistry();

        UnknownLanguageException byId = assertThrows(UnknownLanguageException.class,
            () -> registry.parse("x", "cobol"));
        assertEquals("cobol", byId.getLanguage());
        assertTrue(byId.getMessage().contains("cobol"));

        UnknownLanguageException byName = assertThrows(UnknownLanguageException.class,
            () -> registry.parseByFilename("x", "main.cbl"));
        assertEquals("main.cbl", byName.getLanguage());
    }

    @Test
    void testArgumentValidation() {
        ParserRegistry registry = new ParserRegistry();
        assertThrows(IllegalArgumentException.class, () -> registry.register("toy", null));
        assertThrows(IllegalArgumentException.class, () -> registry.register(null, new StubParser("toy")));
    }

    @Test
    void testDiscoverFindsBundledLanguages() {
        ParserRegistry registry = ParserRegistry.discover();

        assertTrue(registry.getRegisteredLanguages().containsAll(List.of("javascript", "python", "java", "rust")));
        assertEquals("python", registry.getParserByFilename("tool.py").orElseThrow().getLanguageId());
        assertEquals("rust", registry.getParserByFilename("lib.rs").orElseThrow().getLanguageId());
        assertEquals("java", registry.getParserByFilename("Main.java").orElseThrow().getLanguageId());
        assertSame(ParserRegistry.defaultRegistry(), ParserRegistry.defaultRegistry());
    }
}
