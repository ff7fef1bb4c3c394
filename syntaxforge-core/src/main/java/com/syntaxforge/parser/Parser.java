package com.syntaxforge.parser;

import java.util.Locale;
import java.util.Set;

/**
 * A language parser emitting the shared AST.
 *
 * <p>{@code parse} never throws for bad input: every failure is reported as a
 * {@link ParseError} inside a {@link ParseResult} whose program is empty.</p>
 */
public interface Parser {

    default ParseResult parse(String source) {
        return parse(source, null);
    }

    /**
     * Parses source text.
     *
     * @param source   the source text; {@code null} is treated as empty
     * @param filename optional file name, recorded in the metadata only
     * @return the parse result, never null
     */
    ParseResult parse(String source, String filename);

    /**
     * Lower-case extensions without the dot, e.g. {@code "py"}.
     */
    Set<String> getSupportedExtensions();

    String getLanguageId();

    /**
     * True iff the extension of {@code filename} (case-insensitive) is supported.
     */
    default boolean canParse(String filename) {
        if (filename == null) {
            return false;
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return false;
        }
        String extension = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        return getSupportedExtensions().contains(extension);
    }

    /**
     * Merges the non-null fields of {@code partial} into this parser's config.
     * Results already returned are not affected.
     */
    void updateConfig(ParserConfig partial);

    ParserConfig getConfig();
}
