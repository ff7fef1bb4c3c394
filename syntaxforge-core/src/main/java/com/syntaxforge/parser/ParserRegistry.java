package com.syntaxforge.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Maps language ids to parsers and dispatches parse requests.
 *
 * <p>Ids are case-insensitive and kept in registration order; registering an
 * id twice replaces the parser but keeps the id's original position.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ParserRegistry registry = new ParserRegistry();
 * registry.register("python", new PythonParser());
 * ParseResult result = registry.parse(source, "python", "app.py");
 * }</pre>
 */
public class ParserRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ParserRegistry.class);

    private final Map<String, Parser> parsers = new LinkedHashMap<>();

    /**
     * Creates a registry holding every {@link Parser} found by {@link ServiceLoader},
     * each under its own {@link Parser#getLanguageId()}.
     */
    public static ParserRegistry discover() {
        return discover(Thread.currentThread().getContextClassLoader());
    }

    public static ParserRegistry discover(ClassLoader classLoader) {
        ParserRegistry registry = new ParserRegistry();
        for (Parser parser : ServiceLoader.load(Parser.class, classLoader)) {
            registry.register(parser.getLanguageId(), parser);
        }
        LOG.info("Discovered parsers for {}", registry.getRegisteredLanguages());
        return registry;
    }

    /**
     * Process-wide registry built with {@link #discover()} on first use.
     * Prefer passing an explicit registry to the code that needs one.
     */
    public static ParserRegistry defaultRegistry() {
        return DefaultHolder.INSTANCE;
    }

    private static final class DefaultHolder {
        static final ParserRegistry INSTANCE = discover(ParserRegistry.class.getClassLoader());
    }

    public synchronized void register(String languageId, Parser parser) {
        if (parser == null) {
            throw new IllegalArgumentException("Parser is required");
        }
        Parser previous = parsers.put(key(languageId), parser);
        if (previous != null && previous != parser) {
            LOG.debug("Replaced parser for '{}': {} -> {}", key(languageId),
                previous.getClass().getSimpleName(), parser.getClass().getSimpleName());
        } else {
            LOG.debug("Registered parser for '{}': {}", key(languageId), parser.getClass().getSimpleName());
        }
    }

    public synchronized boolean unregister(String languageId) {
        boolean removed = parsers.remove(key(languageId)) != null;
        if (removed) {
            LOG.debug("Unregistered parser for '{}'", key(languageId));
        }
        return removed;
    }

    public synchronized Optional<Parser> getParser(String languageId) {
        return Optional.ofNullable(parsers.get(key(languageId)));
    }

    /**
     * @throws UnknownLanguageException if no parser is registered for {@code languageId}
     */
    public Parser requireParser(String languageId) {
        return getParser(languageId).orElseThrow(() -> UnknownLanguageException.forLanguage(languageId));
    }

    /**
     * The first parser, in registration order, that accepts the file name.
     */
    public synchronized Optional<Parser> getParserByFilename(String filename) {
        for (Parser parser : parsers.values()) {
            if (parser.canParse(filename)) {
                return Optional.of(parser);
            }
        }
        return Optional.empty();
    }

    public synchronized List<String> getRegisteredLanguages() {
        return new ArrayList<>(parsers.keySet());
    }

    public ParseResult parse(String source, String languageId) {
        return parse(source, languageId, null);
    }

    /**
     * Parses with the parser registered for {@code languageId}.
     *
     * @throws UnknownLanguageException if no parser is registered for {@code languageId}
     */
    public ParseResult parse(String source, String languageId, String filename) {
        return requireParser(languageId).parse(source, filename);
    }

    /**
     * Parses with the parser chosen from the file name's extension. The file is not read.
     *
     * @throws UnknownLanguageException if no registered parser accepts {@code filename}
     */
    public ParseResult parseByFilename(String source, String filename) {
        Parser parser = getParserByFilename(filename)
            .orElseThrow(() -> UnknownLanguageException.forFilename(filename));
        return parser.parse(source, filename);
    }

    private static String key(String languageId) {
        if (languageId == null) {
            throw new IllegalArgumentException("Language id is required");
        }
        return languageId.toLowerCase(Locale.ROOT);
    }
}
