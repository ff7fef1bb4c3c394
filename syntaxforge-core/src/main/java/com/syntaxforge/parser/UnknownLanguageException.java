package com.syntaxforge.parser;

/**
 * Raised by {@link ParserRegistry} when no parser is registered for a language id or file name.
 */
public class UnknownLanguageException extends RuntimeException {

    private final String language;

    public UnknownLanguageException(String language, String message) {
        super(message);
        this.language = language;
    }

    public static UnknownLanguageException forLanguage(String languageId) {
        return new UnknownLanguageException(languageId, "No parser registered for language: " + languageId);
    }

    public static UnknownLanguageException forFilename(String filename) {
        return new UnknownLanguageException(filename, "No parser found for file: " + filename);
    }

    /**
     * The language id or file name that could not be resolved.
     */
    public String getLanguage() {
        return language;
    }
}
