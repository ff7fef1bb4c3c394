package com.syntaxforge.lang;

import com.syntaxforge.ast.Program;
import com.syntaxforge.parser.AbstractParser;
import com.syntaxforge.parser.ParseContext;
import com.syntaxforge.parser.ParserConfig;

import java.util.Set;

/**
 * Rust items and statements: functions, structs, enums, traits, impl blocks,
 * bindings, loops and match.
 */
public class RustParser extends AbstractParser {

    private static final Set<String> EXTENSIONS = Set.of("rs");

    public RustParser() {
        super();
    }

    public RustParser(ParserConfig config) {
        super(config);
    }

    @Override
    protected Program parseProgram(ParseContext context) {
        return new RustStatementParser(context).parseProgram();
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return EXTENSIONS;
    }

    @Override
    public String getLanguageId() {
        return "rust";
    }
}
