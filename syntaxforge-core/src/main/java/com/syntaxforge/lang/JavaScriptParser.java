package com.syntaxforge.lang;

import com.syntaxforge.ast.Program;
import com.syntaxforge.parser.AbstractParser;
import com.syntaxforge.parser.ParseContext;
import com.syntaxforge.parser.ParserConfig;

import java.util.Set;

/**
 * JavaScript (ES2020-ish) statement structure. Honors every {@link ParserConfig} option.
 */
public class JavaScriptParser extends AbstractParser {

    private static final Set<String> EXTENSIONS = Set.of("js", "mjs", "cjs", "jsx");

    public JavaScriptParser() {
        super();
    }

    public JavaScriptParser(ParserConfig config) {
        super(config);
    }

    @Override
    protected Program parseProgram(ParseContext context) {
        return new JavaScriptStatementParser(context).parseProgram();
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return EXTENSIONS;
    }

    @Override
    public String getLanguageId() {
        return "javascript";
    }
}
