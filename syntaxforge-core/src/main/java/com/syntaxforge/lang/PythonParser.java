package com.syntaxforge.lang;

import com.syntaxforge.ast.Program;
import com.syntaxforge.parser.AbstractParser;
import com.syntaxforge.parser.ParseContext;
import com.syntaxforge.parser.ParserConfig;

import java.util.Set;

/**
 * Python 3 statement structure, read by indentation.
 */
public class PythonParser extends AbstractParser {

    private static final Set<String> EXTENSIONS = Set.of("py", "pyw", "python");

    public PythonParser() {
        super();
    }

    public PythonParser(ParserConfig config) {
        super(config);
    }

    @Override
    protected Program parseProgram(ParseContext context) {
        return new PythonStatementParser(context).parseProgram();
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return EXTENSIONS;
    }

    @Override
    public String getLanguageId() {
        return "python";
    }
}
