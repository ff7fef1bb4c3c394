package com.syntaxforge.lang;

import com.syntaxforge.ast.Program;
import com.syntaxforge.parser.AbstractParser;
import com.syntaxforge.parser.ParseContext;
import com.syntaxforge.parser.ParserConfig;

import java.util.Set;

/**
 * Java statement and declaration structure: packages, imports, classes,
 * interfaces, enums and records with their members.
 */
public class JavaParser extends AbstractParser {

    private static final Set<String> EXTENSIONS = Set.of("java");

    public JavaParser() {
        super();
    }

    public JavaParser(ParserConfig config) {
        super(config);
    }

    @Override
    protected Program parseProgram(ParseContext context) {
        return new JavaStatementParser(context).parseProgram();
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return EXTENSIONS;
    }

    @Override
    public String getLanguageId() {
        return "java";
    }
}
