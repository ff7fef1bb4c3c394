package com.syntaxforge.parser;

import com.syntaxforge.ast.Program;

import java.util.List;

/**
 * Envelope returned by every {@link Parser}. When {@code errors} is non-empty the
 * AST is an empty {@link Program}; partial trees are never handed out.
 *
 * <p>{@code metadata().nodeCount()} counts recognized constructs and leaves out
 * {@code BlockStatement} containers, so it can be lower than
 * {@code AstQueries.countNodes(ast())}: {@code "fn main() {}"} reports 2 against 3.</p>
 */
public record ParseResult(
    Program ast,
    List<ParseError> errors,
    List<ParseWarning> warnings,
    ParseMetadata metadata
) {

    public ParseResult {
        if (ast == null) {
            throw new IllegalArgumentException("ParseResult requires a Program");
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (!errors.isEmpty() && !ast.body().isEmpty()) {
            throw new IllegalArgumentException("A ParseResult with errors must carry an empty Program");
        }
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }
}
