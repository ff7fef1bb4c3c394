package com.syntaxforge.parser;

import com.syntaxforge.ast.NodeType;
import com.syntaxforge.ast.Program;
import com.syntaxforge.traverse.AstWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Template for language parsers: wraps the language hook
 * {@link #parseProgram(ParseContext)} with timing, config snapshotting and the
 * error-to-empty-program conversion, so no subclass can throw out of {@link #parse}.
 */
public abstract class AbstractParser implements Parser {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractParser.class);

    private volatile ParserConfig config;

    protected AbstractParser() {
        this(null);
    }

    protected AbstractParser(ParserConfig config) {
        this.config = ParserConfig.defaults().merge(config);
    }

    /**
     * Builds the program for {@code context.source()}. Implementations report
     * recoverable problems through {@link ParseContext#error} and may throw
     * {@link SyntaxException} to stop early.
     */
    protected abstract Program parseProgram(ParseContext context);

    @Override
    public final ParseResult parse(String source, String filename) {
        long startNanos = System.nanoTime();
        ParserConfig snapshot = config;
        ParseContext context = new ParseContext(source, filename, snapshot);

        Program program = null;
        try {
            program = parseProgram(context);
        } catch (SyntaxException e) {
            context.error(e.getMessage(), e.getOffset());
        } catch (StackOverflowError e) {
            context.error("Source is nested too deeply to parse", -1);
        } catch (RuntimeException e) {
            LOG.warn("{} parser failed on {}", getLanguageId(), filename != null ? filename : "<source>", e);
            context.error("Internal parser error: " + e.getMessage(), -1);
        }
        if (program == null && !context.hasErrors()) {
            context.error("Parser produced no program", -1);
        }
        if (context.hasErrors()) {
            program = Program.empty(snapshot.sourceType());
        }

        int nodeCount = countConstructs(program);
        double parseTime = (System.nanoTime() - startNanos) / 1_000_000.0;
        ParseMetadata metadata = new ParseMetadata(
            getLanguageId(), parseTime, nodeCount, context.lineCount(), filename);

        if (LOG.isDebugEnabled()) {
            LOG.debug("Parsed {} ({}) in {} ms: {} nodes, {} errors, {} warnings",
                filename != null ? filename : "<source>", getLanguageId(),
                String.format("%.3f", parseTime), nodeCount,
                context.errors().size(), context.warnings().size());
        }
        return new ParseResult(program, context.errors(), context.warnings(), metadata);
    }

    // Block statements are containers, not constructs found in the source
    private static int countConstructs(Program program) {
        int[] count = {0};
        AstWalker.walk(program, (node, parent) -> {
            if (!node.is(NodeType.BLOCK_STATEMENT)) {
                count[0]++;
            }
        });
        return count[0];
    }

    @Override
    public synchronized void updateConfig(ParserConfig partial) {
        config = config.merge(partial);
    }

    @Override
    public ParserConfig getConfig() {
        return config;
    }
}
