package com.syntaxforge.parser;

import com.syntaxforge.ast.Range;
import com.syntaxforge.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-call state handed to a language parser: the source, the config snapshot
 * taken for this call and the diagnostic sinks.
 */
public final class ParseContext {

    private final String source;
    private final String filename;
    private final ParserConfig config;
    private final int[] lineOffsets; // Starting offset of each line
    private final List<ParseError> errors = new ArrayList<>();
    private final List<ParseWarning> warnings = new ArrayList<>();

    public ParseContext(String source, String filename, ParserConfig config) {
        this.source = source == null ? "" : source;
        this.filename = filename;
        this.config = config == null ? ParserConfig.defaults() : config;
        this.lineOffsets = computeLineOffsets(this.source);
    }

    private static int[] computeLineOffsets(String text) {
        int lines = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines++;
            }
        }
        int[] offsets = new int[lines];
        int line = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                offsets[line++] = i + 1;
            }
        }
        return offsets;
    }

    public String source() {
        return source;
    }

    public String filename() {
        return filename;
    }

    public ParserConfig config() {
        return config;
    }

    public int lineCount() {
        return lineOffsets.length;
    }

    /**
     * The text of a 1-based line without its line terminator.
     */
    public String line(int line) {
        int start = lineOffsets[line - 1];
        int end = line < lineOffsets.length ? lineOffsets[line] - 1 : source.length();
        if (end > start && source.charAt(end - 1) == '\r') {
            end--;
        }
        return source.substring(start, Math.max(start, end));
    }

    public int lineStart(int line) {
        return lineOffsets[line - 1];
    }

    /**
     * 1-based line containing {@code offset}.
     */
    public int lineAt(int offset) {
        int clamped = Math.max(0, Math.min(offset, source.length()));
        int low = 0;
        int high = lineOffsets.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineOffsets[mid] <= clamped) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low + 1;
    }

    public int columnAt(int offset) {
        int clamped = Math.max(0, Math.min(offset, source.length()));
        return clamped - lineOffsets[lineAt(clamped) - 1];
    }

    /**
     * Location of the span, or {@code null} when locations are disabled.
     */
    public SourceLocation location(int startOffset, int endOffset) {
        if (!config.locationsEnabled()) {
            return null;
        }
        return span(startOffset, endOffset);
    }

    /**
     * Range of the span, or {@code null} when ranges are disabled.
     */
    public Range range(int startOffset, int endOffset) {
        if (!config.rangesEnabled()) {
            return null;
        }
        int start = Math.max(0, Math.min(startOffset, source.length()));
        int end = Math.max(start, Math.min(endOffset, source.length()));
        return new Range(start, end);
    }

    private SourceLocation span(int startOffset, int endOffset) {
        int end = Math.max(startOffset, endOffset);
        return SourceLocation.of(lineAt(startOffset), columnAt(startOffset), lineAt(end), columnAt(end));
    }

    public void error(String message, int offset) {
        errors.add(new ParseError(message, offset < 0 ? null : span(offset, offset)));
    }

    public void warn(String message, int startOffset, int endOffset) {
        warnings.add(new ParseWarning(message, startOffset < 0 ? null : span(startOffset, endOffset)));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<ParseError> errors() {
        return Collections.unmodifiableList(errors);
    }

    public List<ParseWarning> warnings() {
        return Collections.unmodifiableList(warnings);
    }
}
