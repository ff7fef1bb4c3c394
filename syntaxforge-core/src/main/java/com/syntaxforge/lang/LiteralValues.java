package com.syntaxforge.lang;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Converts literal spellings to their values.
 */
final class LiteralValues {

    private static final Pattern INTEGER_SUFFIX = Pattern.compile("([iu](8|16|32|64|128|size)|[lLnN])$");
    private static final Pattern FLOAT_SUFFIX = Pattern.compile("(f32|f64|[fFdD])$");

    private LiteralValues() {
    }

    /**
     * A {@link Long} for integral spellings that fit, otherwise a {@link Double}.
     */
    static Number number(String lexeme) {
        String digits = lexeme.replace("_", "");
        String lower = digits.toLowerCase(Locale.ROOT);
        if (lower.startsWith("0x") || lower.startsWith("0b") || lower.startsWith("0o")) {
            int radix = lower.charAt(1) == 'x' ? 16 : lower.charAt(1) == 'b' ? 2 : 8;
            String body = INTEGER_SUFFIX.matcher(lower.substring(2)).replaceFirst("");
            if (radix != 16) {
                body = body.replaceAll("[a-z]+$", "");
            }
            return parseIntegral(body, radix);
        }

        boolean floating = false;
        String body = digits;
        if (FLOAT_SUFFIX.matcher(body).find() && !INTEGER_SUFFIX.matcher(body).find()) {
            body = FLOAT_SUFFIX.matcher(body).replaceFirst("");
            floating = true;
        } else {
            body = INTEGER_SUFFIX.matcher(body).replaceFirst("");
        }
        if (body.startsWith(".")) {
            body = "0" + body;
        }
        if (floating || body.contains(".") || body.contains("e") || body.contains("E")) {
            return Double.parseDouble(body);
        }
        return parseIntegral(body, 10);
    }

    private static Number parseIntegral(String digits, int radix) {
        try {
            return Long.parseLong(digits, radix);
        } catch (NumberFormatException e) {
            if (radix == 10 && digits.chars().allMatch(Character::isDigit) && !digits.isEmpty()) {
                return new BigDecimal(digits).doubleValue();
            }
            throw new ExpressionException("Malformed number '" + digits + "'", -1);
        }
    }

    /**
     * The content of a string or char literal with escapes resolved. Raw strings
     * keep their backslashes; template and f-string placeholders are kept as written.
     */
    static String string(String lexeme) {
        int quoteAt = 0;
        while (quoteAt < lexeme.length() && "\"'`".indexOf(lexeme.charAt(quoteAt)) < 0) {
            quoteAt++;
        }
        String prefix = lexeme.substring(0, quoteAt).toLowerCase(Locale.ROOT);
        boolean raw = prefix.contains("r");
        String body = lexeme.substring(quoteAt);

        if (prefix.contains("#")) {
            // Rust r#"..."#: quoteAt points at the first quote after the hashes
            int hashes = quoteAt - 1;
            return lexeme.substring(quoteAt + 1, lexeme.length() - 1 - hashes);
        }

        int quoteLength = body.length() >= 6 && (body.startsWith("\"\"\"") || body.startsWith("'''")) ? 3 : 1;
        String content = body.length() >= 2 * quoteLength
            ? body.substring(quoteLength, body.length() - quoteLength)
            : "";
        return raw ? content : unescape(content);
    }

    private static String unescape(String content) {
        if (content.indexOf('\\') < 0) {
            return content;
        }
        StringBuilder out = new StringBuilder(content.length());
        int i = 0;
        while (i < content.length()) {
            char ch = content.charAt(i);
            if (ch != '\\' || i + 1 >= content.length()) {
                out.append(ch);
                i++;
                continue;
            }
            char next = content.charAt(i + 1);
            i += 2;
            switch (next) {
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case '0' -> out.append('\0');
                case '\n' -> { } // line continuation
                case 'x' -> {
                    int end = Math.min(i + 2, content.length());
                    i = appendCodePoint(out, content, i, end, next);
                }
                case 'u' -> {
                    if (i < content.length() && content.charAt(i) == '{') {
                        int close = content.indexOf('}', i);
                        if (close > 0) {
                            appendCodePoint(out, content, i + 1, close, next);
                            i = close + 1;
                        } else {
                            out.append(next);
                        }
                    } else {
                        i = appendCodePoint(out, content, i, Math.min(i + 4, content.length()), next);
                    }
                }
                default -> out.append(next);
            }
        }
        return out.toString();
    }

    private static int appendCodePoint(StringBuilder out, String content, int from, int to, char escape) {
        String hex = content.substring(from, to);
        if (hex.isEmpty() || !hex.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
            out.append(escape);
            return from;
        }
        out.appendCodePoint(Integer.parseInt(hex, 16));
        return to;
    }
}
