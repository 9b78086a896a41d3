package org.starledger.parser.frontend.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits decoded snapshot text into a flat list of {@link Token}s.
 * <p>
 * The tokenizer is total: every input, including malformed or empty text, yields a token list that
 * ends with a single {@link TokenType#EOF} token. Structural problems are left for the parser to report.
 * <p>
 * Units are separated by whitespace and by the structural characters {@code = { }}. Quoted strings may
 * contain whitespace, structural characters and escaped quotes ({@code \"}). Each unquoted unit is
 * classified as integer, then float, then string. Instances hold no state, so a single tokenizer can be
 * shared between threads.
 */
public final class Tokenizer {

    private static final Pattern INTEGER = Pattern.compile("[-+]?[0-9]+");
    private static final Pattern FLOAT = Pattern.compile("[-+]?[0-9]+\\.[0-9]*([eE][-+]?[0-9]+)?");

    /**
     * Tokenizes the given text.
     *
     * @param text The decoded snapshot text.
     * @return The token list, always terminated by an EOF token.
     */
    public List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>(Math.max(16, text.length() / 6));
        int line = 1;
        int pos = 0;
        final int length = text.length();

        while (pos < length) {
            char c = text.charAt(pos);
            if (c == '\n') {
                line++;
                pos++;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '=') {
                tokens.add(new Token(TokenType.EQUAL, "=", line));
                pos++;
            } else if (c == '{') {
                tokens.add(new Token(TokenType.BRACE_OPEN, "{", line));
                pos++;
            } else if (c == '}') {
                tokens.add(new Token(TokenType.BRACE_CLOSE, "}", line));
                pos++;
            } else if (c == '"') {
                int start = pos;
                int startLine = line;
                pos++;
                while (pos < length) {
                    char q = text.charAt(pos);
                    if (q == '\\' && pos + 1 < length && text.charAt(pos + 1) == '"') {
                        pos += 2;
                        continue;
                    }
                    if (q == '\n') {
                        line++;
                    }
                    pos++;
                    if (q == '"') {
                        break;
                    }
                }
                tokens.add(new Token(TokenType.STRING, text.substring(start, pos), startLine));
            } else {
                int start = pos;
                while (pos < length && !isDelimiter(text.charAt(pos))) {
                    pos++;
                }
                tokens.add(classify(text.substring(start, pos), line));
            }
        }
        tokens.add(new Token(TokenType.EOF, null, line));
        return tokens;
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == '=' || c == '{' || c == '}' || c == '"';
    }

    private static Token classify(String unit, int line) {
        if (INTEGER.matcher(unit).matches()) {
            // numbers beyond the long range are kept as text
            if (fitsInLong(unit)) {
                return new Token(TokenType.INTEGER, unit, line);
            }
            return new Token(TokenType.STRING, unit, line);
        }
        if (FLOAT.matcher(unit).matches()) {
            return new Token(TokenType.FLOAT, unit, line);
        }
        return new Token(TokenType.STRING, unit, line);
    }

    private static boolean fitsInLong(String unit) {
        try {
            Long.parseLong(unit);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
