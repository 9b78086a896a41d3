package org.starledger.parser.frontend.lexer;

/**
 * A single lexical unit of a snapshot file.
 *
 * @param type   The token category.
 * @param lexeme The raw source text of the token, including surrounding quotes for quoted strings.
 * @param line   The 1-based source line the token starts on. The synthetic EOF token carries the last line.
 */
public record Token(TokenType type, String lexeme, int line) {

    /**
     * Returns the textual value of the token with surrounding quotes removed.
     * @return The unquoted text, or an empty string for EOF.
     */
    public String text() {
        if (lexeme == null) {
            return "";
        }
        if (lexeme.length() >= 2 && lexeme.charAt(0) == '"' && lexeme.charAt(lexeme.length() - 1) == '"') {
            return lexeme.substring(1, lexeme.length() - 1);
        }
        if (lexeme.length() == 1 && lexeme.charAt(0) == '"') {
            return "";
        }
        if (!lexeme.isEmpty() && lexeme.charAt(0) == '"') {
            // unterminated quote at end of input
            return lexeme.substring(1);
        }
        return lexeme;
    }

    /**
     * Returns the integer value of an {@link TokenType#INTEGER} token.
     * @return The parsed value.
     * @throws IllegalStateException if this is not an integer token.
     */
    public long longValue() {
        if (type != TokenType.INTEGER) {
            throw new IllegalStateException("Token is not an integer: " + this);
        }
        return Long.parseLong(lexeme);
    }

    /**
     * Returns the floating point value of an {@link TokenType#FLOAT} or {@link TokenType#INTEGER} token.
     * @return The parsed value.
     * @throws IllegalStateException if this is not a numeric token.
     */
    public double doubleValue() {
        if (type != TokenType.FLOAT && type != TokenType.INTEGER) {
            throw new IllegalStateException("Token is not numeric: " + this);
        }
        return Double.parseDouble(lexeme);
    }

    @Override
    public String toString() {
        return type + (lexeme != null ? "(" + lexeme + ")" : "") + "@" + line;
    }
}
