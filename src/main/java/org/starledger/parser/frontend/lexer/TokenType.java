package org.starledger.parser.frontend.lexer;

/**
 * Token categories produced by the {@link Tokenizer}.
 */
public enum TokenType {
    BRACE_OPEN,
    BRACE_CLOSE,
    EQUAL,
    INTEGER,
    FLOAT,
    STRING,
    EOF;

    /**
     * Returns whether tokens of this type can appear as a plain value or key.
     * @return true for strings and numbers.
     */
    public boolean isLiteral() {
        return this == STRING || this == INTEGER || this == FLOAT;
    }
}
