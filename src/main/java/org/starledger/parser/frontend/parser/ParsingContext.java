package org.starledger.parser.frontend.parser;

import org.starledger.parser.frontend.lexer.Token;
import org.starledger.parser.frontend.lexer.TokenType;

/**
 * Cursor over the token stream used by the snapshot parser.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Consumes the current token and returns it. The EOF token is never consumed.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type.
     * @param type The expected token type.
     * @param errorMessage Description of the expected input, used in the exception message.
     * @return The consumed token.
     * @throws FormatException if the current token is of a different type.
     */
    Token consume(TokenType type, String errorMessage) throws FormatException;

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();
}
