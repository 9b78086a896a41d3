package org.starledger.parser.frontend.parser;

import org.starledger.parser.frontend.lexer.Token;
import org.starledger.parser.frontend.lexer.TokenType;
import org.starledger.parser.frontend.lexer.Tokenizer;
import org.starledger.parser.model.FloatValue;
import org.starledger.parser.model.IntValue;
import org.starledger.parser.model.Key;
import org.starledger.parser.model.ListValue;
import org.starledger.parser.model.MapValue;
import org.starledger.parser.model.StringValue;
import org.starledger.parser.model.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent parser turning a token stream into a value tree.
 * <p>
 * Grammar:
 * <pre>
 *   document       := key_value_list
 *   key_value_list := key '=' value (key '=' value)*
 *   key            := STRING | INTEGER
 *   value          := literal | '{' body '}'
 *   body           := (empty) | value_list | key_value_list
 *   value_list     := value+
 * </pre>
 * A brace block is classified with at most two tokens of lookahead: a nested {@code {} or an immediate
 * {@code }} makes it a list, otherwise the first literal is read and the block is a map if it is followed
 * by {@code =}, and a list seeded with that literal if it is followed by another literal or a brace.
 * <p>
 * Repeated keys inside one block are collected into a list in encounter order, even for two
 * occurrences. Blocks nested deeper than the configured limit are skipped and yield an empty list.
 * <p>
 * A parser instance is single-use and not thread-safe; {@link #parse(String)} creates one per call.
 */
public final class SnapshotParser implements ParsingContext {

    private static final Logger log = LoggerFactory.getLogger(SnapshotParser.class);

    public static final int DEFAULT_MAX_NESTING_DEPTH = 100;

    /** Key substituted when a key position holds {@code =}, as in {@code event_id=scope={ ... }}. */
    public static final String UNKNOWN_KEY = "unknown_key";

    private final List<Token> tokens;
    private final int maxNestingDepth;
    private int current = 0;
    private int depth = 0;

    public SnapshotParser(List<Token> tokens) {
        this(tokens, DEFAULT_MAX_NESTING_DEPTH);
    }

    public SnapshotParser(List<Token> tokens, int maxNestingDepth) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token stream must be terminated by EOF");
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        this.tokens = tokens;
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Tokenizes and parses snapshot text with the default nesting limit.
     *
     * @param text The decoded snapshot text.
     * @return The top-level map.
     * @throws FormatException if the text violates the grammar.
     */
    public static MapValue parse(String text) throws FormatException {
        return parse(text, DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * Tokenizes and parses snapshot text.
     *
     * @param text            The decoded snapshot text.
     * @param maxNestingDepth Blocks nested deeper than this are skipped.
     * @return The top-level map.
     * @throws FormatException if the text violates the grammar.
     */
    public static MapValue parse(String text, int maxNestingDepth) throws FormatException {
        return new SnapshotParser(new Tokenizer().tokenize(text), maxNestingDepth).parseDocument();
    }

    /**
     * Parses the whole token stream as a top-level key/value list.
     *
     * @return The top-level map.
     * @throws FormatException if the token stream violates the grammar.
     */
    public MapValue parseDocument() throws FormatException {
        BlockBuilder block = new BlockBuilder();
        while (!isAtEnd()) {
            parseKeyValuePair(block);
        }
        return block.build();
    }

    private void parseKeyValuePair(BlockBuilder block) throws FormatException {
        Token keyToken = peek();
        Key key;
        if (keyToken.type() == TokenType.EQUAL) {
            // the '=' is consumed below as the separator
            key = Key.of(UNKNOWN_KEY);
        } else if (keyToken.type() == TokenType.STRING || keyToken.type() == TokenType.INTEGER) {
            advance();
            key = toKey(keyToken);
        } else {
            throw new FormatException(keyToken.line(), "Expected a string or integer as key, found " + keyToken);
        }
        consume(TokenType.EQUAL, "Expected = after key '" + key + "'");
        block.put(key, parseValue());
    }

    private Value parseValue() throws FormatException {
        Token next = peek();
        if (next.type().isLiteral()) {
            return literal(advance());
        }
        if (next.type() == TokenType.BRACE_OPEN) {
            return parseBlock();
        }
        throw new FormatException(next.line(), "Expected literal or { for composite object or list, found " + next);
    }

    private Value parseBlock() throws FormatException {
        consume(TokenType.BRACE_OPEN, "Expected {");
        depth++;
        try {
            if (depth > maxNestingDepth) {
                return skipBlock();
            }
            if (check(TokenType.BRACE_OPEN)) {
                return parseList(null);
            }
            if (match(TokenType.BRACE_CLOSE)) {
                return ListValue.EMPTY;
            }
            Token first = advance();
            if (!first.type().isLiteral()) {
                throw new FormatException(first.line(), "Expected literal, { or } after {, found " + first);
            }
            Token next = peek();
            if (next.type() == TokenType.EQUAL) {
                if (first.type() == TokenType.FLOAT) {
                    throw new FormatException(first.line(), "Expected a string or integer as key, found " + first);
                }
                return parseMapBody(toKey(first));
            }
            if (next.type().isLiteral() || next.type() == TokenType.BRACE_CLOSE || next.type() == TokenType.BRACE_OPEN) {
                return parseList(literal(first));
            }
            throw new FormatException(next.line(), "Expected =, literal or brace after " + first + ", found " + next);
        } finally {
            depth--;
        }
    }

    private MapValue parseMapBody(Key firstKey) throws FormatException {
        BlockBuilder block = new BlockBuilder();
        consume(TokenType.EQUAL, "Expected = after key '" + firstKey + "'");
        block.put(firstKey, parseValue());
        while (!check(TokenType.BRACE_CLOSE)) {
            if (isAtEnd()) {
                throw new FormatException(peek().line(), "Expected } to close object, found end of input");
            }
            parseKeyValuePair(block);
        }
        advance();
        return block.build();
    }

    private ListValue parseList(Value first) throws FormatException {
        List<Value> values = new ArrayList<>();
        if (first != null) {
            values.add(first);
        }
        while (!check(TokenType.BRACE_CLOSE)) {
            if (isAtEnd()) {
                throw new FormatException(peek().line(), "Expected } to close list, found end of input");
            }
            values.add(parseValue());
        }
        advance();
        return new ListValue(values);
    }

    private ListValue skipBlock() throws FormatException {
        int startLine = previous().line();
        log.info("Skipping object nested deeper than {} levels at line {}", maxNestingDepth, startLine);
        int open = 1;
        while (open > 0) {
            if (isAtEnd()) {
                throw new FormatException(startLine, "Expected } to close nested object, found end of input");
            }
            Token t = advance();
            if (t.type() == TokenType.BRACE_OPEN) {
                open++;
            } else if (t.type() == TokenType.BRACE_CLOSE) {
                open--;
            }
        }
        return ListValue.EMPTY;
    }

    private static Key toKey(Token token) {
        return token.type() == TokenType.INTEGER ? Key.of(token.longValue()) : Key.of(token.text());
    }

    private static Value literal(Token token) {
        return switch (token.type()) {
            case INTEGER -> new IntValue(token.longValue());
            case FLOAT -> new FloatValue(token.doubleValue());
            default -> new StringValue(token.text());
        };
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        return peek().type() == type;
    }

    @Override
    public Token advance() {
        Token token = peek();
        if (!isAtEnd()) {
            current++;
        }
        return token;
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token previous() {
        return current == 0 ? tokens.get(0) : tokens.get(current - 1);
    }

    @Override
    public Token consume(TokenType type, String errorMessage) throws FormatException {
        if (check(type)) {
            return advance();
        }
        throw new FormatException(peek().line(), errorMessage + ", found " + peek());
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    /**
     * Collects the entries of one key/value block, turning repeated keys into lists.
     */
    private static final class BlockBuilder {
        private final Map<Key, Value> entries = new LinkedHashMap<>();
        private final Map<Key, List<Value>> repeated = new LinkedHashMap<>();

        void put(Key key, Value value) {
            List<Value> collected = repeated.get(key);
            if (collected != null) {
                collected.add(value);
                return;
            }
            Value existing = entries.get(key);
            if (existing == null) {
                entries.put(key, value);
                return;
            }
            collected = new ArrayList<>();
            collected.add(existing);
            collected.add(value);
            repeated.put(key, collected);
        }

        MapValue build() {
            for (Map.Entry<Key, List<Value>> entry : repeated.entrySet()) {
                // replacing an existing key keeps its first-occurrence position
                entries.put(entry.getKey(), new ListValue(entry.getValue()));
            }
            return new MapValue(entries);
        }
    }
}
