package org.starledger.parser.frontend.lexer;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class TokenizerTest {

    private final Tokenizer tokenizer = new Tokenizer();

    private List<TokenType> types(String text) {
        return tokenizer.tokenize(text).stream().map(Token::type).toList();
    }

    @Test
    void emptyInputYieldsOnlyEof() {
        List<Token> tokens = tokenizer.tokenize("");

        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).type()).isEqualTo(TokenType.EOF);
    }

    @Test
    void structuralCharactersSplitUnitsWithoutWhitespace() {
        assertThat(types("a={b=1}")).containsExactly(
                TokenType.STRING, TokenType.EQUAL, TokenType.BRACE_OPEN,
                TokenType.STRING, TokenType.EQUAL, TokenType.INTEGER,
                TokenType.BRACE_CLOSE, TokenType.EOF);
    }

    @Test
    void classifiesIntegersBeforeFloatsBeforeStrings() {
        List<Token> tokens = tokenizer.tokenize("42 -7 +3 1.5 -0.25 2200.01.01 yes 1e5");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.INTEGER, TokenType.INTEGER, TokenType.INTEGER,
                TokenType.FLOAT, TokenType.FLOAT,
                TokenType.STRING, TokenType.STRING, TokenType.STRING,
                TokenType.EOF);
        assertThat(tokens.get(1).longValue()).isEqualTo(-7L);
        assertThat(tokens.get(4).doubleValue()).isEqualTo(-0.25);
    }

    @Test
    void integerBeyondLongRangeIsKeptAsText() {
        List<Token> tokens = tokenizer.tokenize("99999999999999999999");

        assertThat(tokens.get(0).type()).isEqualTo(TokenType.STRING);
        assertThat(tokens.get(0).text()).isEqualTo("99999999999999999999");
    }

    @Test
    void quotedStringKeepsDelimitersAndEscapedQuotes() {
        List<Token> tokens = tokenizer.tokenize("name=\"Sol {Prime} = \\\"home\\\"\"");

        assertThat(tokens).hasSize(4);
        assertThat(tokens.get(2).type()).isEqualTo(TokenType.STRING);
        assertThat(tokens.get(2).text()).isEqualTo("Sol {Prime} = \\\"home\\\"");
    }

    @Test
    void quotedNumberIsAString() {
        Token token = tokenizer.tokenize("\"2200.01.01\"").get(0);

        assertThat(token.type()).isEqualTo(TokenType.STRING);
        assertThat(token.text()).isEqualTo("2200.01.01");
    }

    @Test
    void tracksLineNumbersIncludingMultiLineStrings() {
        List<Token> tokens = tokenizer.tokenize("a=1\nb=\"x\ny\"\nc=2");

        assertThat(tokens.get(0).line()).isEqualTo(1);
        assertThat(tokens.get(3).line()).isEqualTo(2);
        assertThat(tokens.get(5).line()).isEqualTo(2);
        assertThat(tokens.get(6).line()).isEqualTo(4);
    }

    @Test
    void unterminatedQuoteDoesNotThrow() {
        List<Token> tokens = tokenizer.tokenize("a=\"open");

        assertThat(tokens).extracting(Token::type)
                .containsExactly(TokenType.STRING, TokenType.EQUAL, TokenType.STRING, TokenType.EOF);
        assertThat(tokens.get(2).text()).isEqualTo("open");
    }
}
