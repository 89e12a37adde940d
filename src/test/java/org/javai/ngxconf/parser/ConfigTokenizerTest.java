package org.javai.ngxconf.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.Reader;
import java.util.List;
import org.javai.ngxconf.ConfigParseException;
import org.javai.ngxconf.ConfigParseException.ErrorKind;
import org.javai.ngxconf.Quote;
import org.junit.jupiter.api.Test;

class ConfigTokenizerTest {

	@Test
	void tokenizeEmptyString() {
		ConfigTokenizer tokenizer = new ConfigTokenizer("");

		Token token = tokenizer.scan();

		assertThat(token.kind()).isEqualTo(TokenKind.END_OF_INPUT);
		assertThat(tokenizer.scanAll()).isEmpty();
	}

	@Test
	void endOfInputIsRepeatable() {
		ConfigTokenizer tokenizer = new ConfigTokenizer("  \n\t ");

		assertThat(tokenizer.scan().kind()).isEqualTo(TokenKind.END_OF_INPUT);
		assertThat(tokenizer.scan().kind()).isEqualTo(TokenKind.END_OF_INPUT);
	}

	@Test
	void tokenizeNullInput() {
		ConfigTokenizer tokenizer = new ConfigTokenizer((String) null);

		assertThat(tokenizer.scan().kind()).isEqualTo(TokenKind.END_OF_INPUT);
	}

	@Test
	void tokenizeSimpleDirective() {
		List<Token> tokens = new ConfigTokenizer("listen 80;").scanAll();

		assertThat(tokens).extracting(Token::kind)
				.containsExactly(TokenKind.KEYWORD, TokenKind.KEYWORD, TokenKind.SEMICOLON);
		assertThat(tokens).extracting(Token::literal).containsExactly("listen", "80", ";");
	}

	@Test
	void tokenizeBlockPunctuation() {
		List<Token> tokens = new ConfigTokenizer("events{}").scanAll();

		assertThat(tokens).extracting(Token::kind)
				.containsExactly(TokenKind.KEYWORD, TokenKind.BLOCK_START, TokenKind.BLOCK_END);
		assertThat(tokens.get(0).literal()).isEqualTo("events");
	}

	@Test
	void closingBraceDoesNotTerminateWord() {
		List<Token> tokens = new ConfigTokenizer("a}").scanAll();

		assertThat(tokens).singleElement().satisfies(token -> {
			assertThat(token.kind()).isEqualTo(TokenKind.KEYWORD);
			assertThat(token.literal()).isEqualTo("a}");
		});
	}

	@Test
	void tokenizeCommentToEndOfLine() {
		List<Token> tokens = new ConfigTokenizer("# a comment; {not} parsed\nlisten").scanAll();

		assertThat(tokens).hasSize(2);
		assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.COMMENT);
		assertThat(tokens.get(0).literal()).isEqualTo("# a comment; {not} parsed");
		assertThat(tokens.get(1).kind()).isEqualTo(TokenKind.KEYWORD);
	}

	@Test
	void tokenizeVariables() {
		List<Token> tokens = new ConfigTokenizer("map $host $clientname{").scanAll();

		assertThat(tokens).extracting(Token::kind).containsExactly(
				TokenKind.KEYWORD, TokenKind.VARIABLE, TokenKind.VARIABLE, TokenKind.BLOCK_START);
		assertThat(tokens.get(2).literal()).isEqualTo("$clientname");
	}

	@Test
	void tokenizeQuotedStringsWithEachDelimiter() {
		List<Token> tokens = new ConfigTokenizer("\"double\" 'single' `back tick`").scanAll();

		assertThat(tokens).extracting(Token::kind).containsOnly(TokenKind.QUOTED_STRING);
		assertThat(tokens).extracting(Token::literal).containsExactly("double", "single", "back tick");
		assertThat(tokens).extracting(Token::quote).containsExactly(Quote.DOUBLE, Quote.SINGLE, Quote.BACKTICK);
	}

	@Test
	void decodeEscapeSequences() {
		Token token = new ConfigTokenizer("\"a\\nb\\\\c\\\"d\"").scan();

		assertThat(token.kind()).isEqualTo(TokenKind.QUOTED_STRING);
		assertThat(token.literal()).isEqualTo("a\nb\\c\"d");
	}

	@Test
	void decodeTabAndCarriageReturn() {
		Token token = new ConfigTokenizer("'x\\ty\\rz'").scan();

		assertThat(token.literal()).isEqualTo("x\ty\rz");
	}

	@Test
	void backslashBeforeOrdinaryCharacterIsKept() {
		Token token = new ConfigTokenizer("\"~*\\.php$\"").scan();

		assertThat(token.literal()).isEqualTo("~*\\.php$");
	}

	@Test
	void otherDelimiterIsNotEscapable() {
		Token token = new ConfigTokenizer("'say \\\"hi\\''").scan();

		assertThat(token.literal()).isEqualTo("say \\\"hi'");
	}

	@Test
	void quotedStringMaySpanLines() {
		Token token = new ConfigTokenizer("'first\nsecond'").scan();

		assertThat(token.literal()).isEqualTo("first\nsecond");
	}

	@Test
	void unterminatedStringFails() {
		ConfigTokenizer tokenizer = new ConfigTokenizer("listen \"abc");
		tokenizer.scan();

		assertThatThrownBy(tokenizer::scan)
				.isInstanceOf(ConfigParseException.class)
				.hasMessageContaining("unterminated string")
				.satisfies(e -> {
					ConfigParseException error = (ConfigParseException) e;
					assertThat(error.getKind()).isEqualTo(ErrorKind.LEXICAL);
					assertThat(error.getLine()).isEqualTo(1);
					assertThat(error.getColumn()).isEqualTo(8);
				});
	}

	@Test
	void escapedClosingDelimiterLeavesStringUnterminated() {
		ConfigTokenizer tokenizer = new ConfigTokenizer("'abc\\'");

		assertThatThrownBy(tokenizer::scan)
				.isInstanceOf(ConfigParseException.class)
				.hasMessageContaining("unterminated string");
	}

	@Test
	void tokensCarryLineAndColumn() {
		List<Token> tokens = new ConfigTokenizer("http {\n  listen  80;\n}").scanAll();

		assertThat(tokens).extracting(Token::line).containsExactly(1, 1, 2, 2, 2, 3);
		assertThat(tokens).extracting(Token::column).containsExactly(1, 6, 3, 11, 13, 1);
	}

	@Test
	void readFailureSurfacesAsIoError() {
		Reader failing = new Reader() {
			@Override
			public int read(char[] cbuf, int off, int len) throws IOException {
				throw new IOException("disk on fire");
			}

			@Override
			public void close() {
			}
		};
		ConfigTokenizer tokenizer = new ConfigTokenizer(failing, "broken.conf");

		assertThatThrownBy(tokenizer::scan)
				.isInstanceOf(ConfigParseException.class)
				.satisfies(e -> assertThat(((ConfigParseException) e).getKind()).isEqualTo(ErrorKind.IO))
				.hasRootCauseMessage("disk on fire")
				.hasMessageContaining("broken.conf");
	}

	@Test
	void nullReaderIsRejected() {
		assertThatThrownBy(() -> new ConfigTokenizer(null, "x"))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
