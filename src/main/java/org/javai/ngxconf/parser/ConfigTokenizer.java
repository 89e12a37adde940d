package org.javai.ngxconf.parser;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import org.javai.ngxconf.ConfigParseException;
import org.javai.ngxconf.Quote;

/**
 * Tokenizer for directive/block configuration syntax.
 * Reads characters one at a time with a single character of lookahead and
 * hands out one {@link Token} per {@link #scan()} call.
 */
public class ConfigTokenizer {

	private static final int EOF = -1;

	private final Reader reader;
	private final String sourceName;
	private int lookahead;
	private boolean lookaheadLoaded = false;
	private int line = 1;
	private int column = 1;

	public ConfigTokenizer(Reader reader, String sourceName) {
		if (reader == null) {
			throw new IllegalArgumentException("Reader cannot be null");
		}
		this.reader = reader;
		this.sourceName = sourceName;
	}

	public ConfigTokenizer(String input) {
		this(new StringReader(input != null ? input : ""), null);
	}

	/**
	 * The name of the source being read, for diagnostics; may be null.
	 */
	public String getSourceName() {
		return sourceName;
	}

	/**
	 * Reads the next token. Once the input is exhausted every call returns an
	 * {@link TokenKind#END_OF_INPUT} token.
	 *
	 * @throws ConfigParseException on an unterminated quoted string or a read failure
	 */
	public Token scan() {
		skipWhitespace();
		int c = peek();
		int startLine = line;
		int startColumn = column;

		if (c == EOF) {
			return new Token(TokenKind.END_OF_INPUT, "", startLine, startColumn);
		}
		switch (c) {
			case ';' -> {
				advance();
				return new Token(TokenKind.SEMICOLON, ";", startLine, startColumn);
			}
			case '{' -> {
				advance();
				return new Token(TokenKind.BLOCK_START, "{", startLine, startColumn);
			}
			case '}' -> {
				advance();
				return new Token(TokenKind.BLOCK_END, "}", startLine, startColumn);
			}
			case '#' -> {
				return new Token(TokenKind.COMMENT, readUntilEndOfLine(), startLine, startColumn);
			}
			case '$' -> {
				return new Token(TokenKind.VARIABLE, readWord(), startLine, startColumn);
			}
			default -> {
				if (Quote.isDelimiter(c)) {
					return scanQuotedString((char) c, startLine, startColumn);
				}
				return new Token(TokenKind.KEYWORD, readWord(), startLine, startColumn);
			}
		}
	}

	/**
	 * Reads every remaining token, excluding the final end-of-input token.
	 */
	public List<Token> scanAll() {
		List<Token> tokens = new ArrayList<>();
		for (Token token = scan(); !token.isKind(TokenKind.END_OF_INPUT); token = scan()) {
			tokens.add(token);
		}
		return tokens;
	}

	private Token scanQuotedString(char delimiter, int startLine, int startColumn) {
		advance(); // consume opening delimiter

		StringBuilder sb = new StringBuilder();
		while (true) {
			int c = advance();
			if (c == EOF) {
				throw ConfigParseException.lexical("unterminated string", sourceName, startLine, startColumn);
			}
			if (c == delimiter) {
				break;
			}
			if (c == '\\' && isEscapable(peek(), delimiter)) {
				int escaped = advance();
				sb.append(switch (escaped) {
					case 'n' -> '\n';
					case 'r' -> '\r';
					case 't' -> '\t';
					default -> (char) escaped; // backslash or the delimiter itself
				});
				continue;
			}
			sb.append((char) c);
		}
		return new Token(TokenKind.QUOTED_STRING, sb.toString(), Quote.of(delimiter), startLine, startColumn);
	}

	private String readWord() {
		StringBuilder sb = new StringBuilder();
		sb.append((char) advance());
		while (peek() != EOF && !isWordTerminator(peek())) {
			sb.append((char) advance());
		}
		return sb.toString();
	}

	private String readUntilEndOfLine() {
		StringBuilder sb = new StringBuilder();
		while (peek() != EOF && !isEndOfLine(peek())) {
			sb.append((char) advance());
		}
		return sb.toString();
	}

	private void skipWhitespace() {
		while (isWhitespace(peek())) {
			advance();
		}
	}

	private int peek() {
		if (!lookaheadLoaded) {
			lookahead = read();
			lookaheadLoaded = true;
		}
		return lookahead;
	}

	private int advance() {
		int c = peek();
		lookaheadLoaded = false;
		if (c == '\n') {
			line++;
			column = 1;
		} else if (c != EOF) {
			column++;
		}
		return c;
	}

	private int read() {
		try {
			return reader.read();
		} catch (IOException e) {
			throw ConfigParseException.io("Failed to read configuration source", sourceName, e);
		}
	}

	private static boolean isEscapable(int c, char delimiter) {
		return c == delimiter || c == 'n' || c == 'r' || c == 't' || c == '\\';
	}

	private static boolean isWordTerminator(int c) {
		return isWhitespace(c) || c == '{' || c == ';';
	}

	private static boolean isWhitespace(int c) {
		return c == ' ' || c == '\t' || isEndOfLine(c);
	}

	private static boolean isEndOfLine(int c) {
		return c == '\n' || c == '\r';
	}
}
