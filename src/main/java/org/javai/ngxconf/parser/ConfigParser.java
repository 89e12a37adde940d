package org.javai.ngxconf.parser;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.javai.ngxconf.Block;
import org.javai.ngxconf.Comment;
import org.javai.ngxconf.Config;
import org.javai.ngxconf.ConfigParseException;
import org.javai.ngxconf.Directive;
import org.javai.ngxconf.DirectiveNode;
import org.javai.ngxconf.Parameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser for directive/block configuration documents.
 * <p>
 * The parser looks at two tokens at a time (current and following). Each statement
 * is parsed generically into a {@link Directive}; the {@link DirectiveRegistry} then
 * decides whether it is upgraded to a typed node. Parsing is fail-fast: the first
 * lexical, syntax or semantic error aborts the parse with a {@link ConfigParseException}.
 * <p>
 * Block nesting is limited by {@link ParserSettings#maxDepth()}.
 * <p>
 * An instance performs a single parse and is not thread-safe; parse independent
 * documents with independent instances.
 */
public class ConfigParser implements ParsingContext {

	private static final Logger logger = LoggerFactory.getLogger(ConfigParser.class);

	private final ConfigTokenizer tokenizer;
	private final DirectiveRegistry registry;
	private final ParserSettings settings;
	private Token currentToken;
	private Token followingToken;
	private boolean used = false;
	private int depth = 0;

	public ConfigParser(ConfigTokenizer tokenizer, DirectiveRegistry registry, ParserSettings settings) {
		if (tokenizer == null) {
			throw new IllegalArgumentException("Tokenizer cannot be null");
		}
		this.tokenizer = tokenizer;
		this.registry = registry != null ? registry : DirectiveRegistry.standard();
		this.settings = settings != null ? settings : ParserSettings.DEFAULTS;
	}

	public ConfigParser(ConfigTokenizer tokenizer) {
		this(tokenizer, DirectiveRegistry.standard(), ParserSettings.DEFAULTS);
	}

	/**
	 * Parses an in-memory document with the standard registry and default settings.
	 */
	public static Config parse(String content) {
		return parse(content, ParserSettings.DEFAULTS);
	}

	public static Config parse(String content, ParserSettings settings) {
		return new ConfigParser(new ConfigTokenizer(content), DirectiveRegistry.standard(), settings).parse();
	}

	/**
	 * Parses an in-memory document with a custom registry, e.g. one extended with
	 * additional statement parsers or wrappers.
	 */
	public static Config parse(String content, DirectiveRegistry registry, ParserSettings settings) {
		return new ConfigParser(new ConfigTokenizer(content), registry, settings).parse();
	}

	/**
	 * Parses a document from a reader. The reader is not closed.
	 *
	 * @param sourceName name reported in errors and kept as the config's file path; may be null
	 */
	public static Config parse(Reader reader, String sourceName) {
		return parse(reader, sourceName, DirectiveRegistry.standard(), ParserSettings.DEFAULTS);
	}

	public static Config parse(Reader reader, String sourceName, DirectiveRegistry registry,
			ParserSettings settings) {
		return new ConfigParser(new ConfigTokenizer(reader, sourceName), registry, settings).parse();
	}

	/**
	 * Parses a document from a file.
	 *
	 * @throws ConfigParseException of kind {@code IO} if the file cannot be opened
	 */
	public static Config parse(Path path) {
		return parse(path, DirectiveRegistry.standard(), ParserSettings.DEFAULTS);
	}

	public static Config parse(Path path, DirectiveRegistry registry, ParserSettings settings) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return new ConfigParser(new ConfigTokenizer(reader, path.toString()), registry, settings).parse();
		} catch (IOException e) {
			throw ConfigParseException.io("Failed to read configuration file", path.toString(), e);
		}
	}

	/**
	 * Parses the whole source.
	 *
	 * @return the document; its file path is the tokenizer's source name
	 * @throws ConfigParseException on the first error
	 * @throws IllegalStateException if this parser has already been used
	 */
	public Config parse() {
		if (used) {
			throw new IllegalStateException("ConfigParser instances parse a single document");
		}
		used = true;

		// fill the two-token window
		advance();
		advance();

		Block block = parseBlock(null);
		if (currentToken.isKind(TokenKind.BLOCK_END)) {
			throw syntaxError("unexpected `}` without a matching `{`", currentToken);
		}
		logger.debug("Parsed {} top-level nodes from {}", block.size(), sourceLabel());
		return new Config(block, tokenizer.getSourceName());
	}

	private Block parseBlock(String enclosingName) {
		Block block = new Block();
		while (!currentToken.isKind(TokenKind.END_OF_INPUT) && !currentToken.isKind(TokenKind.BLOCK_END)) {
			switch (currentToken.kind()) {
				case KEYWORD -> parseStatement(block, enclosingName);
				case COMMENT -> {
					if (settings.preserveComments()) {
						block.add(Comment.fromLiteral(currentToken.literal(), currentToken.position()));
					}
				}
				default -> skipStrayToken();
			}
			advance();
		}
		return block;
	}

	private void skipStrayToken() {
		if (settings.strict()) {
			throw unexpectedToken(currentToken);
		}
		logger.warn("Skipping {} at line {}, column {} in {}: a statement must start with a name",
				currentToken, currentToken.line(), currentToken.column(), sourceLabel());
	}

	private void parseStatement(Block target, String enclosingName) {
		String name = currentToken.literal();

		Optional<StatementParser> statementParser = registry.statementParser(name);
		if (statementParser.isPresent()) {
			target.add(statementParser.get().parse(this));
			return;
		}

		Token nameToken = currentToken;
		List<Parameter> parameters = new ArrayList<>();
		List<Comment> comments = new ArrayList<>();
		advance();
		while (currentToken.kind().isParameterEligible() || currentToken.isKind(TokenKind.COMMENT)) {
			if (currentToken.isKind(TokenKind.COMMENT)) {
				// a comment cannot be rendered as a parameter; keep it next to the statement
				if (settings.preserveComments()) {
					comments.add(Comment.fromLiteral(currentToken.literal(), currentToken.position()));
				}
			} else {
				parameters.add(currentToken.toParameter());
			}
			advance();
		}

		DirectiveNode node;
		if (currentToken.isKind(TokenKind.SEMICOLON)) {
			Directive directive = new Directive(name, parameters, null, nameToken.position());
			node = wrap(directive, registry.directiveWrapper(name, enclosingName));
		} else if (currentToken.isKind(TokenKind.BLOCK_START)) {
			Block block = parseNestedBlock(name, nameToken);
			Directive directive = new Directive(name, parameters, block, nameToken.position());
			node = wrap(directive, registry.blockWrapper(name));
		} else {
			throw unexpectedToken(currentToken);
		}

		target.add(node);
		comments.forEach(target::add);
	}

	private DirectiveNode wrap(Directive directive, Optional<DirectiveWrapper> wrapper) {
		if (wrapper.isEmpty()) {
			return directive;
		}
		try {
			return wrapper.get().wrap(directive);
		} catch (ConfigParseException e) {
			throw e.withSourceName(tokenizer.getSourceName());
		}
	}

	@Override
	public Block parseNestedBlock(String enclosingName) {
		return parseNestedBlock(enclosingName, currentToken);
	}

	private Block parseNestedBlock(String enclosingName, Token opener) {
		if (!currentToken.isKind(TokenKind.BLOCK_START)) {
			throw unexpectedToken(currentToken);
		}
		if (depth >= settings.maxDepth()) {
			throw syntaxError("blocks nested deeper than " + settings.maxDepth(), currentToken);
		}
		depth++;
		advance(); // consume '{'
		Block block = parseBlock(enclosingName);
		if (!currentToken.isKind(TokenKind.BLOCK_END)) {
			throw syntaxError("unexpected end of input: block of `" + enclosingName + "` opened at line "
					+ opener.line() + ", column " + opener.column() + " is not closed", currentToken);
		}
		depth--;
		return block;
	}

	private ConfigParseException unexpectedToken(Token token) {
		return syntaxError("unexpected token `" + token.kind() + "` (`" + token.literal() + "`)", token);
	}

	@Override
	public ConfigParseException syntaxError(String detail, Token at) {
		return ConfigParseException.syntax(detail, tokenizer.getSourceName(), at.line(), at.column());
	}

	@Override
	public Token current() {
		return currentToken;
	}

	@Override
	public Token following() {
		return followingToken;
	}

	@Override
	public Token advance() {
		currentToken = followingToken;
		followingToken = tokenizer.scan();
		return currentToken;
	}

	@Override
	public String getSourceName() {
		return tokenizer.getSourceName();
	}

	private String sourceLabel() {
		return tokenizer.getSourceName() != null ? tokenizer.getSourceName() : "<memory>";
	}
}
