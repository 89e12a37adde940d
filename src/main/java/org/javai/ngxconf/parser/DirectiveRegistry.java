package org.javai.ngxconf.parser;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.ngxconf.Http;
import org.javai.ngxconf.Include;
import org.javai.ngxconf.Location;
import org.javai.ngxconf.Server;
import org.javai.ngxconf.Upstream;
import org.javai.ngxconf.UpstreamServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Name-keyed dispatch tables used by {@link ConfigParser}.
 * <ul>
 * <li>statement parsers take over parsing of a whole statement;</li>
 * <li>block wrappers upgrade {@code name ... { }} directives once their block is parsed;</li>
 * <li>directive wrappers upgrade {@code name ...;} directives, optionally only
 * inside a block with a given name.</li>
 * </ul>
 * Names without an entry stay generic {@link org.javai.ngxconf.Directive}s.
 * Names are matched exactly (case-sensitive).
 */
public final class DirectiveRegistry {

	private static final Logger logger = LoggerFactory.getLogger(DirectiveRegistry.class);

	private static final String ANY_CONTEXT = "";

	private final Map<String, StatementParser> statementParsers = new HashMap<>();
	private final Map<String, DirectiveWrapper> blockWrappers = new HashMap<>();
	private final Map<String, Map<String, DirectiveWrapper>> directiveWrappers = new HashMap<>();

	/**
	 * Creates an empty registry: every directive stays generic.
	 */
	public static DirectiveRegistry empty() {
		return new DirectiveRegistry();
	}

	/**
	 * Creates a registry with the built-in typed nodes:
	 * {@code http}, {@code server}, {@code location} and {@code upstream} blocks,
	 * {@code include} anywhere (rejecting a block) and {@code server} entries inside {@code upstream}.
	 */
	public static DirectiveRegistry standard() {
		DirectiveRegistry registry = new DirectiveRegistry();
		registry.registerBlockWrapper("http", Http::new);
		registry.registerBlockWrapper("server", Server::new);
		registry.registerBlockWrapper("location", Location::of);
		registry.registerBlockWrapper("upstream", Upstream::new);
		registry.registerBlockWrapper("include", Include::of);
		registry.registerDirectiveWrapper("include", Include::of);
		registry.registerDirectiveWrapper(UpstreamServer.NAME, "upstream", UpstreamServer::fromDirective);
		return registry;
	}

	/**
	 * Returns an independent copy that can be extended without touching this registry.
	 */
	public DirectiveRegistry copy() {
		DirectiveRegistry copy = new DirectiveRegistry();
		copy.statementParsers.putAll(statementParsers);
		copy.blockWrappers.putAll(blockWrappers);
		directiveWrappers.forEach((context, wrappers) -> copy.directiveWrappers.put(context, new HashMap<>(wrappers)));
		return copy;
	}

	public DirectiveRegistry registerStatementParser(String name, StatementParser parser) {
		put(statementParsers, name, Objects.requireNonNull(parser, "parser must not be null"), "statement parser");
		return this;
	}

	public DirectiveRegistry registerBlockWrapper(String name, DirectiveWrapper wrapper) {
		put(blockWrappers, name, Objects.requireNonNull(wrapper, "wrapper must not be null"), "block wrapper");
		return this;
	}

	/**
	 * Registers a wrapper for {@code name ...;} directives in any block.
	 */
	public DirectiveRegistry registerDirectiveWrapper(String name, DirectiveWrapper wrapper) {
		return registerDirectiveWrapper(name, ANY_CONTEXT, wrapper);
	}

	/**
	 * Registers a wrapper for {@code name ...;} directives that sit directly inside a
	 * block owned by a directive called {@code enclosingName}. A context-specific
	 * wrapper wins over one registered for any block.
	 */
	public DirectiveRegistry registerDirectiveWrapper(String name, String enclosingName, DirectiveWrapper wrapper) {
		Objects.requireNonNull(enclosingName, "enclosingName must not be null");
		Map<String, DirectiveWrapper> wrappers = directiveWrappers.computeIfAbsent(enclosingName, k -> new HashMap<>());
		put(wrappers, name, Objects.requireNonNull(wrapper, "wrapper must not be null"), "directive wrapper");
		return this;
	}

	public Optional<StatementParser> statementParser(String name) {
		return Optional.ofNullable(statementParsers.get(name));
	}

	public Optional<DirectiveWrapper> blockWrapper(String name) {
		return Optional.ofNullable(blockWrappers.get(name));
	}

	/**
	 * Looks up the wrapper for a simple directive.
	 *
	 * @param name the directive name
	 * @param enclosingName the owner of the surrounding block, or null at top level
	 */
	public Optional<DirectiveWrapper> directiveWrapper(String name, String enclosingName) {
		if (enclosingName != null) {
			Map<String, DirectiveWrapper> contextual = directiveWrappers.get(enclosingName);
			if (contextual != null && contextual.containsKey(name)) {
				return Optional.of(contextual.get(name));
			}
		}
		Map<String, DirectiveWrapper> anywhere = directiveWrappers.get(ANY_CONTEXT);
		return Optional.ofNullable(anywhere != null ? anywhere.get(name) : null);
	}

	private static <T> void put(Map<String, T> table, String name, T value, String what) {
		if (name == null || name.isEmpty()) {
			throw new IllegalArgumentException("Directive name cannot be null or empty");
		}
		if (table.put(name, value) != null) {
			logger.debug("Replaced {} for directive '{}'", what, name);
		}
	}
}
