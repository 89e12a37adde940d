package org.javai.ngxconf;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One backend entry of an upstream pool: {@code server address [key=value ...] [flag ...];}.
 * <p>
 * Unlike the other typed nodes this one owns its data. Everything after the address
 * is kept as one ordered attribute list, so a parsed entry renders with its
 * attributes in their original order; {@link #getServerParameters()} and
 * {@link #getFlags()} are views over that list.
 */
public final class UpstreamServer implements DirectiveNode {

	public static final String NAME = "server";

	private Parameter address;
	private final List<Parameter> attributes = new ArrayList<>();
	private final SourcePosition position;

	private UpstreamServer(Parameter address, SourcePosition position) {
		this.address = Objects.requireNonNull(address, "address must not be null");
		this.position = position;
	}

	public UpstreamServer(String address) {
		this(Parameter.of(address), null);
	}

	/**
	 * Creates an entry whose parameters come first, then its flags, each in the order supplied.
	 */
	public UpstreamServer(String address, Map<String, String> parameters, Collection<String> flags) {
		this(address);
		if (parameters != null) {
			parameters.forEach(this::addParameter);
		}
		if (flags != null) {
			flags.forEach(this::addFlag);
		}
	}

	/**
	 * Builds an entry from a parsed {@code server ...;} directive.
	 *
	 * @throws ConfigParseException (semantic) if the directive has no address or carries a block
	 */
	public static UpstreamServer fromDirective(Directive directive) {
		List<Parameter> parameters = directive.getRawParameters();
		if (parameters.isEmpty()) {
			throw ConfigParseException.semantic("upstream server requires an address", directive);
		}
		if (directive.hasBlock()) {
			throw ConfigParseException.semantic("upstream server can not have a block", directive);
		}
		UpstreamServer server = new UpstreamServer(parameters.get(0), directive.getPosition().orElse(null));
		server.attributes.addAll(parameters.subList(1, parameters.size()));
		return server;
	}

	public String getAddress() {
		return address.value();
	}

	public UpstreamServer setAddress(String address) {
		this.address = Parameter.of(address);
		return this;
	}

	/**
	 * The {@code key=value} attributes, in order. Keys map to the text after the first {@code =};
	 * a parsed attribute such as {@code =x} has an empty key.
	 */
	public Map<String, String> getServerParameters() {
		Map<String, String> parameters = new LinkedHashMap<>();
		for (Parameter attribute : attributes) {
			int eq = attribute.value().indexOf('=');
			if (eq >= 0) {
				parameters.put(attribute.value().substring(0, eq), attribute.value().substring(eq + 1));
			}
		}
		return Collections.unmodifiableMap(parameters);
	}

	/**
	 * The bare attributes without {@code =} such as {@code backup} or {@code down}, in order.
	 */
	public Set<String> getFlags() {
		Set<String> flags = new LinkedHashSet<>();
		for (Parameter attribute : attributes) {
			if (attribute.value().indexOf('=') < 0) {
				flags.add(attribute.value());
			}
		}
		return Collections.unmodifiableSet(flags);
	}

	/**
	 * Sets a {@code key=value} attribute. An existing key is updated where it stands;
	 * a new key is appended.
	 */
	public UpstreamServer addParameter(String key, String value) {
		if (key == null || key.isEmpty() || key.indexOf('=') >= 0) {
			throw new IllegalArgumentException("Invalid upstream server parameter key: " + key);
		}
		Objects.requireNonNull(value, "value must not be null");
		Parameter attribute = Parameter.of(key + "=" + value);
		for (int i = 0; i < attributes.size(); i++) {
			if (attributes.get(i).value().startsWith(key + "=")) {
				attributes.set(i, attribute);
				return this;
			}
		}
		attributes.add(attribute);
		return this;
	}

	/**
	 * Appends a bare flag unless it is already present.
	 */
	public UpstreamServer addFlag(String flag) {
		if (flag == null || flag.isEmpty() || flag.indexOf('=') >= 0) {
			throw new IllegalArgumentException("Invalid upstream server flag: " + flag);
		}
		if (!getFlags().contains(flag)) {
			attributes.add(Parameter.of(flag));
		}
		return this;
	}

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public List<Parameter> getRawParameters() {
		List<Parameter> parameters = new ArrayList<>(attributes.size() + 1);
		parameters.add(address);
		parameters.addAll(attributes);
		return Collections.unmodifiableList(parameters);
	}

	@Override
	public Block getBlock() {
		return null;
	}

	@Override
	public Optional<SourcePosition> getPosition() {
		return Optional.ofNullable(position);
	}

	@Override
	public String toString() {
		return "UpstreamServer[" + getAddress() + " " + attributes + "]";
	}
}
