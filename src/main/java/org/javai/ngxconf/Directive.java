package org.javai.ngxconf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The generic directive: a name, ordered parameters and an optional nested block.
 * Every typed node is either built from one of these or wraps one.
 */
public final class Directive implements DirectiveNode {

	private final String name;
	private final List<Parameter> parameters;
	private final Block block;
	private final SourcePosition position;

	public Directive(String name, List<Parameter> parameters, Block block, SourcePosition position) {
		if (name == null || name.isEmpty()) {
			throw new IllegalArgumentException("Directive name cannot be null or empty");
		}
		this.name = name;
		this.parameters = new ArrayList<>(Objects.requireNonNull(parameters, "parameters must not be null"));
		this.block = block;
		this.position = position;
	}

	/**
	 * Creates a simple directive, e.g. {@code Directive.simple("listen", "80")}.
	 */
	public static Directive simple(String name, String... parameters) {
		return new Directive(name, toParameters(parameters), null, null);
	}

	/**
	 * Creates a block directive with an empty block.
	 */
	public static Directive block(String name, String... parameters) {
		return new Directive(name, toParameters(parameters), new Block(), null);
	}

	private static List<Parameter> toParameters(String... values) {
		List<Parameter> result = new ArrayList<>(values.length);
		for (String value : values) {
			result.add(Parameter.of(value));
		}
		return result;
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	public List<Parameter> getRawParameters() {
		return Collections.unmodifiableList(parameters);
	}

	@Override
	public Block getBlock() {
		return block;
	}

	@Override
	public Optional<SourcePosition> getPosition() {
		return Optional.ofNullable(position);
	}

	@Override
	public String toString() {
		return "Directive[" + name + " " + parameters + (block != null ? " {" + block.size() + "}" : "") + "]";
	}
}
