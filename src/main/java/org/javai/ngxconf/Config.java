package org.javai.ngxconf;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The root of a parsed document: the top-level block plus the path it was read from, if any.
 */
public final class Config {

	private final Block block;
	private final String filePath;

	public Config(Block block, String filePath) {
		this.block = Objects.requireNonNull(block, "block must not be null");
		this.filePath = filePath;
	}

	public Config(Block block) {
		this(block, null);
	}

	public Block getBlock() {
		return block;
	}

	public Optional<String> getFilePath() {
		return Optional.ofNullable(filePath);
	}

	/**
	 * Returns every upstream pool in the document, at any nesting depth, in source order.
	 */
	public List<Upstream> findUpstreams() {
		return block.findAll(Upstream.class);
	}

	/**
	 * Returns every directive-like node with the given name, at any nesting depth, in source order.
	 */
	public List<DirectiveNode> findDirectives(String name) {
		return block.findDirectives(name);
	}
}
