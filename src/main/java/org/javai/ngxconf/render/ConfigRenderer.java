package org.javai.ngxconf.render;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;
import org.javai.ngxconf.Block;
import org.javai.ngxconf.Comment;
import org.javai.ngxconf.Config;
import org.javai.ngxconf.ConfigNode;
import org.javai.ngxconf.ConfigNodeVisitor;
import org.javai.ngxconf.DirectiveNode;
import org.javai.ngxconf.Parameter;

/**
 * Visitor that renders a configuration tree back to directive/block text.
 * <p>
 * Parsing the output again yields the same names, parameters, nesting and typed
 * nodes. Quoted parameters are re-quoted with their original delimiter.
 */
public class ConfigRenderer implements ConfigNodeVisitor<Void> {

	private final StringBuilder output = new StringBuilder();
	private final RenderStyle style;
	private int indentLevel = 0;

	public ConfigRenderer(RenderStyle style) {
		this.style = Objects.requireNonNull(style, "style must not be null");
	}

	@Override
	public Void visitDirective(DirectiveNode directive) {
		startNode();
		output.append(directive.getName());
		for (Parameter parameter : directive.getRawParameters()) {
			output.append(' ').append(formatParameter(parameter));
		}

		Block block = directive.getBlock();
		if (block == null) {
			output.append(';');
			return null;
		}

		if (style.compact() || style.bracePlacement() == BracePlacement.SAME_LINE) {
			output.append(" {");
		} else {
			output.append('\n');
			indent();
			output.append('{');
		}

		indentLevel++;
		for (ConfigNode node : block.getNodes()) {
			node.accept(this);
		}
		indentLevel--;

		if (style.compact()) {
			output.append(atLineStart() ? "}" : " }");
		} else {
			output.append('\n');
			indent();
			output.append('}');
		}
		return null;
	}

	@Override
	public Void visitComment(Comment comment) {
		startNode();
		output.append('#');
		if (!comment.text().isEmpty()) {
			output.append(' ').append(comment.text());
		}
		if (style.compact()) {
			// the comment runs to end of line, so whatever follows needs a fresh one
			output.append('\n');
		}
		return null;
	}

	private void startNode() {
		if (style.compact()) {
			if (!atLineStart()) {
				output.append(' ');
			}
			return;
		}
		if (output.length() > 0) {
			output.append('\n');
		}
		indent();
	}

	private boolean atLineStart() {
		return output.length() == 0 || output.charAt(output.length() - 1) == '\n';
	}

	private void indent() {
		output.append(" ".repeat(style.startIndent() + indentLevel * style.indent()));
	}

	static String formatParameter(Parameter parameter) {
		if (!parameter.isQuoted()) {
			return parameter.value();
		}
		char delimiter = parameter.quote().delimiter();
		StringBuilder sb = new StringBuilder(parameter.value().length() + 2);
		sb.append(delimiter);
		for (char c : parameter.value().toCharArray()) {
			switch (c) {
				case '\\' -> sb.append("\\\\");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				default -> {
					if (c == delimiter) {
						sb.append('\\');
					}
					sb.append(c);
				}
			}
		}
		return sb.append(delimiter).toString();
	}

	/**
	 * Returns the rendered output.
	 */
	@Override
	public String toString() {
		return output.toString();
	}

	/**
	 * Renders every node of a block.
	 */
	public static String render(Block block, RenderStyle style) {
		ConfigRenderer renderer = new ConfigRenderer(style);
		for (ConfigNode node : block.getNodes()) {
			node.accept(renderer);
		}
		return renderer.toString();
	}

	public static String render(Config config, RenderStyle style) {
		return render(config.getBlock(), style);
	}

	/**
	 * Renders a single node and everything beneath it.
	 */
	public static String render(ConfigNode node, RenderStyle style) {
		ConfigRenderer renderer = new ConfigRenderer(style);
		node.accept(renderer);
		return renderer.toString();
	}

	/**
	 * Writes a rendered config followed by a line break. The writer is not closed.
	 */
	public static void write(Config config, RenderStyle style, Writer writer) throws IOException {
		writer.write(render(config, style));
		writer.write('\n');
		writer.flush();
	}
}
