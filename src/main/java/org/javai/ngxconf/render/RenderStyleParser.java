package org.javai.ngxconf.render;

import java.io.InputStream;
import java.io.Reader;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;

/**
 * Parser for render style definitions written in YAML:
 * <pre>
 * styles:
 *   wide:
 *     indent: 8
 *     start_indent: 0
 *     brace_placement: next_line
 *     compact: false
 * </pre>
 * Omitted options take their value from {@link RenderStyle#INDENTED}.
 */
public class RenderStyleParser {

	private final Yaml yaml = new Yaml();

	/**
	 * Parse style definitions from an input stream.
	 */
	public Map<String, RenderStyle> parse(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return buildStyles(data);
		} catch (Exception e) {
			throw new IllegalArgumentException("Failed to parse render styles from input stream", e);
		}
	}

	/**
	 * Parse style definitions from a reader.
	 */
	public Map<String, RenderStyle> parse(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return buildStyles(data);
		} catch (Exception e) {
			throw new IllegalArgumentException("Failed to parse render styles from reader", e);
		}
	}

	/**
	 * Parse style definitions from a string.
	 */
	public Map<String, RenderStyle> parseString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return buildStyles(data);
		} catch (Exception e) {
			throw new IllegalArgumentException("Failed to parse render styles from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private Map<String, RenderStyle> buildStyles(Map<String, Object> data) {
		if (data == null || !(data.get("styles") instanceof Map)) {
			throw new IllegalArgumentException("Missing required 'styles' section");
		}
		Map<String, Object> stylesMap = (Map<String, Object>) data.get("styles");
		Map<String, RenderStyle> styles = new LinkedHashMap<>();
		stylesMap.forEach((name, definition) -> {
			if (!(definition instanceof Map)) {
				throw new IllegalArgumentException("Style '" + name + "' must be a mapping");
			}
			styles.put(name, buildStyle((Map<String, Object>) definition));
		});
		return styles;
	}

	private RenderStyle buildStyle(Map<String, Object> map) {
		RenderStyle defaults = RenderStyle.INDENTED;
		return new RenderStyle(
			toInt(map.get("indent"), defaults.indent()),
			toInt(map.get("start_indent"), defaults.startIndent()),
			toBracePlacement(map.get("brace_placement"), defaults.bracePlacement()),
			toBoolean(map.get("compact"), defaults.compact())
		);
	}

	private int toInt(Object value, int defaultValue) {
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Number number) {
			return number.intValue();
		}
		return Integer.parseInt(value.toString().trim());
	}

	private boolean toBoolean(Object value, boolean defaultValue) {
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Boolean b) {
			return b;
		}
		return Boolean.parseBoolean(value.toString().trim());
	}

	private BracePlacement toBracePlacement(Object value, BracePlacement defaultValue) {
		if (value == null) {
			return defaultValue;
		}
		return BracePlacement.valueOf(value.toString().trim().toUpperCase(Locale.ROOT).replace('-', '_'));
	}
}
