package org.javai.ngxconf;

/**
 * A 1-based line/column location in a configuration source.
 *
 * @param line the line number, starting at 1
 * @param column the column number, starting at 1
 */
public record SourcePosition(int line, int column) {

	@Override
	public String toString() {
		return "line " + line + ", column " + column;
	}
}
