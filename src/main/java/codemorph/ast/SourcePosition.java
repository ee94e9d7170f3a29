package codemorph.ast;

/**
 * Source position for diagnostics.
 *
 * Lines and columns are 1-based and point at the first character of a token
 * or node.
 */
public record SourcePosition(int line, int column) {
	public static final SourcePosition NONE = new SourcePosition(-1, -1);

	public boolean isKnown() {
		return line > 0;
	}

	@Override
	public String toString() {
		return isKnown() ? line + ":" + column : "?";
	}
}
