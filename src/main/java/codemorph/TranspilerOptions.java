package codemorph;

/**
 * Generator settings.
 *
 * @param indentUnit      text emitted once per indentation level
 * @param emitMainGuard   append an {@code if __name__ == "__main__":} call to
 *                        {@code main()} when the program defines one
 * @param translateMacros turn {@code #define}s into Python definitions
 */
public record TranspilerOptions(String indentUnit, boolean emitMainGuard, boolean translateMacros) {
	public static final int DEFAULT_INDENT_WIDTH = 4;

	public TranspilerOptions {
		if (indentUnit == null || indentUnit.isEmpty() || !indentUnit.isBlank()) {
			throw new IllegalArgumentException("indent unit must be non-empty whitespace");
		}
	}

	public static TranspilerOptions defaults() {
		return new TranspilerOptions(" ".repeat(DEFAULT_INDENT_WIDTH), true, true);
	}

	public TranspilerOptions withIndentWidth(int width) {
		if (width < 1) {
			throw new IllegalArgumentException("indent width must be positive: " + width);
		}
		return new TranspilerOptions(" ".repeat(width), emitMainGuard, translateMacros);
	}

	public TranspilerOptions withMainGuard(boolean enabled) {
		return new TranspilerOptions(indentUnit, enabled, translateMacros);
	}

	public TranspilerOptions withMacros(boolean enabled) {
		return new TranspilerOptions(indentUnit, emitMainGuard, enabled);
	}
}
