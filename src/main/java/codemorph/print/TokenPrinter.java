package codemorph.print;

import codemorph.parse.c.CToken;

import java.util.List;

/**
 * One line per token: {@code  text ---->(Kind) line: L, col: C}.
 */
public final class TokenPrinter {
	public String print(List<CToken> tokens) {
		StringBuilder out = new StringBuilder();
		for (CToken t : tokens) {
			out.append(' ')
					.append(visible(t.text()))
					.append(" ---->(")
					.append(t.kind().displayName())
					.append(") line: ")
					.append(t.line())
					.append(", col: ")
					.append(t.column())
					.append('\n');
		}
		return out.toString();
	}

	/** Keeps control characters from breaking the one-line-per-entry layout. */
	static String visible(String text) {
		return text.replace("\\", "\\\\")
				.replace("\n", "\\n")
				.replace("\t", "\\t")
				.replace("\r", "\\r");
	}
}
