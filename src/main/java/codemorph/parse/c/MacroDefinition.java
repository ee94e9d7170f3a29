package codemorph.parse.c;

import java.util.List;

/**
 * A captured {@code #define}. Malformed definitions are kept with
 * {@code valid == false} so callers can report them.
 */
public record MacroDefinition(String name, boolean functionLike, List<String> parameters, String body,
		int sourceLine, boolean valid) {
	public MacroDefinition {
		parameters = List.copyOf(parameters);
	}
}
