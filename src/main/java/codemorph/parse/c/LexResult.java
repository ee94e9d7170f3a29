package codemorph.parse.c;

import java.util.List;

public record LexResult(List<CToken> tokens, List<MacroDefinition> macros) {
	public LexResult {
		tokens = List.copyOf(tokens);
		macros = List.copyOf(macros);
	}
}
