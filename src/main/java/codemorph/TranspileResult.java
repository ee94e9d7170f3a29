package codemorph;

import codemorph.ast.c.CProgram;
import codemorph.parse.c.CToken;
import codemorph.parse.c.MacroDefinition;

import java.util.List;

/**
 * Everything one run of the pipeline produced.
 */
public record TranspileResult(List<CToken> tokens, List<MacroDefinition> macros, CProgram program, String output,
		List<Diagnostic> diagnostics) {
	public TranspileResult {
		tokens = List.copyOf(tokens);
		macros = List.copyOf(macros);
		diagnostics = List.copyOf(diagnostics);
	}

	public boolean hasErrors() {
		return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
	}
}
