package codemorph.transform;

import codemorph.Diagnostic.Stage;
import codemorph.Diagnostics;
import codemorph.ast.c.CExpr;
import codemorph.parse.c.CLexer;
import codemorph.parse.c.CParser;
import codemorph.parse.c.LexResult;
import codemorph.parse.c.MacroDefinition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns {@code #define}s into Python: object-like macros become constants,
 * function-like macros become one-line functions.
 *
 * Each body is lexed and parsed on its own by a fresh lexer and parser.
 */
final class MacroTranslator {
	private final String indentUnit;
	private final Diagnostics diagnostics;

	MacroTranslator(String indentUnit, Diagnostics diagnostics) {
		this.indentUnit = indentUnit;
		this.diagnostics = diagnostics;
	}

	List<String> translate(List<MacroDefinition> macros) {
		List<String> lines = new ArrayList<>();
		for (MacroDefinition macro : macros) {
			lines.addAll(translate(macro));
		}
		return lines;
	}

	List<String> translate(MacroDefinition macro) {
		if (!macro.valid()) {
			diagnostics.warning(Stage.GENERATOR, macro.sourceLine(),
					"Skipping invalid macro '" + macro.name() + "'");
			return List.of();
		}
		String name = PythonSyntax.safeName(macro.name());
		if (macro.body().isEmpty()) {
			if (macro.functionLike()) {
				return List.of(signature(name, macro), indentUnit + "pass");
			}
			return List.of(name + " = True");
		}

		// scratch diagnostics: a body that fails is reported once, below
		Diagnostics scratch = new Diagnostics();
		LexResult lexed = new CLexer(scratch).tokenize(macro.body());
		if (!lexed.macros().isEmpty()) {
			diagnostics.warning(Stage.GENERATOR, macro.sourceLine(),
					"Ignoring macro '" + macro.name() + "': its body contains a #define");
			return List.of();
		}
		Optional<CExpr> expr = scratch.hasErrors() ? Optional.empty()
				: new CParser(scratch).parseExpressionOnly(lexed.tokens());
		if (expr.isEmpty()) {
			diagnostics.warning(Stage.GENERATOR, macro.sourceLine(),
					"Could not translate macro '" + macro.name() + "': " + macro.body());
			return List.of("# could not translate macro " + macro.name() + ": " + macro.body());
		}

		ExpressionTranslator expressions = new ExpressionTranslator();
		String value = expressions.render(expr.get());
		String note = unsupportedNote(expressions, macro.sourceLine());
		if (macro.functionLike()) {
			return List.of(signature(name, macro), indentUnit + "return " + value + note);
		}
		return List.of(name + " = " + value + note);
	}

	/** Names of object-like macros whose body is an integer constant, such as {@code 10} or {@code (4 * 8)}. */
	static Set<String> integerConstants(List<MacroDefinition> macros) {
		Set<String> names = new HashSet<>();
		for (MacroDefinition macro : macros) {
			if (!macro.valid() || macro.functionLike() || macro.body().isEmpty()) {
				continue;
			}
			Diagnostics scratch = new Diagnostics();
			LexResult lexed = new CLexer(scratch).tokenize(macro.body());
			if (scratch.hasErrors() || !lexed.macros().isEmpty()) {
				continue;
			}
			new CParser(scratch).parseExpressionOnly(lexed.tokens())
					.filter(ForLoopRewriter::isIntegerConstant)
					.ifPresent(e -> names.add(macro.name()));
		}
		return names;
	}

	private String unsupportedNote(ExpressionTranslator expressions, int line) {
		List<String> notes = expressions.drainNotes();
		for (String n : notes) {
			diagnostics.warning(Stage.GENERATOR, line, "Unsupported in macro: " + n);
		}
		return notes.isEmpty() ? "" : "  # unsupported: " + String.join("; ", notes);
	}

	private static String signature(String name, MacroDefinition macro) {
		List<String> params = macro.parameters().stream().map(PythonSyntax::safeName).toList();
		return "def " + name + "(" + String.join(", ", params) + "):";
	}
}
