package codemorph;

import codemorph.ast.c.CProgram;
import codemorph.parse.c.CLexer;
import codemorph.parse.c.CParser;
import codemorph.parse.c.LexResult;
import codemorph.transform.CToPythonTransformer;

import java.util.logging.Logger;

/**
 * Public entrypoint for C -> Python transpilation.
 *
 * Runs lexer, parser and generator in sequence. Problems in the input never
 * make this throw; they show up as diagnostics and placeholder comments.
 */
public final class Transpiler {
	private static final Logger LOG = Logger.getLogger(Transpiler.class.getName());

	private final TranspilerOptions options;

	public Transpiler() {
		this(TranspilerOptions.defaults());
	}

	public Transpiler(TranspilerOptions options) {
		this.options = options;
	}

	public TranspileResult run(String cSource) {
		Diagnostics diagnostics = new Diagnostics();
		LexResult lexed = new CLexer(diagnostics).tokenize(cSource);
		CProgram program = new CParser(diagnostics).parse(lexed.tokens());
		String python = new CToPythonTransformer(options, diagnostics).generate(program, lexed.macros());
		LOG.fine(() -> "Transpiled " + lexed.tokens().size() + " tokens, " + program.statements().size()
				+ " top-level statements, " + diagnostics.entries().size() + " diagnostics");
		return new TranspileResult(lexed.tokens(), lexed.macros(), program, python, diagnostics.entries());
	}

	public String transpile(String cSource) {
		return run(cSource).output();
	}
}
