package codemorph.transform;

import codemorph.Diagnostic.Stage;
import codemorph.Diagnostics;
import codemorph.TranspilerOptions;
import codemorph.ast.c.CArrayDecl;
import codemorph.ast.c.CAssignment;
import codemorph.ast.c.CBlock;
import codemorph.ast.c.CBreak;
import codemorph.ast.c.CContinue;
import codemorph.ast.c.CExpr;
import codemorph.ast.c.CExpressionStmt;
import codemorph.ast.c.CFor;
import codemorph.ast.c.CFunctionDecl;
import codemorph.ast.c.CIf;
import codemorph.ast.c.CParam;
import codemorph.ast.c.CPrintf;
import codemorph.ast.c.CProgram;
import codemorph.ast.c.CReturn;
import codemorph.ast.c.CScanf;
import codemorph.ast.c.CStmt;
import codemorph.ast.c.CStmtVisitor;
import codemorph.ast.c.CUnaryExpr;
import codemorph.ast.c.CVariableDecl;
import codemorph.ast.c.CWhile;
import codemorph.parse.c.MacroDefinition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Generates Python source from a parsed C program.
 *
 * Output layout: translated macros first, then the program's top-level
 * statements in order, then the {@code main()} call guard. Function
 * definitions are set apart by blank lines.
 *
 * Generation never fails. Constructs Python cannot express are emitted as
 * {@code # unsupported:} comments and reported as warnings.
 */
public final class CToPythonTransformer {
	private final TranspilerOptions options;
	private final Diagnostics diagnostics;

	public CToPythonTransformer() {
		this(TranspilerOptions.defaults(), new Diagnostics());
	}

	public CToPythonTransformer(TranspilerOptions options, Diagnostics diagnostics) {
		this.options = options;
		this.diagnostics = diagnostics;
	}

	public String generate(CProgram program) {
		return generate(program, List.of());
	}

	public String generate(CProgram program, List<MacroDefinition> macros) {
		List<List<String>> chunks = new ArrayList<>();
		if (options.translateMacros()) {
			List<String> macroLines = new MacroTranslator(options.indentUnit(), diagnostics).translate(macros);
			if (!macroLines.isEmpty()) {
				chunks.add(macroLines);
			}
		} else if (!macros.isEmpty()) {
			diagnostics.info(Stage.GENERATOR, -1, macros.size() + " macro(s) left untranslated");
		}

		Emitter emitter = new Emitter(globalNames(program), globalTypes(program, macros), takenNames(program, macros));
		chunks.addAll(emitter.emitProgram(program));

		if (options.emitMainGuard() && definesMain(program)) {
			chunks.add(List.of("if __name__ == \"__main__\":", options.indentUnit() + "main()"));
		}

		if (chunks.isEmpty()) {
			return "";
		}
		return chunks.stream()
				.map(lines -> String.join("\n", lines))
				.collect(Collectors.joining("\n\n", "", "\n"));
	}

	private static Set<String> globalNames(CProgram program) {
		Set<String> names = new LinkedHashSet<>();
		for (CStmt stmt : program.statements()) {
			if (stmt instanceof CVariableDecl v) {
				names.add(v.name());
			} else if (stmt instanceof CArrayDecl a) {
				names.add(a.name());
			}
		}
		return names;
	}

	/** File-scope variable types, plus integer constant macros as {@code int}. */
	private static Map<String, String> globalTypes(CProgram program, List<MacroDefinition> macros) {
		Map<String, String> types = new HashMap<>();
		for (CStmt stmt : program.statements()) {
			if (stmt instanceof CVariableDecl v) {
				types.merge(v.name(), v.declaredType(), (a, b) -> a.equals(b) ? a : "");
			} else if (stmt instanceof CArrayDecl a) {
				types.put(a.name(), a.declaredType() + "[]");
			}
		}
		for (String name : MacroTranslator.integerConstants(macros)) {
			types.putIfAbsent(name, "int");
		}
		return types;
	}

	/** Every name the output may already use; fresh names must avoid them. */
	private static Set<String> takenNames(CProgram program, List<MacroDefinition> macros) {
		Set<String> names = new HashSet<>(MutationScanner.of(program.statements()).mentioned());
		for (CStmt stmt : program.statements()) {
			if (stmt instanceof CFunctionDecl f) {
				f.params().forEach(p -> names.add(p.name()));
			}
		}
		macros.forEach(m -> names.add(m.name()));
		return names;
	}

	private static boolean definesMain(CProgram program) {
		return program.statements().stream()
				.anyMatch(s -> s instanceof CFunctionDecl f && f.name().equals("main") && !f.isPrototype());
	}

	static String defaultValue(String declaredType) {
		List<String> words = Arrays.asList(declaredType.split(" "));
		if (words.contains("float") || words.contains("double")) {
			return "0.0";
		}
		if (words.contains("char")) {
			return "''";
		}
		if (words.contains("bool")) {
			return "False";
		}
		if (words.contains("void")) {
			return "None";
		}
		return "0";
	}

	/**
	 * Per-statement emission context, passed explicitly down the recursion.
	 *
	 * @param loopIncrement increment of the innermost loop emitted as a
	 *                      {@code while} fallback; a {@code continue} must run it
	 *                      first
	 * @param usedAfter     names mentioned after the current statement finishes
	 */
	private record Frame(int indent, Optional<CExpr> loopIncrement, Set<String> usedAfter, boolean inFunction,
			boolean inLoop) {
		Frame nested() {
			return new Frame(indent + 1, loopIncrement, usedAfter, inFunction, inLoop);
		}

		Frame withUsedAfter(Set<String> names) {
			return new Frame(indent, loopIncrement, names, inFunction, inLoop);
		}

		Frame loopBody(Optional<CExpr> increment, Set<String> names) {
			return new Frame(indent + 1, increment, names, inFunction, true);
		}
	}

	private final class Emitter implements CStmtVisitor<Void, Frame> {
		private final Set<String> globals;
		private final Map<String, String> globalTypes;
		private final Set<String> taken;
		// block scopes of the function being emitted, innermost first
		private final Deque<Set<String>> scopes = new ArrayDeque<>();
		private Map<String, String> localTypes = Map.of();
		private final ExpressionTranslator expressions = new ExpressionTranslator();
		private final StdioTranslator stdio = new StdioTranslator(expressions);
		private final List<String> out = new ArrayList<>();
		private int currentLine = -1;

		Emitter(Set<String> globals, Map<String, String> globalTypes, Set<String> taken) {
			this.globals = globals;
			this.globalTypes = globalTypes;
			this.taken = taken;
		}

		private boolean isIntegerName(String name) {
			String type = localTypes.containsKey(name) ? localTypes.get(name) : globalTypes.get(name);
			return type != null && ForLoopRewriter.isIntegerType(type);
		}

		private boolean isVisible(String name) {
			return globals.contains(name) || scopes.stream().anyMatch(scope -> scope.contains(name));
		}

		private String freshName(String base) {
			int suffix = 1;
			while (taken.contains(base + "_" + suffix)) {
				suffix++;
			}
			String name = base + "_" + suffix;
			taken.add(name);
			return name;
		}

		/** Groups top-level output: each function is its own chunk, other statements are grouped. */
		List<List<String>> emitProgram(CProgram program) {
			List<List<String>> chunks = new ArrayList<>();
			List<String> plain = new ArrayList<>();
			List<CStmt> statements = program.statements();
			List<Set<String>> after = mentionedAfter(statements, Set.of());
			Frame top = new Frame(0, Optional.empty(), Set.of(), false, false);
			for (int i = 0; i < statements.size(); i++) {
				CStmt stmt = statements.get(i);
				int mark = out.size();
				stmt.accept(this, top.withUsedAfter(after.get(i)));
				List<String> lines = new ArrayList<>(out.subList(mark, out.size()));
				if (lines.isEmpty()) {
					continue;
				}
				if (stmt instanceof CFunctionDecl) {
					if (!plain.isEmpty()) {
						chunks.add(plain);
						plain = new ArrayList<>();
					}
					chunks.add(lines);
				} else {
					plain.addAll(lines);
				}
			}
			if (!plain.isEmpty()) {
				chunks.add(plain);
			}
			return chunks;
		}

		private List<Set<String>> mentionedAfter(List<CStmt> statements, Set<String> outer) {
			List<Set<String>> after = new ArrayList<>(statements.size());
			Set<String> running = new HashSet<>(outer);
			for (int i = statements.size() - 1; i >= 0; i--) {
				after.add(0, Set.copyOf(running));
				running.addAll(MutationScanner.of(statements.get(i)).mentioned());
			}
			return after;
		}

		private void emitStatements(List<CStmt> statements, Frame frame) {
			List<Set<String>> after = mentionedAfter(statements, frame.usedAfter());
			scopes.push(new HashSet<>());
			try {
				for (int i = 0; i < statements.size(); i++) {
					statements.get(i).accept(this, frame.withUsedAfter(after.get(i)));
				}
			} finally {
				scopes.pop();
			}
		}

		private void emitBody(CStmt body, Frame frame) {
			int mark = out.size();
			emitBodyStatements(body, frame);
			ensureStatement(mark, frame);
		}

		private void emitBodyStatements(CStmt body, Frame frame) {
			if (body instanceof CBlock block) {
				emitStatements(block.statements(), frame);
			} else {
				body.accept(this, frame);
			}
		}

		/** Python needs at least one statement in every suite; comments do not count. */
		private void ensureStatement(int mark, Frame frame) {
			boolean hasStatement = out.subList(mark, out.size()).stream()
					.anyMatch(l -> !l.isBlank() && !l.strip().startsWith("#"));
			if (!hasStatement) {
				line(frame, "pass");
			}
		}

		private void line(Frame frame, String text) {
			List<String> notes = expressions.drainNotes();
			for (String note : notes) {
				diagnostics.warning(Stage.GENERATOR, currentLine, "Unsupported: " + note);
			}
			String suffix = notes.isEmpty() ? "" : "  # unsupported: " + String.join("; ", notes);
			out.add(options.indentUnit().repeat(frame.indent()) + text + suffix);
		}

		private void unsupported(Frame frame, String what) {
			diagnostics.warning(Stage.GENERATOR, currentLine, "Unsupported: " + what);
			line(frame, "# unsupported: " + what);
		}

		private void at(CStmt stmt) {
			if (stmt.position().isKnown()) {
				currentLine = stmt.position().line();
			}
		}

		/** An expression used as a statement: assignments and steps get statement forms. */
		private String statementText(CExpr expr) {
			if (expr instanceof CAssignment a) {
				if (a.isCompound()) {
					return expressions.renderTarget(a.target()) + " " + a.op() + " " + expressions.render(a.value());
				}
				List<String> targets = new ArrayList<>();
				CExpr value = a;
				while (value instanceof CAssignment chained && !chained.isCompound()) {
					targets.add(expressions.renderTarget(chained.target()));
					value = chained.value();
				}
				return String.join(" = ", targets) + " = " + expressions.render(value);
			}
			if (expr instanceof CUnaryExpr u && u.isIncrementOrDecrement() && CAssignment.isLValue(u.operand())) {
				return expressions.renderTarget(u.operand()) + (u.op().equals("++") ? " += 1" : " -= 1");
			}
			return expressions.render(expr);
		}

		@Override
		public Void visitExpressionStmt(CExpressionStmt stmt, Frame frame) {
			at(stmt);
			line(frame, statementText(stmt.expr()));
			return null;
		}

		@Override
		public Void visitVariableDecl(CVariableDecl stmt, Frame frame) {
			at(stmt);
			String value = stmt.initializer()
					.map(expressions::render)
					.orElseGet(() -> defaultValue(stmt.declaredType()));
			line(frame, expressions.name(stmt.name()) + " = " + value);
			if (!scopes.isEmpty()) {
				scopes.peek().add(stmt.name());
			}
			return null;
		}

		@Override
		public Void visitArrayDecl(CArrayDecl stmt, Frame frame) {
			at(stmt);
			line(frame, expressions.name(stmt.name()) + " = [" + defaultValue(stmt.declaredType()) + "] * "
					+ expressions.render(stmt.size(), PythonSyntax.UNARY));
			if (!scopes.isEmpty()) {
				scopes.peek().add(stmt.name());
			}
			return null;
		}

		@Override
		public Void visitFunctionDecl(CFunctionDecl stmt, Frame frame) {
			if (stmt.body().isEmpty()) {
				return null;
			}
			at(stmt);
			CBlock body = stmt.body().get();
			String params = stmt.params().stream()
					.map(p -> PythonSyntax.safeName(p.name()))
					.collect(Collectors.joining(", "));
			line(frame, "def " + PythonSyntax.safeName(stmt.name()) + "(" + params + "):");

			Frame inner = new Frame(frame.indent() + 1, Optional.empty(), Set.of(), true, false);
			int mark = out.size();
			Set<String> rebound = globalsRebound(stmt, body);
			if (!rebound.isEmpty()) {
				line(inner, "global " + rebound.stream().map(PythonSyntax::safeName).collect(Collectors.joining(", ")));
			}
			localTypes = localTypes(stmt, body);
			scopes.push(stmt.params().stream().map(CParam::name).collect(Collectors.toCollection(HashSet::new)));
			try {
				emitStatements(body.statements(), inner);
			} finally {
				scopes.pop();
				localTypes = Map.of();
			}
			ensureStatement(mark, inner);
			return null;
		}

		private Map<String, String> localTypes(CFunctionDecl function, CBlock body) {
			Map<String, String> types = new HashMap<>();
			for (CParam p : function.params()) {
				types.put(p.name(), p.isArray() ? p.type() + "[]" : p.type());
			}
			MutationScanner.of(body).declaredTypes()
					.forEach((name, type) -> types.merge(name, type, (a, b) -> a.equals(b) ? a : ""));
			return types;
		}

		/** File-scope names the body assigns without declaring a local of the same name. */
		private Set<String> globalsRebound(CFunctionDecl function, CBlock body) {
			MutationScanner scan = MutationScanner.of(body);
			Set<String> params = function.params().stream().map(CParam::name).collect(Collectors.toSet());
			Set<String> names = new LinkedHashSet<>();
			for (String name : scan.rebound()) {
				if (globals.contains(name) && !scan.declared().contains(name) && !params.contains(name)) {
					names.add(name);
				}
			}
			return names;
		}

		@Override
		public Void visitBlock(CBlock stmt, Frame frame) {
			emitStatements(stmt.statements(), frame);
			return null;
		}

		@Override
		public Void visitIf(CIf stmt, Frame frame) {
			at(stmt);
			line(frame, "if " + expressions.render(stmt.condition()) + ":");
			emitBody(stmt.thenBranch(), frame.nested());
			Optional<CStmt> rest = stmt.elseBranch();
			while (rest.isPresent()) {
				if (rest.get() instanceof CIf elseIf) {
					at(elseIf);
					line(frame, "elif " + expressions.render(elseIf.condition()) + ":");
					emitBody(elseIf.thenBranch(), frame.nested());
					rest = elseIf.elseBranch();
				} else {
					line(frame, "else:");
					emitBody(rest.get(), frame.nested());
					rest = Optional.empty();
				}
			}
			return null;
		}

		@Override
		public Void visitWhile(CWhile stmt, Frame frame) {
			at(stmt);
			line(frame, "while " + expressions.render(stmt.condition()) + ":");
			emitBody(stmt.body(), frame.loopBody(Optional.empty(), loopMentions(stmt, frame)));
			return null;
		}

		/** A loop's own names count as used after each statement in its body: the next iteration reads them. */
		private Set<String> loopMentions(CStmt loop, Frame frame) {
			Set<String> names = new HashSet<>(frame.usedAfter());
			names.addAll(MutationScanner.of(loop).mentioned());
			return names;
		}

		@Override
		public Void visitFor(CFor stmt, Frame frame) {
			at(stmt);
			// a counter declared in the loop must not clobber an outer variable read later
			String shadowed = null;
			String hidden = null;
			if (stmt.initializer().isPresent() && stmt.initializer().get() instanceof CVariableDecl decl
					&& isVisible(decl.name()) && frame.usedAfter().contains(decl.name())) {
				shadowed = decl.name();
				hidden = expressions.rename(shadowed, freshName(shadowed));
			}
			scopes.push(new HashSet<>());
			try {
				emitFor(stmt, frame);
			} finally {
				scopes.pop();
				if (shadowed != null) {
					expressions.restore(shadowed, hidden);
				}
			}
			return null;
		}

		private void emitFor(CFor stmt, Frame frame) {
			Optional<ForLoopRewriter.RangeLoop> range =
					ForLoopRewriter.match(stmt, globals, frame.usedAfter(), this::isIntegerName);
			if (range.isPresent()) {
				ForLoopRewriter.RangeLoop r = range.get();
				line(frame, "for " + expressions.name(r.variable()) + " in range(" + rangeArguments(r) + "):");
				emitBody(stmt.body(), frame.loopBody(Optional.empty(), loopMentions(stmt, frame)));
				return;
			}

			stmt.initializer().ifPresent(init -> init.accept(this, frame));
			at(stmt);
			String condition = stmt.condition().map(expressions::render).orElse("True");
			line(frame, "while " + condition + ":");
			Frame body = frame.loopBody(stmt.increment(), loopMentions(stmt, frame));
			int mark = out.size();
			emitBodyStatements(stmt.body(), body);
			stmt.increment().ifPresent(inc -> line(body, statementText(inc)));
			ensureStatement(mark, body);
		}

		private String rangeArguments(ForLoopRewriter.RangeLoop r) {
			String end;
			Optional<Long> literalBound = ForLoopRewriter.integerValue(r.bound());
			if (r.boundAdjust() == 0) {
				end = expressions.render(r.bound(), PythonSyntax.OR);
			} else if (literalBound.isPresent()) {
				end = String.valueOf(literalBound.get() + r.boundAdjust());
			} else {
				end = expressions.render(r.bound(), PythonSyntax.ADD) + (r.boundAdjust() > 0 ? " + 1" : " - 1");
			}

			boolean zeroStart = ForLoopRewriter.integerValue(r.start()).map(v -> v == 0).orElse(false);
			if (r.step() == 1 && zeroStart) {
				return end;
			}
			String start = expressions.render(r.start(), PythonSyntax.OR);
			if (r.step() == 1) {
				return start + ", " + end;
			}
			return start + ", " + end + ", " + r.step();
		}

		@Override
		public Void visitReturn(CReturn stmt, Frame frame) {
			at(stmt);
			if (!frame.inFunction()) {
				unsupported(frame, "return outside a function");
				return null;
			}
			line(frame, stmt.value().map(v -> "return " + expressions.render(v)).orElse("return"));
			return null;
		}

		@Override
		public Void visitBreak(CBreak stmt, Frame frame) {
			at(stmt);
			if (!frame.inLoop()) {
				unsupported(frame, "break outside a loop");
				return null;
			}
			line(frame, "break");
			return null;
		}

		@Override
		public Void visitContinue(CContinue stmt, Frame frame) {
			at(stmt);
			if (!frame.inLoop()) {
				unsupported(frame, "continue outside a loop");
				return null;
			}
			frame.loopIncrement().ifPresent(inc -> line(frame, statementText(inc)));
			line(frame, "continue");
			return null;
		}

		@Override
		public Void visitPrintf(CPrintf stmt, Frame frame) {
			at(stmt);
			List<String> warnings = new ArrayList<>();
			String text = stdio.printf(stmt, warnings);
			report(warnings);
			line(frame, text);
			return null;
		}

		@Override
		public Void visitScanf(CScanf stmt, Frame frame) {
			at(stmt);
			List<String> warnings = new ArrayList<>();
			List<String> lines = stdio.scanf(stmt, warnings);
			report(warnings);
			for (String l : lines) {
				line(frame, l);
			}
			return null;
		}

		private void report(List<String> warnings) {
			for (String w : warnings) {
				diagnostics.warning(Stage.GENERATOR, currentLine, w);
			}
		}
	}
}
