package codemorph.transform;

import codemorph.ast.c.CAssignment;
import codemorph.ast.c.CBinaryExpr;
import codemorph.ast.c.CExpr;
import codemorph.ast.c.CExpressionStmt;
import codemorph.ast.c.CFor;
import codemorph.ast.c.CIdentifier;
import codemorph.ast.c.CNumberLiteral;
import codemorph.ast.c.CStmt;
import codemorph.ast.c.CUnaryExpr;
import codemorph.ast.c.CVariableDecl;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Recognizes canonical counting loops that can become {@code for v in range(...)}.
 *
 * A loop qualifies when it starts {@code v} at a simple integer value, tests
 * {@code v} against a simple bound with {@code < <= > >=}, steps {@code v} by a
 * non-zero integer constant in the direction of the test, and its body never
 * rebinds {@code v} or a name the bound reads. Every name involved must be
 * known to hold an integer. Anything else keeps C's semantics through the
 * {@code while} fallback.
 */
final class ForLoopRewriter {
	private static final Set<String> NON_INTEGER_TYPES = Set.of("float", "double", "char", "bool", "void");

	/**
	 * @param start      first value
	 * @param bound      right side of the loop test
	 * @param boundAdjust 0 for strict tests, +1 for {@code <=}, -1 for {@code >=}
	 */
	record RangeLoop(String variable, CExpr start, CExpr bound, int boundAdjust, long step) {
	}

	private ForLoopRewriter() {
	}

	/**
	 * @param globals   names declared at file scope
	 * @param usedAfter names read or written once the loop is done; a loop that
	 *                  assigns (rather than declares) its variable must not leak
	 *                  Python's final value into them
	 * @param integers  whether a name in scope is declared with an integer type
	 */
	static Optional<RangeLoop> match(CFor loop, Set<String> globals, Set<String> usedAfter,
			Predicate<String> integers) {
		if (loop.initializer().isEmpty() || loop.condition().isEmpty() || loop.increment().isEmpty()) {
			return Optional.empty();
		}

		String variable;
		CExpr start;
		CStmt init = loop.initializer().get();
		if (init instanceof CVariableDecl decl) {
			if (decl.initializer().isEmpty() || !isIntegerType(decl.declaredType())) {
				return Optional.empty();
			}
			variable = decl.name();
			start = decl.initializer().get();
		} else if (init instanceof CExpressionStmt es && es.expr() instanceof CAssignment a && !a.isCompound()
				&& a.target() instanceof CIdentifier id) {
			variable = id.name();
			start = a.value();
			if (usedAfter.contains(variable) || globals.contains(variable) || !integers.test(variable)) {
				return Optional.empty();
			}
		} else {
			return Optional.empty();
		}
		if (!isSimpleStart(start)) {
			return Optional.empty();
		}
		if (start instanceof CIdentifier startName && !integers.test(startName.name())) {
			return Optional.empty();
		}

		if (!(loop.condition().get() instanceof CBinaryExpr test) || !isVariable(test.left(), variable)) {
			return Optional.empty();
		}
		String op = test.op();
		if (!op.equals("<") && !op.equals("<=") && !op.equals(">") && !op.equals(">=")) {
			return Optional.empty();
		}
		int direction = op.startsWith("<") ? 1 : -1;
		int boundAdjust = op.endsWith("=") ? direction : 0;
		Set<String> boundNames = new HashSet<>();
		if (!collectSimpleBound(test.right(), boundNames) || boundNames.contains(variable)) {
			return Optional.empty();
		}
		if (!boundNames.stream().allMatch(integers)) {
			return Optional.empty();
		}

		Optional<Long> step = stepOf(loop.increment().get(), variable);
		if (step.isEmpty() || step.get() == 0 || Long.signum(step.get()) != direction) {
			return Optional.empty();
		}

		MutationScanner body = MutationScanner.of(loop.body());
		Set<String> watched = new HashSet<>(boundNames);
		watched.add(variable);
		for (String name : watched) {
			if (body.rebound().contains(name) || body.declared().contains(name)) {
				return Optional.empty();
			}
			if (body.hasCalls() && globals.contains(name)) {
				return Optional.empty();
			}
		}

		return Optional.of(new RangeLoop(variable, start, test.right(), boundAdjust, step.get()));
	}

	/** False for floating, character, boolean and array types, and for an unknown (empty) type. */
	static boolean isIntegerType(String declaredType) {
		if (declaredType.isBlank() || declaredType.contains("[")) {
			return false;
		}
		for (String word : declaredType.split(" ")) {
			if (NON_INTEGER_TYPES.contains(word)) {
				return false;
			}
		}
		return true;
	}

	private static boolean isVariable(CExpr expr, String variable) {
		return expr instanceof CIdentifier id && id.name().equals(variable);
	}

	private static boolean isSimpleStart(CExpr expr) {
		if (expr instanceof CIdentifier) {
			return true;
		}
		return integerValue(expr).isPresent();
	}

	/** Integer literals combined with unary minus and {@code + - *}, with no names. */
	static boolean isIntegerConstant(CExpr expr) {
		Set<String> names = new HashSet<>();
		return collectSimpleBound(expr, names) && names.isEmpty();
	}

	/** Identifiers, integer literals and {@code + - *} over them. */
	private static boolean collectSimpleBound(CExpr expr, Set<String> names) {
		if (expr instanceof CIdentifier id) {
			names.add(id.name());
			return true;
		}
		if (expr instanceof CNumberLiteral n) {
			return !n.isFloat();
		}
		if (expr instanceof CUnaryExpr u && u.prefix() && u.op().equals("-")) {
			return collectSimpleBound(u.operand(), names);
		}
		if (expr instanceof CBinaryExpr b && (b.op().equals("+") || b.op().equals("-") || b.op().equals("*"))) {
			return collectSimpleBound(b.left(), names) && collectSimpleBound(b.right(), names);
		}
		return false;
	}

	private static Optional<Long> stepOf(CExpr increment, String variable) {
		if (increment instanceof CUnaryExpr u && u.isIncrementOrDecrement() && isVariable(u.operand(), variable)) {
			return Optional.of(u.op().equals("++") ? 1L : -1L);
		}
		if (!(increment instanceof CAssignment a) || !isVariable(a.target(), variable)) {
			return Optional.empty();
		}
		switch (a.op()) {
			case "+=":
				return integerValue(a.value());
			case "-=":
				return integerValue(a.value()).map(n -> -n);
			case "=":
				if (a.value() instanceof CBinaryExpr b && isVariable(b.left(), variable)) {
					if (b.op().equals("+")) {
						return integerValue(b.right());
					}
					if (b.op().equals("-")) {
						return integerValue(b.right()).map(n -> -n);
					}
				}
				return Optional.empty();
			default:
				return Optional.empty();
		}
	}

	/** Value of an integer literal, optionally negated; empty for anything else. */
	static Optional<Long> integerValue(CExpr expr) {
		if (expr instanceof CUnaryExpr u && u.prefix() && u.op().equals("-")) {
			return integerValue(u.operand()).map(n -> -n);
		}
		if (!(expr instanceof CNumberLiteral n) || n.isFloat()) {
			return Optional.empty();
		}
		String text = n.text();
		int radix = text.length() > 1 && text.startsWith("0") ? 8 : 10;
		try {
			return Optional.of(Long.parseLong(radix == 8 ? text.substring(1) : text, radix));
		} catch (NumberFormatException ex) {
			// out of range for a long, or 8/9 in an octal literal
			return Optional.empty();
		}
	}
}
