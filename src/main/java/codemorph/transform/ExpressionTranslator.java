package codemorph.transform;

import codemorph.ast.SourcePosition;
import codemorph.ast.c.CArraySubscript;
import codemorph.ast.c.CAssignment;
import codemorph.ast.c.CBinaryExpr;
import codemorph.ast.c.CBooleanLiteral;
import codemorph.ast.c.CCharLiteral;
import codemorph.ast.c.CExpr;
import codemorph.ast.c.CExprVisitor;
import codemorph.ast.c.CFunctionCall;
import codemorph.ast.c.CIdentifier;
import codemorph.ast.c.CNumberLiteral;
import codemorph.ast.c.CStringLiteral;
import codemorph.ast.c.CUnaryExpr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders C expressions as Python expressions, adding parentheses only where
 * Python's binding rules need them.
 *
 * Forms with no faithful Python equivalent are rendered best-effort and leave
 * a note; the statement emitter turns pending notes into an
 * {@code # unsupported:} comment on the line it writes.
 */
final class ExpressionTranslator implements CExprVisitor<ExpressionTranslator.Py, Void> {
	/** Rendered text and the binding strength of its outermost operator. */
	record Py(String text, int precedence) {
	}

	private final List<String> notes = new ArrayList<>();
	private final Map<String, String> renames = new HashMap<>();

	String render(CExpr expr) {
		return expr.accept(this, null).text();
	}

	/** Renders {@code expr}, parenthesized when it binds looser than {@code minPrecedence}. */
	String render(CExpr expr, int minPrecedence) {
		return wrap(expr.accept(this, null), minPrecedence);
	}

	/** Renders an assignment target: a name or a subscript. */
	String renderTarget(CExpr target) {
		return render(target, PythonSyntax.POSTFIX);
	}

	/** Python spelling of a C variable name, after any active rename. */
	String name(String cName) {
		return PythonSyntax.safeName(renames.getOrDefault(cName, cName));
	}

	/**
	 * Spells {@code cName} as {@code pythonName} until {@link #restore} is called.
	 *
	 * @return the rename this one hides, or null
	 */
	String rename(String cName, String pythonName) {
		return renames.put(cName, pythonName);
	}

	void restore(String cName, String previous) {
		if (previous == null) {
			renames.remove(cName);
		} else {
			renames.put(cName, previous);
		}
	}

	List<String> drainNotes() {
		List<String> pending = List.copyOf(notes);
		notes.clear();
		return pending;
	}

	private static String wrap(Py py, int minPrecedence) {
		return py.precedence() < minPrecedence ? "(" + py.text() + ")" : py.text();
	}

	@Override
	public Py visitIdentifier(CIdentifier expr, Void arg) {
		return new Py(name(expr.name()), PythonSyntax.ATOM);
	}

	@Override
	public Py visitNumber(CNumberLiteral expr, Void arg) {
		return new Py(numberText(expr.text()), PythonSyntax.ATOM);
	}

	/** C octal literals ({@code 010}) need the {@code 0o} prefix in Python. */
	static String numberText(String text) {
		if (text.length() > 1 && text.charAt(0) == '0' && text.chars().allMatch(Character::isDigit)) {
			return "0o" + text.substring(1);
		}
		return text;
	}

	@Override
	public Py visitString(CStringLiteral expr, Void arg) {
		return new Py(PythonSyntax.quote(expr.value(), '"'), PythonSyntax.ATOM);
	}

	@Override
	public Py visitChar(CCharLiteral expr, Void arg) {
		return new Py(PythonSyntax.quote(String.valueOf(expr.value()), '\''), PythonSyntax.ATOM);
	}

	@Override
	public Py visitBoolean(CBooleanLiteral expr, Void arg) {
		return new Py(expr.value() ? "True" : "False", PythonSyntax.ATOM);
	}

	@Override
	public Py visitBinary(CBinaryExpr expr, Void arg) {
		int precedence = PythonSyntax.binaryPrecedence(expr.op());
		if (precedence < 0) {
			notes.add("operator '" + expr.op() + "'");
			return new Py("(" + render(expr.left(), PythonSyntax.ATOM) + " " + expr.op() + " "
					+ render(expr.right(), PythonSyntax.ATOM) + ")", PythonSyntax.ATOM);
		}
		// comparisons chain in Python, so a comparison operand is never a bare comparison
		int leftMin = precedence == PythonSyntax.COMPARE ? PythonSyntax.COMPARE + 1 : precedence;
		int rightMin = precedence + 1;
		String text = render(expr.left(), leftMin) + " " + PythonSyntax.binaryOperator(expr.op()) + " "
				+ render(expr.right(), rightMin);
		return new Py(text, precedence);
	}

	@Override
	public Py visitUnary(CUnaryExpr expr, Void arg) {
		switch (expr.op()) {
			case "!":
				return new Py("not " + render(expr.operand(), PythonSyntax.NOT), PythonSyntax.NOT);
			case "-":
				return new Py("-" + render(expr.operand(), PythonSyntax.UNARY), PythonSyntax.UNARY);
			case "&":
				// Python has no addresses; the value itself is the closest reading
				return expr.operand().accept(this, null);
			case "++":
			case "--":
				return stepInExpression(expr);
			default:
				notes.add("unary operator '" + expr.op() + "'");
				return expr.operand().accept(this, null);
		}
	}

	/** {@code ++x} becomes {@code (x := x + 1)}; {@code x++} yields the old value. */
	private Py stepInExpression(CUnaryExpr expr) {
		if (!(expr.operand() instanceof CIdentifier id)) {
			notes.add("'" + expr.op() + "' on " + expr.operand().kind().displayName() + " inside an expression");
			return expr.operand().accept(this, null);
		}
		String name = name(id.name());
		boolean increment = expr.op().equals("++");
		String walrus = "(" + name + " := " + name + (increment ? " + 1)" : " - 1)");
		if (expr.prefix()) {
			return new Py(walrus, PythonSyntax.ATOM);
		}
		return new Py(walrus + (increment ? " - 1" : " + 1"), PythonSyntax.ADD);
	}

	@Override
	public Py visitAssignment(CAssignment expr, Void arg) {
		if (!(expr.target() instanceof CIdentifier id)) {
			notes.add("assignment to " + expr.target().kind().displayName() + " inside an expression");
			return expr.value().accept(this, null);
		}
		String name = name(id.name());
		String value = expr.isCompound()
				? visitBinary(new CBinaryExpr(expr.arithmeticOp(), id, expr.value(), SourcePosition.NONE), null).text()
				: render(expr.value(), PythonSyntax.OR);
		return new Py("(" + name + " := " + value + ")", PythonSyntax.ATOM);
	}

	@Override
	public Py visitCall(CFunctionCall expr, Void arg) {
		String callee = switch (expr.name()) {
			case "puts" -> "print";
			case "strlen" -> "len";
			default -> PythonSyntax.safeName(expr.name());
		};
		String args = expr.args().stream()
				.map(a -> render(a, PythonSyntax.OR))
				.collect(Collectors.joining(", "));
		return new Py(callee + "(" + args + ")", PythonSyntax.POSTFIX);
	}

	@Override
	public Py visitSubscript(CArraySubscript expr, Void arg) {
		return new Py(render(expr.array(), PythonSyntax.POSTFIX) + "[" + render(expr.index()) + "]",
				PythonSyntax.POSTFIX);
	}
}
