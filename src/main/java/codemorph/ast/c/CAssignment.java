package codemorph.ast.c;

import codemorph.ast.SourcePosition;

import java.util.Objects;

/**
 * Plain ({@code =}) or compound ({@code += -= *= /= %=}) assignment.
 *
 * The target must be an L-value: an identifier or an array subscript.
 */
public record CAssignment(String op, CExpr target, CExpr value, SourcePosition position) implements CExpr {
	public CAssignment {
		Objects.requireNonNull(op, "op");
		Objects.requireNonNull(value, "value");
		if (!isLValue(target)) {
			throw new IllegalArgumentException("Assignment target must be an identifier or array subscript, got "
					+ (target == null ? "null" : target.kind().displayName()));
		}
	}

	public static boolean isLValue(CExpr expr) {
		return expr instanceof CIdentifier || expr instanceof CArraySubscript;
	}

	public boolean isCompound() {
		return !op.equals("=");
	}

	/**
	 * The arithmetic operator of a compound assignment ({@code "+"} for
	 * {@code "+="}); empty for plain assignment.
	 */
	public String arithmeticOp() {
		return isCompound() ? op.substring(0, op.length() - 1) : "";
	}

	@Override
	public NodeKind kind() {
		return NodeKind.ASSIGNMENT;
	}

	@Override
	public <R, P> R accept(CExprVisitor<R, P> visitor, P arg) {
		return visitor.visitAssignment(this, arg);
	}
}
