package codemorph.ast.c;

import codemorph.ast.SourcePosition;

/**
 * Prefix ({@code ! - & ++ --}) or postfix ({@code ++ --}) operator.
 */
public record CUnaryExpr(String op, CExpr operand, boolean prefix, SourcePosition position) implements CExpr {
	public boolean isIncrementOrDecrement() {
		return op.equals("++") || op.equals("--");
	}

	@Override
	public NodeKind kind() {
		return NodeKind.UNARY_EXPR;
	}

	@Override
	public <R, P> R accept(CExprVisitor<R, P> visitor, P arg) {
		return visitor.visitUnary(this, arg);
	}
}
