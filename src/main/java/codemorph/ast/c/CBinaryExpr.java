package codemorph.ast.c;

import codemorph.ast.SourcePosition;

public record CBinaryExpr(String op, CExpr left, CExpr right, SourcePosition position) implements CExpr {
	@Override
	public NodeKind kind() {
		return NodeKind.BINARY_EXPR;
	}

	@Override
	public <R, P> R accept(CExprVisitor<R, P> visitor, P arg) {
		return visitor.visitBinary(this, arg);
	}
}
