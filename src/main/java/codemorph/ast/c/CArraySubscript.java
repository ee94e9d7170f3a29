package codemorph.ast.c;

import codemorph.ast.SourcePosition;

public record CArraySubscript(CExpr array, CExpr index, SourcePosition position) implements CExpr {
	@Override
	public NodeKind kind() {
		return NodeKind.ARRAY_SUBSCRIPT;
	}

	@Override
	public <R, P> R accept(CExprVisitor<R, P> visitor, P arg) {
		return visitor.visitSubscript(this, arg);
	}
}
