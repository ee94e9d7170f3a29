package codemorph.ast.c;

import codemorph.ast.SourcePosition;

public record CIdentifier(String name, SourcePosition position) implements CExpr {
	@Override
	public NodeKind kind() {
		return NodeKind.IDENTIFIER;
	}

	@Override
	public <R, P> R accept(CExprVisitor<R, P> visitor, P arg) {
		return visitor.visitIdentifier(this, arg);
	}
}
