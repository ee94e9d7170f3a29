package codemorph.ast.c;

import codemorph.ast.SourcePosition;

public record CBooleanLiteral(boolean value, SourcePosition position) implements CExpr {
	@Override
	public NodeKind kind() {
		return NodeKind.BOOLEAN_LITERAL;
	}

	@Override
	public <R, P> R accept(CExprVisitor<R, P> visitor, P arg) {
		return visitor.visitBoolean(this, arg);
	}
}
