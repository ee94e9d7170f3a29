package codemorph.ast.c;

import codemorph.ast.SourcePosition;

public record CCharLiteral(char value, SourcePosition position) implements CExpr {
	@Override
	public NodeKind kind() {
		return NodeKind.CHAR_LITERAL;
	}

	@Override
	public <R, P> R accept(CExprVisitor<R, P> visitor, P arg) {
		return visitor.visitChar(this, arg);
	}
}
