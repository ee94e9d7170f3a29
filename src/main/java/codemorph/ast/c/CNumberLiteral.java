package codemorph.ast.c;

import codemorph.ast.SourcePosition;

/**
 * Integer or floating literal, kept as its source text.
 */
public record CNumberLiteral(String text, SourcePosition position) implements CExpr {
	public boolean isFloat() {
		return text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0;
	}

	@Override
	public NodeKind kind() {
		return NodeKind.NUMBER_LITERAL;
	}

	@Override
	public <R, P> R accept(CExprVisitor<R, P> visitor, P arg) {
		return visitor.visitNumber(this, arg);
	}
}
