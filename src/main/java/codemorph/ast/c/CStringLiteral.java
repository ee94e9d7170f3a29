package codemorph.ast.c;

import codemorph.ast.SourcePosition;

/**
 * String literal. {@link #value()} is the unescaped content without quotes.
 */
public record CStringLiteral(String value, SourcePosition position) implements CExpr {
	@Override
	public NodeKind kind() {
		return NodeKind.STRING_LITERAL;
	}

	@Override
	public <R, P> R accept(CExprVisitor<R, P> visitor, P arg) {
		return visitor.visitString(this, arg);
	}
}
