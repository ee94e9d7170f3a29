package codemorph.ast.c;

import codemorph.ast.SourcePosition;

public record CExpressionStmt(CExpr expr, SourcePosition position) implements CStmt {
	@Override
	public NodeKind kind() {
		return NodeKind.EXPRESSION_STATEMENT;
	}

	@Override
	public <R, P> R accept(CStmtVisitor<R, P> visitor, P arg) {
		return visitor.visitExpressionStmt(this, arg);
	}
}
