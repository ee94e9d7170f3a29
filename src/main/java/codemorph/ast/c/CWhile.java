package codemorph.ast.c;

import codemorph.ast.SourcePosition;

public record CWhile(CExpr condition, CStmt body, SourcePosition position) implements CStmt {
	@Override
	public NodeKind kind() {
		return NodeKind.WHILE;
	}

	@Override
	public <R, P> R accept(CStmtVisitor<R, P> visitor, P arg) {
		return visitor.visitWhile(this, arg);
	}
}
