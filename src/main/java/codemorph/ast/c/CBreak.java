package codemorph.ast.c;

import codemorph.ast.SourcePosition;

public record CBreak(SourcePosition position) implements CStmt {
	@Override
	public NodeKind kind() {
		return NodeKind.BREAK;
	}

	@Override
	public <R, P> R accept(CStmtVisitor<R, P> visitor, P arg) {
		return visitor.visitBreak(this, arg);
	}
}
