package codemorph.ast.c;

import codemorph.ast.SourcePosition;

public record CContinue(SourcePosition position) implements CStmt {
	@Override
	public NodeKind kind() {
		return NodeKind.CONTINUE;
	}

	@Override
	public <R, P> R accept(CStmtVisitor<R, P> visitor, P arg) {
		return visitor.visitContinue(this, arg);
	}
}
