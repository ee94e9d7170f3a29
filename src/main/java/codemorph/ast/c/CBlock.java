package codemorph.ast.c;

import codemorph.ast.SourcePosition;

import java.util.List;

public record CBlock(List<CStmt> statements, SourcePosition position) implements CStmt {
	public CBlock {
		statements = List.copyOf(statements);
	}

	@Override
	public NodeKind kind() {
		return NodeKind.BLOCK;
	}

	@Override
	public <R, P> R accept(CStmtVisitor<R, P> visitor, P arg) {
		return visitor.visitBlock(this, arg);
	}
}
