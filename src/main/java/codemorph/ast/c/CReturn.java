package codemorph.ast.c;

import codemorph.ast.SourcePosition;

import java.util.Objects;
import java.util.Optional;

public record CReturn(Optional<CExpr> value, SourcePosition position) implements CStmt {
	public CReturn {
		Objects.requireNonNull(value, "value");
	}

	@Override
	public NodeKind kind() {
		return NodeKind.RETURN;
	}

	@Override
	public <R, P> R accept(CStmtVisitor<R, P> visitor, P arg) {
		return visitor.visitReturn(this, arg);
	}
}
