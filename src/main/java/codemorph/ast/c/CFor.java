package codemorph.ast.c;

import codemorph.ast.SourcePosition;

import java.util.Objects;
import java.util.Optional;

/**
 * C {@code for} loop. Each of the three clauses is independently optional.
 */
public record CFor(Optional<CStmt> initializer, Optional<CExpr> condition, Optional<CExpr> increment, CStmt body,
		SourcePosition position) implements CStmt {
	public CFor {
		Objects.requireNonNull(initializer, "initializer");
		Objects.requireNonNull(condition, "condition");
		Objects.requireNonNull(increment, "increment");
	}

	@Override
	public NodeKind kind() {
		return NodeKind.FOR;
	}

	@Override
	public <R, P> R accept(CStmtVisitor<R, P> visitor, P arg) {
		return visitor.visitFor(this, arg);
	}
}
