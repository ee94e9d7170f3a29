package codemorph.ast.c;

import codemorph.ast.SourcePosition;

import java.util.Objects;
import java.util.Optional;

/**
 * Conditional. An else branch that is itself a {@code CIf} forms an else-if
 * chain.
 */
public record CIf(CExpr condition, CStmt thenBranch, Optional<CStmt> elseBranch, SourcePosition position)
		implements CStmt {
	public CIf {
		Objects.requireNonNull(elseBranch, "elseBranch");
	}

	@Override
	public NodeKind kind() {
		return NodeKind.IF;
	}

	@Override
	public <R, P> R accept(CStmtVisitor<R, P> visitor, P arg) {
		return visitor.visitIf(this, arg);
	}
}
