package codemorph.ast.c;

import codemorph.ast.SourcePosition;

import java.util.Objects;
import java.util.Optional;

/**
 * Scalar declaration such as {@code int x = 5;}. {@code declaredType} is the
 * full specifier list, e.g. {@code "unsigned int"}.
 */
public record CVariableDecl(String name, String declaredType, Optional<CExpr> initializer, SourcePosition position)
		implements CDeclaration {
	public CVariableDecl {
		Objects.requireNonNull(initializer, "initializer");
	}

	@Override
	public NodeKind kind() {
		return NodeKind.VARIABLE_DECLARATION;
	}

	@Override
	public <R, P> R accept(CStmtVisitor<R, P> visitor, P arg) {
		return visitor.visitVariableDecl(this, arg);
	}
}
