package codemorph.ast.c;

import codemorph.ast.SourcePosition;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Function definition, or a prototype when {@link #body()} is empty.
 */
public record CFunctionDecl(String name, String declaredType, List<CParam> params, Optional<CBlock> body,
		SourcePosition position) implements CDeclaration {
	public CFunctionDecl {
		params = List.copyOf(params);
		Objects.requireNonNull(body, "body");
	}

	public boolean isPrototype() {
		return body.isEmpty();
	}

	@Override
	public NodeKind kind() {
		return NodeKind.FUNCTION_DECLARATION;
	}

	@Override
	public <R, P> R accept(CStmtVisitor<R, P> visitor, P arg) {
		return visitor.visitFunctionDecl(this, arg);
	}
}
