package codemorph.ast.c;

import codemorph.ast.SourcePosition;

/**
 * Fixed-size array declaration such as {@code int arr[10];}.
 */
public record CArrayDecl(String name, String declaredType, CExpr size, SourcePosition position)
		implements CDeclaration {
	@Override
	public NodeKind kind() {
		return NodeKind.ARRAY_DECLARATION;
	}

	@Override
	public <R, P> R accept(CStmtVisitor<R, P> visitor, P arg) {
		return visitor.visitArrayDecl(this, arg);
	}
}
