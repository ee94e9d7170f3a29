package codemorph.ast.c;

import codemorph.ast.SourcePosition;

import java.util.List;

public record CFunctionCall(String name, List<CExpr> args, SourcePosition position) implements CExpr {
	public CFunctionCall {
		args = List.copyOf(args);
	}

	@Override
	public NodeKind kind() {
		return NodeKind.FUNCTION_CALL;
	}

	@Override
	public <R, P> R accept(CExprVisitor<R, P> visitor, P arg) {
		return visitor.visitCall(this, arg);
	}
}
