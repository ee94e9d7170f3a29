package codemorph.ast.c;

import codemorph.ast.SourcePosition;

import java.util.List;

/**
 * {@code scanf(format, args...)}; arguments are normally {@code &lvalue}.
 */
public record CScanf(CStringLiteral format, List<CExpr> args, SourcePosition position) implements CStmt {
	public CScanf {
		args = List.copyOf(args);
	}

	@Override
	public NodeKind kind() {
		return NodeKind.SCANF;
	}

	@Override
	public <R, P> R accept(CStmtVisitor<R, P> visitor, P arg) {
		return visitor.visitScanf(this, arg);
	}
}
