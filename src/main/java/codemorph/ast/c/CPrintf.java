package codemorph.ast.c;

import codemorph.ast.SourcePosition;

import java.util.List;

/**
 * {@code printf(format, args...)}, recognized structurally by the parser.
 */
public record CPrintf(CStringLiteral format, List<CExpr> args, SourcePosition position) implements CStmt {
	public CPrintf {
		args = List.copyOf(args);
	}

	@Override
	public NodeKind kind() {
		return NodeKind.PRINTF;
	}

	@Override
	public <R, P> R accept(CStmtVisitor<R, P> visitor, P arg) {
		return visitor.visitPrintf(this, arg);
	}
}
