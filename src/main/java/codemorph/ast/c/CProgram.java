package codemorph.ast.c;

import codemorph.ast.SourcePosition;

import java.util.List;

/**
 * Root of a parsed translation unit: top-level statements in source order.
 */
public record CProgram(List<CStmt> statements, SourcePosition position) implements CNode {
	public CProgram {
		statements = List.copyOf(statements);
	}

	@Override
	public NodeKind kind() {
		return NodeKind.PROGRAM;
	}
}
