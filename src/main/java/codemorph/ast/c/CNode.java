package codemorph.ast.c;

import codemorph.ast.SourcePosition;

public sealed interface CNode permits CProgram, CExpr, CStmt {
	NodeKind kind();

	SourcePosition position();
}
