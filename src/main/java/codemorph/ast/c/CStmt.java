package codemorph.ast.c;

public sealed interface CStmt extends CNode permits CExpressionStmt, CDeclaration, CBlock, CIf, CWhile, CFor,
		CReturn, CBreak, CContinue, CPrintf, CScanf {
	<R, P> R accept(CStmtVisitor<R, P> visitor, P arg);
}
