package codemorph.ast.c;

/**
 * Exhaustive dispatch over {@link CStmt} variants.
 */
public interface CStmtVisitor<R, P> {
	R visitExpressionStmt(CExpressionStmt stmt, P arg);

	R visitVariableDecl(CVariableDecl stmt, P arg);

	R visitArrayDecl(CArrayDecl stmt, P arg);

	R visitFunctionDecl(CFunctionDecl stmt, P arg);

	R visitBlock(CBlock stmt, P arg);

	R visitIf(CIf stmt, P arg);

	R visitWhile(CWhile stmt, P arg);

	R visitFor(CFor stmt, P arg);

	R visitReturn(CReturn stmt, P arg);

	R visitBreak(CBreak stmt, P arg);

	R visitContinue(CContinue stmt, P arg);

	R visitPrintf(CPrintf stmt, P arg);

	R visitScanf(CScanf stmt, P arg);
}
