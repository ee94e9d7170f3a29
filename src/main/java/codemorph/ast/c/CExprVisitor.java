package codemorph.ast.c;

/**
 * Exhaustive dispatch over {@link CExpr} variants. {@code P} is an extra
 * argument threaded through the traversal.
 */
public interface CExprVisitor<R, P> {
	R visitIdentifier(CIdentifier expr, P arg);

	R visitNumber(CNumberLiteral expr, P arg);

	R visitString(CStringLiteral expr, P arg);

	R visitChar(CCharLiteral expr, P arg);

	R visitBoolean(CBooleanLiteral expr, P arg);

	R visitBinary(CBinaryExpr expr, P arg);

	R visitUnary(CUnaryExpr expr, P arg);

	R visitAssignment(CAssignment expr, P arg);

	R visitCall(CFunctionCall expr, P arg);

	R visitSubscript(CArraySubscript expr, P arg);
}
