package codemorph.ast.c;

public sealed interface CExpr extends CNode permits CIdentifier, CNumberLiteral, CStringLiteral, CCharLiteral,
		CBooleanLiteral, CBinaryExpr, CUnaryExpr, CAssignment, CFunctionCall, CArraySubscript {
	<R, P> R accept(CExprVisitor<R, P> visitor, P arg);
}
