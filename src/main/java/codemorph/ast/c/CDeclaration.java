package codemorph.ast.c;

/**
 * Statements that introduce a name: scalar variables, arrays and functions.
 *
 * For arrays {@link #declaredType()} is the element type, for functions the
 * return type.
 */
public sealed interface CDeclaration extends CStmt permits CVariableDecl, CArrayDecl, CFunctionDecl {
	String name();

	String declaredType();
}
