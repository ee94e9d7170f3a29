package codemorph.ast.c;

/**
 * Variant tag carried by every C AST node.
 */
public enum NodeKind {
	PROGRAM("Program"),
	IDENTIFIER("Identifier"),
	NUMBER_LITERAL("NumberLiteral"),
	STRING_LITERAL("StringLiteral"),
	CHAR_LITERAL("CharLiteral"),
	BOOLEAN_LITERAL("BooleanLiteral"),
	BINARY_EXPR("BinaryExpr"),
	UNARY_EXPR("UnaryExpr"),
	ASSIGNMENT("Assignment"),
	FUNCTION_CALL("FunctionCall"),
	ARRAY_SUBSCRIPT("ArraySubscript"),
	EXPRESSION_STATEMENT("ExpressionStatement"),
	VARIABLE_DECLARATION("VariableDeclaration"),
	ARRAY_DECLARATION("ArrayDeclaration"),
	FUNCTION_DECLARATION("FunctionDeclaration"),
	BLOCK("Block"),
	IF("If"),
	WHILE("While"),
	FOR("For"),
	RETURN("Return"),
	BREAK("Break"),
	CONTINUE("Continue"),
	PRINTF("Printf"),
	SCANF("Scanf");

	private final String displayName;

	NodeKind(String displayName) {
		this.displayName = displayName;
	}

	public String displayName() {
		return displayName;
	}
}
