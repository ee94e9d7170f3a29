package codemorph.parse.c;

public enum CTokenKind {
	KEYWORD("Keyword"),
	IDENTIFIER("Identifier"),
	INTEGER_LITERAL("IntegerLiteral"),
	FLOAT_LITERAL("FloatLiteral"),
	STRING_LITERAL("StringLiteral"),
	CHAR_LITERAL("CharLiteral"),
	OPERATOR("Operator"),
	SYMBOL("Symbol"),
	BOOLEAN_LITERAL("BooleanLiteral"),
	EOF("EndOfFile"),
	ERROR("Error"),
	UNKNOWN("Unknown");

	private final String displayName;

	CTokenKind(String displayName) {
		this.displayName = displayName;
	}

	public String displayName() {
		return displayName;
	}
}
