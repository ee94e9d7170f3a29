package codemorph.parse.c;

import codemorph.ast.SourcePosition;

/**
 * A lexeme with its kind and 1-based position of its first character.
 *
 * String and char literals hold their unescaped content; error tokens hold the
 * message.
 */
public record CToken(CTokenKind kind, String text, int line, int column) {
	public CToken {
		if (kind == null || text == null) {
			throw new IllegalArgumentException("token kind and text are required");
		}
	}

	public static CToken eof(int line, int column) {
		return new CToken(CTokenKind.EOF, "", line, column);
	}

	public SourcePosition position() {
		return new SourcePosition(line, column);
	}

	public boolean is(CTokenKind kind, String text) {
		return this.kind == kind && this.text.equals(text);
	}

	public boolean isKeyword(String keyword) {
		return is(CTokenKind.KEYWORD, keyword);
	}

	public boolean isSymbol(String symbol) {
		return is(CTokenKind.SYMBOL, symbol);
	}

	public boolean isOperator(String operator) {
		return is(CTokenKind.OPERATOR, operator);
	}

	public boolean isIdentifier(String name) {
		return is(CTokenKind.IDENTIFIER, name);
	}
}
