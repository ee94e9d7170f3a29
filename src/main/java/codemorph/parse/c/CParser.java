package codemorph.parse.c;

import codemorph.Diagnostic.Stage;
import codemorph.Diagnostics;
import codemorph.ast.SourcePosition;
import codemorph.ast.c.CArrayDecl;
import codemorph.ast.c.CArraySubscript;
import codemorph.ast.c.CAssignment;
import codemorph.ast.c.CBinaryExpr;
import codemorph.ast.c.CBlock;
import codemorph.ast.c.CBooleanLiteral;
import codemorph.ast.c.CBreak;
import codemorph.ast.c.CCharLiteral;
import codemorph.ast.c.CContinue;
import codemorph.ast.c.CExpr;
import codemorph.ast.c.CExpressionStmt;
import codemorph.ast.c.CFor;
import codemorph.ast.c.CFunctionCall;
import codemorph.ast.c.CFunctionDecl;
import codemorph.ast.c.CIdentifier;
import codemorph.ast.c.CIf;
import codemorph.ast.c.CNumberLiteral;
import codemorph.ast.c.CParam;
import codemorph.ast.c.CPrintf;
import codemorph.ast.c.CProgram;
import codemorph.ast.c.CReturn;
import codemorph.ast.c.CScanf;
import codemorph.ast.c.CStmt;
import codemorph.ast.c.CStringLiteral;
import codemorph.ast.c.CUnaryExpr;
import codemorph.ast.c.CVariableDecl;
import codemorph.ast.c.CWhile;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Recursive-descent parser for the C subset.
 *
 * Binary operators are parsed by precedence level, lowest first:
 * assignment, {@code ||}, {@code &&}, equality, comparison, additive,
 * multiplicative, unary, postfix, primary.
 *
 * Errors are thrown as {@link CParseException} and caught only in the
 * top-level statement loop, which reports them, resynchronizes and moves on.
 */
public final class CParser {
	static final int MAX_DEPTH = 256;

	static final Set<String> TYPE_QUALIFIERS = Set.of("const", "static", "unsigned", "signed", "long", "short");
	static final Set<String> BASE_TYPES = Set.of("int", "float", "double", "char", "bool", "void");
	private static final Set<String> STATEMENT_KEYWORDS = Set.of("if", "while", "for", "return", "break",
			"continue");
	private static final Set<String> ASSIGNMENT_OPS = Set.of("=", "+=", "-=", "*=", "/=", "%=");
	private static final Set<String> PREFIX_OPS = Set.of("!", "-", "&", "++", "--");

	private final Diagnostics diagnostics;

	public CParser() {
		this(new Diagnostics());
	}

	public CParser(Diagnostics diagnostics) {
		this.diagnostics = diagnostics;
	}

	public CProgram parse(List<CToken> tokens) {
		Cursor c = new Cursor(tokens);
		SourcePosition start = c.isAtEnd() ? SourcePosition.NONE : c.peek().position();
		List<CStmt> statements = new ArrayList<>();
		while (!c.isAtEnd()) {
			try {
				statements.add(parseStatement(c));
			} catch (CParseException ex) {
				report(ex);
				c.pos = synchronize(c.tokens, c.pos);
			}
		}
		return new CProgram(statements, start);
	}

	/**
	 * Parses the whole token list as a single expression. Empty when the list is
	 * empty, does not parse, or has tokens left over.
	 */
	public Optional<CExpr> parseExpressionOnly(List<CToken> tokens) {
		Cursor c = new Cursor(tokens);
		if (c.isAtEnd()) {
			return Optional.empty();
		}
		try {
			CExpr expr = parseExpression(c);
			if (!c.isAtEnd()) {
				CToken extra = c.peek();
				diagnostics.info(Stage.PARSER, extra.line(), "Unexpected '" + extra.text() + "' after expression");
				return Optional.empty();
			}
			return Optional.of(expr);
		} catch (CParseException ex) {
			diagnostics.info(Stage.PARSER, ex.token().line(), ex.getMessage());
			return Optional.empty();
		}
	}

	private void report(CParseException ex) {
		CToken t = ex.token();
		String near = t.kind() == CTokenKind.EOF ? "end of file" : "'" + t.text() + "' (" + t.kind().displayName() + ")";
		diagnostics.error(Stage.PARSER, t.line(), "Syntax error near " + near + ": " + ex.getMessage());
	}

	/**
	 * Panic-mode resynchronization. Discards at least one token, then stops after
	 * a consumed {@code ;} or before a token that can start a statement. Returns
	 * the new position.
	 */
	static int synchronize(List<CToken> tokens, int pos) {
		int last = tokens.size() - 1;
		if (pos >= last || tokens.get(pos).kind() == CTokenKind.EOF) {
			return Math.min(pos, last);
		}
		pos++;
		while (pos < last && tokens.get(pos).kind() != CTokenKind.EOF) {
			if (tokens.get(pos - 1).isSymbol(";") || startsStatement(tokens, pos)) {
				return pos;
			}
			pos++;
		}
		return pos;
	}

	private static boolean startsStatement(List<CToken> tokens, int pos) {
		CToken t = tokens.get(pos);
		switch (t.kind()) {
			case KEYWORD:
				return STATEMENT_KEYWORDS.contains(t.text()) || isTypeKeyword(t);
			case IDENTIFIER:
				return (t.text().equals("printf") || t.text().equals("scanf"))
						&& pos + 1 < tokens.size() && tokens.get(pos + 1).isSymbol("(");
			case SYMBOL:
				return t.text().equals("{") || t.text().equals("}");
			default:
				return false;
		}
	}

	private static boolean isTypeKeyword(CToken t) {
		return t.kind() == CTokenKind.KEYWORD && (TYPE_QUALIFIERS.contains(t.text()) || BASE_TYPES.contains(t.text()));
	}

	// statements

	private CStmt parseStatement(Cursor c) {
		c.enter();
		try {
			CToken t = c.peek();
			if (t.isKeyword("if")) {
				return parseIf(c);
			}
			if (t.isKeyword("while")) {
				return parseWhile(c);
			}
			if (t.isKeyword("for")) {
				return parseFor(c);
			}
			if (t.isKeyword("return")) {
				return parseReturn(c);
			}
			if (t.isKeyword("break")) {
				c.next();
				c.expectSymbol(";", "after 'break'");
				return new CBreak(t.position());
			}
			if (t.isKeyword("continue")) {
				c.next();
				c.expectSymbol(";", "after 'continue'");
				return new CContinue(t.position());
			}
			if (t.isSymbol("{")) {
				return parseBlock(c);
			}
			if ((t.isIdentifier("printf") || t.isIdentifier("scanf")) && c.peekAt(1).isSymbol("(")) {
				return parseStdioCall(c);
			}
			if (isTypeKeyword(t)) {
				return parseDeclaration(c);
			}
			return parseExpressionStatement(c);
		} finally {
			c.exit();
		}
	}

	private CExpressionStmt parseExpressionStatement(Cursor c) {
		CExpr expr = parseExpression(c);
		c.expectSymbol(";", "after expression");
		return new CExpressionStmt(expr, expr.position());
	}

	private CBlock parseBlock(Cursor c) {
		CToken open = c.expectSymbol("{", "to open a block");
		List<CStmt> statements = new ArrayList<>();
		while (!c.isAtEnd() && !c.peekIsSymbol("}")) {
			statements.add(parseStatement(c));
		}
		c.expectSymbol("}", "to close the block opened at line " + open.line());
		return new CBlock(statements, open.position());
	}

	private CIf parseIf(Cursor c) {
		CToken start = c.next();
		c.expectSymbol("(", "after 'if'");
		CExpr condition = parseExpression(c);
		c.expectSymbol(")", "after if condition");
		CStmt thenBranch = parseStatement(c);
		Optional<CStmt> elseBranch = Optional.empty();
		if (c.peek().isKeyword("else")) {
			c.next();
			elseBranch = Optional.of(parseStatement(c));
		}
		return new CIf(condition, thenBranch, elseBranch, start.position());
	}

	private CWhile parseWhile(Cursor c) {
		CToken start = c.next();
		c.expectSymbol("(", "after 'while'");
		CExpr condition = parseExpression(c);
		c.expectSymbol(")", "after while condition");
		CStmt body = parseStatement(c);
		return new CWhile(condition, body, start.position());
	}

	private CFor parseFor(Cursor c) {
		CToken start = c.next();
		c.expectSymbol("(", "after 'for'");

		Optional<CStmt> initializer = Optional.empty();
		if (c.peekIsSymbol(";")) {
			c.next();
		} else if (isTypeKeyword(c.peek())) {
			String type = parseType(c);
			CToken name = c.expect(CTokenKind.IDENTIFIER, "variable name in for initializer");
			initializer = Optional.of(parseScalarRest(c, type, name));
		} else {
			initializer = Optional.of(parseExpressionStatement(c));
		}

		Optional<CExpr> condition = Optional.empty();
		if (!c.peekIsSymbol(";")) {
			condition = Optional.of(parseExpression(c));
		}
		c.expectSymbol(";", "after for condition");

		Optional<CExpr> increment = Optional.empty();
		if (!c.peekIsSymbol(")")) {
			increment = Optional.of(parseExpression(c));
		}
		c.expectSymbol(")", "after for clauses");

		CStmt body = parseStatement(c);
		return new CFor(initializer, condition, increment, body, start.position());
	}

	private CReturn parseReturn(Cursor c) {
		CToken start = c.next();
		Optional<CExpr> value = Optional.empty();
		if (!c.peekIsSymbol(";")) {
			value = Optional.of(parseExpression(c));
		}
		c.expectSymbol(";", "after return");
		return new CReturn(value, start.position());
	}

	private CStmt parseStdioCall(Cursor c) {
		CToken name = c.next();
		c.expectSymbol("(", "after " + name.text());
		CToken format = c.peek();
		if (format.kind() != CTokenKind.STRING_LITERAL) {
			throw c.fail("Expected a string literal as the first argument to " + name.text());
		}
		CStringLiteral formatLiteral = parseStringLiteral(c);
		List<CExpr> args = new ArrayList<>();
		while (c.peekIsSymbol(",")) {
			c.next();
			args.add(parseExpression(c));
		}
		c.expectSymbol(")", "after " + name.text() + " arguments");
		c.expectSymbol(";", "after " + name.text() + "(...)");
		if (name.text().equals("printf")) {
			return new CPrintf(formatLiteral, args, name.position());
		}
		return new CScanf(formatLiteral, args, name.position());
	}

	// declarations

	/** A run of specifier keywords joined by single spaces, e.g. {@code unsigned long int}. */
	private String parseType(Cursor c) {
		List<String> words = new ArrayList<>();
		while (c.peek().kind() == CTokenKind.KEYWORD && TYPE_QUALIFIERS.contains(c.peek().text())) {
			words.add(c.next().text());
		}
		if (c.peek().kind() == CTokenKind.KEYWORD && BASE_TYPES.contains(c.peek().text())) {
			words.add(c.next().text());
		}
		if (words.isEmpty()) {
			throw c.fail("Expected a type");
		}
		return String.join(" ", words);
	}

	private CStmt parseDeclaration(Cursor c) {
		CToken start = c.peek();
		String type = parseType(c);
		CToken name = c.expect(CTokenKind.IDENTIFIER, "identifier after type '" + type + "'");

		if (c.peekIsSymbol("[")) {
			c.next();
			CExpr size = parseExpression(c);
			c.expectSymbol("]", "after array size");
			if (c.peekIsOperator("=")) {
				diagnostics.warning(Stage.PARSER, c.peek().line(),
						"Array initializer for '" + name.text() + "' is not supported and was skipped");
				while (!c.isAtEnd() && !c.peekIsSymbol(";")) {
					c.next();
				}
			}
			c.expectSymbol(";", "after array declaration");
			return new CArrayDecl(name.text(), type, size, start.position());
		}
		if (c.peekIsSymbol("(")) {
			return parseFunctionRest(c, type, name, start);
		}
		return parseScalarRest(c, type, name, start);
	}

	private CVariableDecl parseScalarRest(Cursor c, String type, CToken name) {
		return parseScalarRest(c, type, name, name);
	}

	private CVariableDecl parseScalarRest(Cursor c, String type, CToken name, CToken start) {
		if (c.peekIsSymbol("[") || c.peekIsSymbol("(")) {
			throw c.fail("Expected a scalar declaration");
		}
		Optional<CExpr> initializer = Optional.empty();
		if (c.peekIsOperator("=")) {
			c.next();
			initializer = Optional.of(parseExpression(c));
		}
		c.expectSymbol(";", "after declaration of '" + name.text() + "'");
		return new CVariableDecl(name.text(), type, initializer, start.position());
	}

	private CFunctionDecl parseFunctionRest(Cursor c, String returnType, CToken name, CToken start) {
		c.expectSymbol("(", "after function name");
		List<CParam> params = new ArrayList<>();
		if (c.peek().isKeyword("void") && c.peekAt(1).isSymbol(")")) {
			c.next();
		} else if (!c.peekIsSymbol(")")) {
			while (true) {
				String type = parseType(c);
				CToken paramName = c.expect(CTokenKind.IDENTIFIER, "parameter name");
				boolean isArray = false;
				if (c.peekIsSymbol("[")) {
					c.next();
					c.expectSymbol("]", "in array parameter");
					isArray = true;
				}
				params.add(new CParam(paramName.text(), type, isArray));
				if (c.peekIsSymbol(",")) {
					c.next();
					continue;
				}
				break;
			}
		}
		c.expectSymbol(")", "after parameters");

		if (c.peekIsSymbol(";")) {
			c.next();
			return new CFunctionDecl(name.text(), returnType, params, Optional.empty(), start.position());
		}
		CBlock body = parseBlock(c);
		return new CFunctionDecl(name.text(), returnType, params, Optional.of(body), start.position());
	}

	// expressions

	private CExpr parseExpression(Cursor c) {
		return parseAssignment(c);
	}

	private CExpr parseAssignment(Cursor c) {
		c.enter();
		try {
			CExpr left = parseLogicalOr(c);
			CToken t = c.peek();
			if (t.kind() == CTokenKind.OPERATOR && ASSIGNMENT_OPS.contains(t.text())) {
				if (!CAssignment.isLValue(left)) {
					throw new CParseException("Invalid assignment target: the left side of '" + t.text()
							+ "' must be an identifier or an array element", t);
				}
				c.next();
				CExpr value = parseAssignment(c);
				return new CAssignment(t.text(), left, value, left.position());
			}
			return left;
		} finally {
			c.exit();
		}
	}

	private CExpr parseLogicalOr(Cursor c) {
		return parseLeftAssociative(c, Set.of("||"), this::parseLogicalAnd);
	}

	private CExpr parseLogicalAnd(Cursor c) {
		return parseLeftAssociative(c, Set.of("&&"), this::parseEquality);
	}

	private CExpr parseEquality(Cursor c) {
		return parseLeftAssociative(c, Set.of("==", "!="), this::parseComparison);
	}

	private CExpr parseComparison(Cursor c) {
		return parseLeftAssociative(c, Set.of("<", ">", "<=", ">="), this::parseTerm);
	}

	private CExpr parseTerm(Cursor c) {
		return parseLeftAssociative(c, Set.of("+", "-"), this::parseFactor);
	}

	private CExpr parseFactor(Cursor c) {
		return parseLeftAssociative(c, Set.of("*", "/", "%"), this::parseUnary);
	}

	private CExpr parseLeftAssociative(Cursor c, Set<String> ops, Function<Cursor, CExpr> operand) {
		CExpr left = operand.apply(c);
		int levels = 0;
		try {
			while (c.peek().kind() == CTokenKind.OPERATOR && ops.contains(c.peek().text())) {
				// each operator wraps the tree one level deeper
				c.enter();
				levels++;
				String op = c.next().text();
				CExpr right = operand.apply(c);
				left = new CBinaryExpr(op, left, right, left.position());
			}
			return left;
		} finally {
			c.exit(levels);
		}
	}

	private CExpr parseUnary(Cursor c) {
		CToken t = c.peek();
		if (t.kind() == CTokenKind.OPERATOR && PREFIX_OPS.contains(t.text())) {
			c.enter();
			try {
				c.next();
				CExpr operand = parseUnary(c);
				return new CUnaryExpr(t.text(), operand, true, t.position());
			} finally {
				c.exit();
			}
		}
		return parsePostfix(c);
	}

	private CExpr parsePostfix(Cursor c) {
		CExpr expr = parsePrimary(c);
		int levels = 0;
		try {
			while (true) {
				CToken t = c.peek();
				if (t.isSymbol("(") || t.isSymbol("[") || t.isOperator("++") || t.isOperator("--")) {
					c.enter();
					levels++;
				}
				if (t.isSymbol("(")) {
					if (!(expr instanceof CIdentifier callee)) {
						throw c.fail("Only a plain function name can be called");
					}
					c.next();
					List<CExpr> args = new ArrayList<>();
					if (!c.peekIsSymbol(")")) {
						args.add(parseExpression(c));
						while (c.peekIsSymbol(",")) {
							c.next();
							args.add(parseExpression(c));
						}
					}
					c.expectSymbol(")", "after call arguments");
					expr = new CFunctionCall(callee.name(), args, callee.position());
				} else if (t.isSymbol("[")) {
					c.next();
					CExpr index = parseExpression(c);
					c.expectSymbol("]", "after array index");
					expr = new CArraySubscript(expr, index, expr.position());
				} else if (t.isOperator("++") || t.isOperator("--")) {
					c.next();
					expr = new CUnaryExpr(t.text(), expr, false, expr.position());
				} else {
					return expr;
				}
			}
		} finally {
			c.exit(levels);
		}
	}

	private CExpr parsePrimary(Cursor c) {
		CToken t = c.peek();
		switch (t.kind()) {
			case BOOLEAN_LITERAL:
				c.next();
				return new CBooleanLiteral(t.text().equals("true"), t.position());
			case INTEGER_LITERAL:
			case FLOAT_LITERAL:
				c.next();
				return new CNumberLiteral(t.text(), t.position());
			case STRING_LITERAL:
				return parseStringLiteral(c);
			case CHAR_LITERAL:
				if (t.text().length() != 1) {
					throw c.fail("Character literal must hold exactly one character");
				}
				c.next();
				return new CCharLiteral(t.text().charAt(0), t.position());
			case IDENTIFIER:
				c.next();
				return new CIdentifier(t.text(), t.position());
			default:
				break;
		}
		if (t.isSymbol("(")) {
			c.next();
			CExpr inner = parseExpression(c);
			c.expectSymbol(")", "to close parenthesized expression");
			return inner;
		}
		throw c.fail("Expected an expression");
	}

	/** Adjacent string literals are concatenated, as in C. */
	private CStringLiteral parseStringLiteral(Cursor c) {
		CToken first = c.expect(CTokenKind.STRING_LITERAL, "string literal");
		StringBuilder value = new StringBuilder(first.text());
		while (c.peek().kind() == CTokenKind.STRING_LITERAL) {
			value.append(c.next().text());
		}
		return new CStringLiteral(value.toString(), first.position());
	}

	/**
	 * Position over a token list that always ends with exactly one reachable EOF.
	 * {@link #next()} never moves past it.
	 */
	private static final class Cursor {
		private final List<CToken> tokens;
		private int pos;
		private int depth;

		Cursor(List<CToken> source) {
			List<CToken> copy = new ArrayList<>(source == null ? List.of() : source);
			if (copy.isEmpty()) {
				copy.add(CToken.eof(1, 1));
			} else if (copy.get(copy.size() - 1).kind() != CTokenKind.EOF) {
				CToken last = copy.get(copy.size() - 1);
				copy.add(CToken.eof(last.line(), last.column() + last.text().length()));
			}
			this.tokens = copy;
		}

		boolean isAtEnd() {
			return peek().kind() == CTokenKind.EOF;
		}

		CToken peek() {
			return tokens.get(pos);
		}

		CToken peekAt(int offset) {
			return tokens.get(Math.min(pos + offset, tokens.size() - 1));
		}

		CToken next() {
			CToken t = tokens.get(pos);
			if (pos < tokens.size() - 1) {
				pos++;
			}
			return t;
		}

		boolean peekIsSymbol(String text) {
			return peek().isSymbol(text);
		}

		boolean peekIsOperator(String text) {
			return peek().isOperator(text);
		}

		CToken expectSymbol(String text, String context) {
			if (!peekIsSymbol(text)) {
				throw fail("Expected '" + text + "' " + context);
			}
			return next();
		}

		CToken expect(CTokenKind kind, String what) {
			if (peek().kind() != kind) {
				throw fail("Expected " + what);
			}
			return next();
		}

		/** Error at the current token; an ERROR token reports its own message. */
		CParseException fail(String message) {
			CToken t = peek();
			if (t.kind() == CTokenKind.ERROR) {
				return new CParseException("Lexical error: " + t.text(), t);
			}
			return new CParseException(message, t);
		}

		void enter() {
			if (depth >= MAX_DEPTH) {
				throw new CParseException("Nesting exceeds the limit of " + MAX_DEPTH + " levels", peek());
			}
			depth++;
		}

		void exit() {
			depth--;
		}

		void exit(int levels) {
			depth -= levels;
		}
	}
}
