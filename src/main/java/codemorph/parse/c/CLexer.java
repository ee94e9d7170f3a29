package codemorph.parse.c;

import codemorph.Diagnostic.Stage;
import codemorph.Diagnostics;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lexer for the C subset.
 *
 * Notes:
 * - Total: every input yields a token list ending in exactly one EOF token.
 * - Bad input becomes an ERROR token carrying a message; scanning continues.
 * - Preprocessor lines are consumed here. {@code #define}s are captured as
 * {@link MacroDefinition}s, every other directive is skipped. A {@code #} is a
 * directive only when nothing but whitespace or comments precedes it on its line.
 * - {@code 1.foo} lexes as {@code 1}, {@code .}, {@code foo}; multi-character
 * char literals such as {@code 'ab'} are accepted.
 */
public final class CLexer {
	static final Set<String> KEYWORDS = Set.of(
			"auto", "break", "case", "char", "const", "continue", "default", "do", "double", "else", "enum",
			"extern", "float", "for", "goto", "if", "int", "long", "register", "return", "short", "signed",
			"sizeof", "static", "struct", "switch", "typedef", "union", "unsigned", "void", "volatile", "while",
			"bool");

	// longest match first
	private static final List<String> OPERATORS = List.of(
			"...", "<<=", ">>=",
			"==", "!=", "<=", ">=", "+=", "-=", "*=", "/=", "%=", "&&", "||", "->", "++", "--", "<<", ">>",
			"&=", "|=", "^=", ".*", "::",
			"+", "-", "*", "/", "%", "=", "!", "<", ">", "&", "|", "^", "~", ".", "?", ":");

	private static final String SYMBOLS = ";,(){}[]";

	private final Diagnostics diagnostics;

	public CLexer() {
		this(new Diagnostics());
	}

	public CLexer(Diagnostics diagnostics) {
		this.diagnostics = diagnostics;
	}

	public LexResult tokenize(String source) {
		Scan s = new Scan(source == null ? "" : source);
		List<CToken> tokens = new ArrayList<>();
		List<MacroDefinition> macros = new ArrayList<>();
		while (true) {
			skipTrivia(s, macros);
			CToken token = nextToken(s);
			s.lineStart = false;
			tokens.add(token);
			if (token.kind() == CTokenKind.ERROR) {
				diagnostics.error(Stage.LEXER, token.line(), token.text());
			}
			if (token.kind() == CTokenKind.EOF) {
				break;
			}
		}
		return new LexResult(tokens, macros);
	}

	private void skipTrivia(Scan s, List<MacroDefinition> macros) {
		while (!s.atEnd()) {
			char c = s.peek();
			if (isSpace(c)) {
				s.next();
				continue;
			}
			if (c == '#' && s.lineStart) {
				processDirective(s, macros);
				continue;
			}
			if (s.startsWith("//")) {
				while (!s.atEnd() && s.peek() != '\n') {
					s.next();
				}
				continue;
			}
			if (s.startsWith("/*")) {
				skipBlockComment(s);
				continue;
			}
			return;
		}
	}

	private void skipBlockComment(Scan s) {
		int startLine = s.line;
		s.next();
		s.next();
		while (!s.atEnd()) {
			if (s.startsWith("*/")) {
				s.next();
				s.next();
				return;
			}
			s.next();
		}
		diagnostics.warning(Stage.LEXER, startLine, "Unterminated block comment");
	}

	private CToken nextToken(Scan s) {
		int line = s.line;
		int col = s.col;
		if (s.atEnd()) {
			return CToken.eof(line, col);
		}

		char c = s.peek();
		if (c == '#') {
			s.next();
			return new CToken(CTokenKind.ERROR, "Unexpected '#' outside a directive", line, col);
		}
		if (c == '"') {
			return lexString(s);
		}
		if (c == '\'') {
			return lexChar(s);
		}
		if (isIdentStart(c)) {
			String word = s.take(CLexer::isIdentPart);
			if (word.equals("true") || word.equals("false")) {
				return new CToken(CTokenKind.BOOLEAN_LITERAL, word, line, col);
			}
			return new CToken(KEYWORDS.contains(word) ? CTokenKind.KEYWORD : CTokenKind.IDENTIFIER, word, line, col);
		}
		if (isDigit(c) || (c == '.' && isDigit(s.peekAt(1)))) {
			return lexNumber(s);
		}
		for (String op : OPERATORS) {
			if (s.startsWith(op)) {
				s.advance(op.length());
				return new CToken(CTokenKind.OPERATOR, op, line, col);
			}
		}
		if (SYMBOLS.indexOf(c) >= 0) {
			s.next();
			return new CToken(CTokenKind.SYMBOL, String.valueOf(c), line, col);
		}

		s.next();
		return new CToken(CTokenKind.ERROR, "Unrecognized character: " + c, line, col);
	}

	private CToken lexString(Scan s) {
		int line = s.line;
		int col = s.col;
		s.next();
		StringBuilder value = new StringBuilder();
		while (!s.atEnd() && s.peek() != '"' && s.peek() != '\n') {
			char c = s.next();
			if (c != '\\') {
				value.append(c);
				continue;
			}
			if (s.atEnd()) {
				return new CToken(CTokenKind.ERROR, "Unterminated escape sequence in string literal: \"" + value, line,
						col);
			}
			value.append(unescape(s.next()));
		}
		if (s.atEnd() || s.peek() != '"') {
			return new CToken(CTokenKind.ERROR, "Unterminated string literal: \"" + value, line, col);
		}
		s.next();
		return new CToken(CTokenKind.STRING_LITERAL, value.toString(), line, col);
	}

	private CToken lexChar(Scan s) {
		int line = s.line;
		int col = s.col;
		s.next();
		if (s.atEnd()) {
			return new CToken(CTokenKind.ERROR, "Unterminated character literal (EOF after ')", line, col);
		}
		if (s.peek() == '\'') {
			s.next();
			return new CToken(CTokenKind.ERROR, "Empty character literal", line, col);
		}

		StringBuilder value = new StringBuilder();
		char c = s.next();
		if (c == '\\') {
			if (s.atEnd()) {
				return new CToken(CTokenKind.ERROR, "Unterminated escape sequence in char literal", line, col);
			}
			value.append(unescape(s.next()));
		} else {
			value.append(c);
		}

		if (!s.atEnd() && s.peek() == '\'') {
			s.next();
			return new CToken(CTokenKind.CHAR_LITERAL, value.toString(), line, col);
		}

		// scan ahead on the same line for the closing quote
		while (!s.atEnd() && s.peek() != '\'' && s.peek() != '\n') {
			value.append(s.next());
		}
		if (!s.atEnd() && s.peek() == '\'') {
			s.next();
			return new CToken(CTokenKind.CHAR_LITERAL, value.toString(), line, col);
		}
		return new CToken(CTokenKind.ERROR, "Unterminated character literal: '" + value, line, col);
	}

	private static char unescape(char escaped) {
		return switch (escaped) {
			case 'n' -> '\n';
			case 't' -> '\t';
			case 'r' -> '\r';
			case 'b' -> '\b';
			case 'f' -> '\f';
			case '0' -> '\0';
			default -> escaped;
		};
	}

	private CToken lexNumber(Scan s) {
		int line = s.line;
		int col = s.col;
		StringBuilder text = new StringBuilder();
		boolean isFloat = false;

		if (s.peek() == '.') {
			text.append(s.next());
			isFloat = true;
			text.append(s.take(CLexer::isDigit));
		} else {
			text.append(s.take(CLexer::isDigit));
			if (s.peek() == '.') {
				if (isDigit(s.peekAt(1)) || exponentAt(s, 1)) {
					text.append(s.next());
					isFloat = true;
					text.append(s.take(CLexer::isDigit));
				} else {
					return new CToken(CTokenKind.INTEGER_LITERAL, text.toString(), line, col);
				}
			}
		}

		if (exponentAt(s, 0)) {
			isFloat = true;
			text.append(s.next());
			if (s.peek() == '+' || s.peek() == '-') {
				text.append(s.next());
			}
			text.append(s.take(CLexer::isDigit));
		}

		return new CToken(isFloat ? CTokenKind.FLOAT_LITERAL : CTokenKind.INTEGER_LITERAL, text.toString(), line, col);
	}

	/** An {@code e}/{@code E} at the offset, an optional sign, then a digit. */
	private static boolean exponentAt(Scan s, int offset) {
		char e = s.peekAt(offset);
		if (e != 'e' && e != 'E') {
			return false;
		}
		char next = s.peekAt(offset + 1);
		if (next == '+' || next == '-') {
			return isDigit(s.peekAt(offset + 2));
		}
		return isDigit(next);
	}

	private void processDirective(Scan s, List<MacroDefinition> macros) {
		int line = s.line;
		s.next(); // '#'
		s.skipHorizontalSpace();
		String directive = s.take(CLexer::isIdentPart);
		if (directive.equals("define")) {
			macros.add(parseDefine(s, line));
			return;
		}
		s.restOfLogicalLine();
	}

	private MacroDefinition parseDefine(Scan s, int line) {
		s.skipHorizontalSpace();
		if (!isIdentStart(s.peek()) || s.atEnd()) {
			s.restOfLogicalLine();
			diagnostics.warning(Stage.LEXER, line, "Invalid macro name after #define");
			return new MacroDefinition("", false, List.of(), "", line, false);
		}
		String name = s.take(CLexer::isIdentPart);

		boolean functionLike = false;
		List<String> params = new ArrayList<>();
		String problem = null;
		if (s.peek() == '(' && !s.atEnd()) {
			functionLike = true;
			s.next();
			problem = parseMacroParameters(s, params);
		}

		s.skipHorizontalSpace();
		String body = s.restOfLogicalLine().trim();
		if (problem != null) {
			diagnostics.warning(Stage.LEXER, line, problem + " in macro " + name);
			return new MacroDefinition(name, functionLike, params, body, line, false);
		}
		return new MacroDefinition(name, functionLike, params, body, line, true);
	}

	/** Returns a description of the first problem found, or null. Consumes the closing paren. */
	private static String parseMacroParameters(Scan s, List<String> params) {
		String problem = null;
		s.skipHorizontalSpace();
		if (s.peek() == ')') {
			s.next();
			return null;
		}

		StringBuilder buffer = new StringBuilder();
		while (!s.atEnd()) {
			char c = s.peek();
			if (c == ')' || c == ',') {
				String param = buffer.toString().trim();
				if (param.isEmpty()) {
					problem = problem != null ? problem : "Unexpected comma or empty parameter";
				} else if (!isIdentifier(param)) {
					problem = problem != null ? problem : "Invalid parameter name '" + param + "'";
				} else {
					params.add(param);
				}
				buffer.setLength(0);
				s.next();
				if (c == ')') {
					return problem;
				}
				continue;
			}
			int continuation = s.continuationLength();
			if (continuation > 0) {
				s.advance(continuation);
				buffer.append(' ');
				continue;
			}
			if (c == '\n') {
				return problem != null ? problem : "Unexpected newline in parameter list";
			}
			buffer.append(s.next());
		}
		return problem != null ? problem : "Missing ')'";
	}

	private static boolean isIdentifier(String text) {
		if (text.isEmpty() || !isIdentStart(text.charAt(0))) {
			return false;
		}
		for (int i = 1; i < text.length(); i++) {
			if (!isIdentPart(text.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	static boolean isSpace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == '\u000B';
	}

	static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	static boolean isIdentStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	static boolean isIdentPart(char c) {
		return isIdentStart(c) || isDigit(c);
	}

	private interface CharTest {
		boolean test(char c);
	}

	/** Read position over the source, tracking 1-based line and column. */
	private static final class Scan {
		private final String input;
		private int pos;
		private int line = 1;
		private int col = 1;
		// only whitespace and comments since the last newline
		private boolean lineStart = true;

		Scan(String input) {
			this.input = input;
		}

		boolean atEnd() {
			return pos >= input.length();
		}

		char peek() {
			return peekAt(0);
		}

		char peekAt(int offset) {
			int i = pos + offset;
			return i < input.length() ? input.charAt(i) : '\0';
		}

		boolean startsWith(String text) {
			return input.startsWith(text, pos);
		}

		char next() {
			char c = input.charAt(pos++);
			if (c == '\n') {
				line++;
				col = 1;
				lineStart = true;
			} else {
				col++;
			}
			return c;
		}

		void advance(int count) {
			for (int i = 0; i < count && !atEnd(); i++) {
				next();
			}
		}

		String take(CharTest test) {
			int start = pos;
			while (!atEnd() && test.test(peek())) {
				next();
			}
			return input.substring(start, pos);
		}

		void skipHorizontalSpace() {
			while (!atEnd()) {
				char c = peek();
				if (c == ' ' || c == '\t' || c == '\f' || c == '\u000B' || (c == '\r' && peekAt(1) != '\n')) {
					next();
				} else if (continuationLength() > 0) {
					advance(continuationLength());
				} else {
					return;
				}
			}
		}

		/** Length of a backslash line continuation at the current position, or 0. */
		int continuationLength() {
			if (peek() != '\\') {
				return 0;
			}
			if (peekAt(1) == '\n') {
				return 2;
			}
			if (peekAt(1) == '\r' && peekAt(2) == '\n') {
				return 3;
			}
			return 0;
		}

		/**
		 * Consumes up to and including the end of the logical line and returns its
		 * text with each continuation collapsed to one space.
		 */
		String restOfLogicalLine() {
			StringBuilder out = new StringBuilder();
			while (!atEnd()) {
				int continuation = continuationLength();
				if (continuation > 0) {
					advance(continuation);
					out.append(' ');
					continue;
				}
				char c = next();
				if (c == '\n') {
					break;
				}
				if (c != '\r' || peek() != '\n') {
					out.append(c);
				}
			}
			return out.toString();
		}
	}
}
