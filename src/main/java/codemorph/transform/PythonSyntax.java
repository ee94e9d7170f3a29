package codemorph.transform;

import java.util.Set;

/**
 * Python lexical rules the generator needs: reserved names, string quoting
 * and operator binding strength.
 */
final class PythonSyntax {
	static final int OR = 1;
	static final int AND = 2;
	static final int NOT = 3;
	static final int COMPARE = 4;
	static final int ADD = 5;
	static final int MUL = 6;
	static final int UNARY = 7;
	static final int POSTFIX = 8;
	static final int ATOM = 9;

	static final Set<String> KEYWORDS = Set.of(
			"False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue", "def",
			"del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in", "is",
			"lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");

	/** Builtins the generated code calls; a C name equal to one of these would shadow it. */
	static final Set<String> RESERVED_BUILTINS = Set.of("print", "input", "range", "len", "map", "str", "int",
			"float");

	private PythonSyntax() {
	}

	static String safeName(String name) {
		if (KEYWORDS.contains(name) || RESERVED_BUILTINS.contains(name)) {
			return name + "_";
		}
		return name;
	}

	static String quote(String value) {
		return quote(value, '"');
	}

	static String quote(String value, char quote) {
		return quote + escape(value, quote) + quote;
	}

	/** Escapes for the inside of a Python string literal delimited by {@code quote}. */
	static String escape(String value, char quote) {
		StringBuilder out = new StringBuilder(value.length() + 8);
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			switch (c) {
				case '\\' -> out.append("\\\\");
				case '\n' -> out.append("\\n");
				case '\t' -> out.append("\\t");
				case '\r' -> out.append("\\r");
				case '\b' -> out.append("\\b");
				case '\f' -> out.append("\\f");
				default -> {
					if (c == quote) {
						out.append('\\').append(c);
					} else if (c < 0x20 || c == 0x7f) {
						out.append(String.format("\\x%02x", (int) c));
					} else {
						out.append(c);
					}
				}
			}
		}
		return out.toString();
	}

	static int binaryPrecedence(String op) {
		return switch (op) {
			case "||" -> OR;
			case "&&" -> AND;
			case "==", "!=", "<", ">", "<=", ">=" -> COMPARE;
			case "+", "-" -> ADD;
			case "*", "/", "%" -> MUL;
			default -> -1;
		};
	}

	static String binaryOperator(String op) {
		return switch (op) {
			case "||" -> "or";
			case "&&" -> "and";
			default -> op;
		};
	}
}
