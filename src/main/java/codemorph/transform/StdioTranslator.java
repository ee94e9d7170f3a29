package codemorph.transform;

import codemorph.ast.c.CArraySubscript;
import codemorph.ast.c.CBinaryExpr;
import codemorph.ast.c.CBooleanLiteral;
import codemorph.ast.c.CCharLiteral;
import codemorph.ast.c.CExpr;
import codemorph.ast.c.CIdentifier;
import codemorph.ast.c.CPrintf;
import codemorph.ast.c.CScanf;
import codemorph.ast.c.CStringLiteral;
import codemorph.ast.c.CUnaryExpr;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Translates {@code printf} into {@code print} with an f-string and
 * {@code scanf} into assignments from {@code input()}.
 */
final class StdioTranslator {
	private static final Pattern PRINTF_CONVERSION = Pattern
			.compile("%([-+ #0]*)(\\d*)(?:\\.(\\d*))?(hh|h|ll|l|L|z|j|t)?([diouxXfFeEgGcsp%])");
	private static final Pattern SCANF_CONVERSION = Pattern.compile("%(\\*?)(\\d*)(hh|h|ll|l|L)?([diouxXfFeEgGcs%])");

	private sealed interface Segment permits Text, Field {
	}

	private record Text(String value) implements Segment {
	}

	private record Field(String expression, String spec) implements Segment {
	}

	private final ExpressionTranslator expressions;

	StdioTranslator(ExpressionTranslator expressions) {
		this.expressions = expressions;
	}

	/** One {@code print(...)} line; problems are appended to {@code warnings}. */
	String printf(CPrintf stmt, List<String> warnings) {
		String format = stmt.format().value();
		List<CExpr> args = stmt.args();
		List<Segment> segments = new ArrayList<>();
		StringBuilder text = new StringBuilder();
		int nextArg = 0;

		Matcher m = PRINTF_CONVERSION.matcher(format);
		int i = 0;
		while (i < format.length()) {
			char c = format.charAt(i);
			if (c != '%') {
				text.append(c);
				i++;
				continue;
			}
			m.region(i, format.length());
			if (!m.lookingAt()) {
				warnings.add("printf: unrecognized conversion at '" + format.substring(i) + "' kept as text");
				text.append(c);
				i++;
				continue;
			}
			i = m.end();
			char conversion = m.group(5).charAt(0);
			if (conversion == '%') {
				text.append('%');
				continue;
			}
			if (nextArg >= args.size()) {
				warnings.add("printf: no argument for '" + m.group() + "', kept as text");
				text.append(m.group());
				continue;
			}
			CExpr arg = args.get(nextArg++);
			String spec = pythonSpec(m.group(1), m.group(2), m.group(3), conversion);
			if (spec.isEmpty() && conversion == 's' && arg instanceof CStringLiteral s) {
				text.append(s.value());
				continue;
			}
			if (spec.isEmpty() && conversion == 'c' && arg instanceof CCharLiteral ch) {
				text.append(ch.value());
				continue;
			}
			if (text.length() > 0) {
				segments.add(new Text(text.toString()));
				text.setLength(0);
			}
			segments.add(new Field(fieldExpression(arg, conversion), spec));
		}
		if (nextArg < args.size()) {
			warnings.add("printf: " + (args.size() - nextArg) + " extra argument(s) ignored");
		}

		boolean newline = text.length() > 0 && text.charAt(text.length() - 1) == '\n';
		if (newline) {
			text.setLength(text.length() - 1);
		}
		if (text.length() > 0) {
			segments.add(new Text(text.toString()));
		}
		return "print(" + printArguments(segments, newline) + ")";
	}

	/**
	 * C prints truth values as 0 or 1 and a {@code %c} code as its character;
	 * Python would print {@code True} or the number.
	 */
	private String fieldExpression(CExpr arg, char conversion) {
		if ("diuxXo".indexOf(conversion) >= 0) {
			if (arg instanceof CBinaryExpr b && (b.op().equals("&&") || b.op().equals("||"))) {
				// Python's and/or yield an operand, not a truth value
				return "int(bool(" + expressions.render(arg) + "))";
			}
			if (isTruthValue(arg)) {
				return "int(" + expressions.render(arg) + ")";
			}
		}
		if (conversion == 'c' && ForLoopRewriter.integerValue(arg).filter(v -> v >= 0).isPresent()) {
			return "chr(" + expressions.render(arg) + ")";
		}
		return expressions.render(arg, PythonSyntax.OR);
	}

	private static boolean isTruthValue(CExpr arg) {
		if (arg instanceof CBinaryExpr b) {
			return PythonSyntax.binaryPrecedence(b.op()) == PythonSyntax.COMPARE;
		}
		return arg instanceof CUnaryExpr u && u.op().equals("!") || arg instanceof CBooleanLiteral;
	}

	private static String printArguments(List<Segment> segments, boolean newline) {
		String end = newline ? "" : "end=\"\"";
		if (segments.isEmpty()) {
			return end;
		}
		List<Field> fields = segments.stream()
				.filter(s -> s instanceof Field)
				.map(s -> (Field) s)
				.toList();

		String literal;
		if (fields.isEmpty()) {
			literal = PythonSyntax.quote(((Text) segments.get(0)).value());
		} else if (fields.stream().anyMatch(f -> f.expression().contains("\"") || f.expression().contains("\\"))) {
			// f-string fields may not hold a backslash or the enclosing quote
			StringBuilder body = new StringBuilder();
			for (Segment s : segments) {
				if (s instanceof Text t) {
					body.append(escapeForTemplate(t.value()));
				} else {
					Field f = (Field) s;
					body.append(f.spec().isEmpty() ? "{}" : "{:" + f.spec() + "}");
				}
			}
			literal = "\"" + body + "\".format("
					+ fields.stream().map(Field::expression).collect(Collectors.joining(", ")) + ")";
		} else {
			StringBuilder body = new StringBuilder("f\"");
			for (Segment s : segments) {
				if (s instanceof Text t) {
					body.append(escapeForTemplate(t.value()));
				} else {
					Field f = (Field) s;
					body.append('{').append(f.expression());
					if (!f.spec().isEmpty()) {
						body.append(':').append(f.spec());
					}
					body.append('}');
				}
			}
			literal = body.append('"').toString();
		}
		return end.isEmpty() ? literal : literal + ", " + end;
	}

	private static String escapeForTemplate(String text) {
		return PythonSyntax.escape(text, '"').replace("{", "{{").replace("}", "}}");
	}

	/** Python format spec for a C conversion; empty when the default rendering matches. */
	static String pythonSpec(String flags, String width, String precision, char conversion) {
		boolean textual = conversion == 'c' || conversion == 's' || conversion == 'p';
		boolean left = flags.indexOf('-') >= 0;
		StringBuilder spec = new StringBuilder();
		if (left) {
			spec.append('<');
		} else if (textual && !width.isEmpty()) {
			spec.append('>');
		}
		if (!textual) {
			if (flags.indexOf('+') >= 0) {
				spec.append('+');
			} else if (flags.indexOf(' ') >= 0) {
				spec.append(' ');
			}
			if (flags.indexOf('#') >= 0) {
				spec.append('#');
			}
			if (flags.indexOf('0') >= 0 && !left) {
				spec.append('0');
			}
		}
		spec.append(width);
		boolean integral = "diuxXo".indexOf(conversion) >= 0;
		if (precision != null && !integral && conversion != 'c' && conversion != 'p') {
			spec.append('.').append(precision.isEmpty() ? "0" : precision);
		}
		if ("fFeEgGxXo".indexOf(conversion) >= 0) {
			spec.append(conversion);
		}
		return spec.toString();
	}

	/**
	 * Assignment lines for a {@code scanf}. Warnings about suspicious arguments
	 * are also returned as {@code # warning:} comment lines.
	 */
	List<String> scanf(CScanf stmt, List<String> warnings) {
		List<Character> conversions = new ArrayList<>();
		Matcher m = SCANF_CONVERSION.matcher(stmt.format().value());
		while (m.find()) {
			char conversion = m.group(4).charAt(0);
			if (conversion != '%' && m.group(1).isEmpty()) {
				conversions.add(conversion);
			}
		}

		List<String> lines = new ArrayList<>();
		List<String> targets = new ArrayList<>();
		List<Character> targetConversions = new ArrayList<>();
		for (int i = 0; i < stmt.args().size(); i++) {
			CExpr arg = stmt.args().get(i);
			char conversion = i < conversions.size() ? conversions.get(i) : 's';
			CExpr target;
			if (arg instanceof CUnaryExpr u && u.op().equals("&") && u.prefix()) {
				target = u.operand();
			} else {
				target = arg;
				boolean buffer = conversion == 's' && (arg instanceof CIdentifier || arg instanceof CArraySubscript);
				if (!buffer) {
					String message = "scanf argument '" + expressions.render(arg) + "' is not an address";
					warnings.add(message);
					lines.add("# warning: " + message);
				}
			}
			if (!(target instanceof CIdentifier) && !(target instanceof CArraySubscript)) {
				String message = "scanf argument '" + expressions.render(arg) + "' cannot be assigned";
				warnings.add(message);
				lines.add("# unsupported: " + message);
				continue;
			}
			targets.add(expressions.renderTarget(target));
			targetConversions.add(conversion);
		}
		if (stmt.args().size() > conversions.size()) {
			warnings.add("scanf: more arguments than conversions, extra targets read as text");
		} else if (stmt.args().size() < conversions.size()) {
			warnings.add("scanf: " + (conversions.size() - stmt.args().size()) + " conversion(s) without a target");
		}

		if (targets.isEmpty()) {
			lines.add("input()");
			return lines;
		}
		if (targets.size() == 1) {
			lines.add(targets.get(0) + " = " + convert(targetConversions.get(0), "input()"));
			return lines;
		}

		String joined = String.join(", ", targets);
		String mapped = mapFunction(targetConversions.get(0));
		boolean uniform = targetConversions.stream().allMatch(c -> mapFunction(c).equals(mapped));
		if (uniform && mapped.equals("str")) {
			lines.add(joined + " = input().split()");
		} else if (uniform && !mapped.isEmpty()) {
			lines.add(joined + " = map(" + mapped + ", input().split())");
		} else {
			lines.add("_values = input().split()");
			for (int i = 0; i < targets.size(); i++) {
				lines.add(targets.get(i) + " = " + convert(targetConversions.get(i), "_values[" + i + "]"));
			}
		}
		return lines;
	}

	/** Name usable with {@code map}; empty when the conversion needs more than a call. */
	private static String mapFunction(char conversion) {
		return switch (conversion) {
			case 'd', 'i', 'u' -> "int";
			case 'f', 'F', 'e', 'E', 'g', 'G' -> "float";
			case 's' -> "str";
			default -> "";
		};
	}

	private static String convert(char conversion, String source) {
		return switch (conversion) {
			case 'd', 'i', 'u' -> "int(" + source + ")";
			case 'x', 'X' -> "int(" + source + ", 16)";
			case 'o' -> "int(" + source + ", 8)";
			case 'f', 'F', 'e', 'E', 'g', 'G' -> "float(" + source + ")";
			case 'c' -> source + "[:1]";
			default -> source;
		};
	}
}
