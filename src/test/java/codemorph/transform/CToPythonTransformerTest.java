package codemorph.transform;

import codemorph.Diagnostic;
import codemorph.Diagnostics;
import codemorph.TranspilerOptions;
import codemorph.parse.c.CLexer;
import codemorph.parse.c.CParser;
import codemorph.parse.c.LexResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CToPythonTransformerTest {
	private final Diagnostics diagnostics = new Diagnostics();

	private String py(String source) {
		return py(source, TranspilerOptions.defaults());
	}

	private String py(String source, TranspilerOptions options) {
		LexResult lexed = new CLexer(diagnostics).tokenize(source);
		return new CToPythonTransformer(options, diagnostics)
				.generate(new CParser(diagnostics).parse(lexed.tokens()), lexed.macros());
	}

	private static String inMain(String body) {
		return "int main() {\n" + body + "\nreturn 0;\n}\n";
	}

	@Test
	void translatesDeclarationAndIfElse() {
		assertEquals("x = 5\n" +
				"if x > 3:\n" +
				"    x = x + 1\n" +
				"else:\n" +
				"    x = 0\n", py("int x = 5; if (x > 3) { x = x + 1; } else { x = 0; }"));
	}

	@Test
	void emptyProgramGivesEmptyOutput() {
		assertEquals("", py(""));
		assertEquals("", py("// nothing here\n"));
	}

	@Test
	void flattensElseIfChains() {
		String out = py(inMain("int x = 2;\n"
				+ "if (x == 1) { printf(\"one\\n\"); } else if (x == 2) { printf(\"two\\n\"); } "
				+ "else { printf(\"other\\n\"); }"));

		assertTrue(out.contains("    if x == 1:\n" +
				"        print(\"one\")\n" +
				"    elif x == 2:\n" +
				"        print(\"two\")\n" +
				"    else:\n" +
				"        print(\"other\")\n"), out);
		assertFalse(out.contains("else:\n        if"));
	}

	@Test
	void emitsFunctionsWithGlobalsAndMainGuard() {
		String source = "int count = 0;\n" +
				"void bump() { count++; }\n" +
				"int main() { bump(); printf(\"%d\\n\", count); return 0; }\n";

		assertEquals("count = 0\n" +
				"\n" +
				"def bump():\n" +
				"    global count\n" +
				"    count += 1\n" +
				"\n" +
				"def main():\n" +
				"    bump()\n" +
				"    print(f\"{count}\")\n" +
				"    return 0\n" +
				"\n" +
				"if __name__ == \"__main__\":\n" +
				"    main()\n", py(source));
	}

	@Test
	void localShadowingAGlobalNeedsNoGlobalStatement() {
		String out = py("int n = 1; void f(int k) { int n = 2; n = n + k; k = 0; }");

		assertFalse(out.contains("global"), out);
	}

	@Test
	void mainGuardCanBeTurnedOff() {
		String out = py("int main() { return 0; }", TranspilerOptions.defaults().withMainGuard(false));

		assertEquals("def main():\n    return 0\n", out);
	}

	@Test
	void honorsIndentWidth() {
		String out = py("void f() { if (1) { g(); } }", TranspilerOptions.defaults().withIndentWidth(2));

		assertEquals("def f():\n  if 1:\n    g()\n", out);
	}

	@Test
	void prototypesProduceNothing() {
		assertEquals("def f(a):\n    return a * 2\n", py("int f(int a); int f(int a) { return a * 2; }"));
	}

	@Test
	void emptySuitesGetPass() {
		assertEquals("def f():\n    pass\n", py("void f() { }"));
		assertEquals("while x:\n    pass\n", py("while (x) { }"));
	}

	@Test
	void uninitializedDeclarationsGetTypedDefaults() {
		assertEquals("f = 0.0\n" +
				"d = 0.0\n" +
				"c = ''\n" +
				"b = False\n" +
				"n = 0\n" +
				"arr = [0] * 5\n" +
				"buf = [''] * 10\n" +
				"u = 0\n", py("float f; double d; char c; bool b; int n; int arr[5]; char buf[10]; unsigned long u;"));
	}

	@Test
	void reEscapesStringLiterals() {
		assertEquals("print(\"line1\\nline2\\ttab \\\"q\\\" \\\\\")\n",
				py("puts(\"line1\\nline2\\ttab \\\"q\\\" \\\\\");"));
	}

	@Test
	void translatesLogicalOperatorsWithMinimalParentheses() {
		assertEquals("r = not (a and b) or c\n", py("r = !(a && b) || c;"));
		assertEquals("r = (a < b) == c\n", py("r = (a < b) == c;"));
		assertEquals("r = (a + b) * -c\n", py("r = (a + b) * -c;"));
		assertEquals("r = a - (b - c)\n", py("r = a - (b - c);"));
	}

	@Test
	void translatesStepsAndAssignments() {
		assertEquals("x += 1\n" +
				"arr[i] -= 1\n" +
				"y = (x := x + 1) - 1\n" +
				"y = (x := x + 1)\n" +
				"a = b = 0\n" +
				"t *= 2\n" +
				"f((n := 3))\n", py("x++; arr[i]--; y = x++; y = ++x; a = b = 0; t *= 2; f(n = 3);"));
	}

	@Test
	void renamesPythonKeywordsAndBuiltins() {
		assertEquals("lambda_ = 1\nprint_ = 2\n", py("int lambda = 1; int print = 2;"));
	}

	@Test
	void translatesLiterals() {
		assertEquals("o = 0o10\nt = True\nc = 'q'\nq = '\\''\n", py("int o = 010; bool t = true; char c = 'q'; char q = '\\'';"));
	}

	@Test
	void marksStatementsPythonCannotExpress() {
		String out = py("return 0; break;");

		assertEquals("# unsupported: return outside a function\n# unsupported: break outside a loop\n", out);
		assertEquals(2, diagnostics.entries(Diagnostic.Severity.WARNING).size());
	}

	@Test
	void notesIncrementOfArrayElementInsideExpression() {
		String out = py("y = a[0]++;");

		assertEquals("y = a[0]  # unsupported: '++' on ArraySubscript inside an expression\n", out);
		assertFalse(diagnostics.entries(Diagnostic.Severity.WARNING).isEmpty());
	}

	@Test
	void translatesPrintfFormats() {
		assertEquals("print(f\"Sum: {s}, avg {a:.2f}\")\n", py("printf(\"Sum: %d, avg %.2f\\n\", s, a);"));
		assertEquals("print(f\"{a:5}|{b:<5}|{c:05}\")\n", py("printf(\"%5d|%-5d|%05d\\n\", a, b, c);"));
		assertEquals("print(\"no newline\", end=\"\")\n", py("printf(\"no newline\");"));
		assertEquals("print(\"100%\")\n", py("printf(\"100%%\\n\");"));
		assertEquals("print(f\"{{{x}}}\")\n", py("printf(\"{%d}\\n\", x);"));
		assertEquals("print(\"Hello, world!\")\n", py("printf(\"Hello, %s!\\n\", \"world\");"));
		assertEquals("print(f\"{n:x}\")\n", py("printf(\"%x\\n\", n);"));
		assertEquals("print(\"{}\".format(len(\"ab\")))\n", py("printf(\"%d\\n\", strlen(\"ab\"));"));
		assertEquals("print()\n", py("printf(\"\\n\");"));
	}

	@Test
	void printsTruthValuesAsNumbersAndCharacterCodesAsCharacters() {
		assertEquals("print(f\"{int(a > b)} {chr(65)}\")\n", py("printf(\"%d %c\\n\", a > b, 65);"));
		assertEquals("print(f\"{int(not x)}\")\n", py("printf(\"%d\\n\", !x);"));
		assertEquals("print(f\"{int(bool(a and b)):3}\")\n", py("printf(\"%3d\\n\", a && b);"));
		assertEquals("print(f\"{int(a == b):x}\")\n", py("printf(\"%x\\n\", a == b);"));
		assertEquals("print(f\"{a + b}\")\n", py("printf(\"%d\\n\", a + b);"));
		assertEquals("print(f\"{c}\")\n", py("printf(\"%c\\n\", c);"));
	}

	@Test
	void warnsAboutMissingAndExtraPrintfArguments() {
		assertEquals("print(f\"{x} %d\")\n", py("printf(\"%d %d\\n\", x);"));
		assertEquals("print(\"plain\")\n", py("printf(\"plain\\n\", x);"));
		assertEquals(2, diagnostics.entries(Diagnostic.Severity.WARNING).size());
	}

	@Test
	void translatesScanfCalls() {
		assertEquals("x = int(input())\n", py("scanf(\"%d\", &x);"));
		assertEquals("d = float(input())\n", py("scanf(\"%lf\", &d);"));
		assertEquals("a, b = map(int, input().split())\n", py("scanf(\"%d %d\", &a, &b);"));
		assertEquals("_values = input().split()\n" +
				"a = int(_values[0])\n" +
				"b = float(_values[1])\n", py("scanf(\"%d %f\", &a, &b);"));
		assertEquals("name = input()\n", py("scanf(\"%s\", name);"));
		assertTrue(diagnostics.entries(Diagnostic.Severity.WARNING).isEmpty());
	}

	@Test
	void warnsWhenScanfArgumentIsNotAnAddress() {
		assertEquals("# warning: scanf argument 'x' is not an address\n" +
				"x = int(input())\n", py("scanf(\"%d\", x);"));
		assertEquals(1, diagnostics.entries(Diagnostic.Severity.WARNING).size());
	}

	@Test
	void macrosComeFirstUnlessDisabled() {
		String source = "#define MAX 100\nint y = MAX;\n";

		assertEquals("MAX = 100\n\ny = MAX\n", py(source));
		assertEquals("y = MAX\n", py(source, TranspilerOptions.defaults().withMacros(false)));
		assertEquals(1, diagnostics.entries(Diagnostic.Severity.INFO).stream()
				.filter(d -> d.message().equals("1 macro(s) left untranslated"))
				.count());
	}

	@Test
	void generatorNeverThrowsOnRecoveredPrograms() {
		String out = py("int main() { int x = ; return 0; } int y = 1;");

		assertTrue(diagnostics.hasErrors());
		assertTrue(out.endsWith("\n"));
	}
}
