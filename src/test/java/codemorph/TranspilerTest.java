package codemorph;

import codemorph.parse.c.CTokenKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TranspilerTest {
	@Test
	void runExposesEveryStage() {
		TranspileResult result = new Transpiler().run("#define N 3\nint x = N;");

		assertEquals(CTokenKind.EOF, result.tokens().get(result.tokens().size() - 1).kind());
		assertEquals(1, result.macros().size());
		assertEquals(1, result.program().statements().size());
		assertEquals("N = 3\n\nx = N\n", result.output());
		assertFalse(result.hasErrors());
	}

	@Test
	void syntaxErrorsAreReportedNotThrown() {
		TranspileResult result = new Transpiler().run("int x = 5;\nint = 3;\nint y = x;");

		assertTrue(result.hasErrors());
		assertEquals("x = 5\ny = x\n", result.output());
		Diagnostic error = result.diagnostics().get(0);
		assertEquals(Diagnostic.Stage.PARSER, error.stage());
		assertEquals(2, error.line());
		assertTrue(error.toString().startsWith("parser error (line 2): Syntax error near '='"), error.toString());
	}

	@Test
	void longExpressionChainsBecomeErrorsInsteadOfOverflowingTheGenerator() {
		String source = "int main() { int x = 0; x = " + "x + ".repeat(20000) + "1; return x; }";

		TranspileResult result = assertDoesNotThrow(() -> new Transpiler().run(source));

		assertTrue(result.hasErrors());
		assertTrue(result.diagnostics().stream().anyMatch(d -> d.message().contains("Nesting exceeds")));
	}

	@Test
	void transpileReturnsOnlyThePythonText() {
		assertEquals("a = 1\n", new Transpiler().transpile("int a = 1;"));
		assertEquals("", new Transpiler().transpile(null));
	}

	@Test
	void optionsRejectBadIndentation() {
		assertThrows(IllegalArgumentException.class, () -> new TranspilerOptions("", true, true));
		assertThrows(IllegalArgumentException.class, () -> new TranspilerOptions("--", true, true));
		assertThrows(IllegalArgumentException.class, () -> TranspilerOptions.defaults().withIndentWidth(0));
		assertEquals("\t", new TranspilerOptions("\t", true, true).indentUnit());
	}
}
