package codemorph.transform;

import codemorph.Diagnostic;
import codemorph.Diagnostics;
import codemorph.parse.c.CLexer;
import codemorph.parse.c.MacroDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MacroTranslatorTest {
	private final Diagnostics diagnostics = new Diagnostics();
	private final MacroTranslator translator = new MacroTranslator("    ", diagnostics);

	private List<String> translate(String source) {
		return translator.translate(new CLexer().tokenize(source).macros());
	}

	@Test
	void objectLikeMacroBecomesConstant() {
		assertEquals(List.of("MAX = 100"), translate("#define MAX 100"));
		assertEquals(List.of("GREETING = \"hi\\n\""), translate("#define GREETING \"hi\\n\""));
	}

	@Test
	void functionLikeMacroBecomesFunction() {
		assertEquals(List.of("def SQUARE(x):", "    return x * x"), translate("#define SQUARE(x) ((x) * (x))"));
		assertEquals(List.of("def MAX2(a, b):", "    return a + b"), translate("#define MAX2(a, b) (a) + (b)"));
	}

	@Test
	void emptyBodiesBecomeFlagsAndStubs() {
		assertEquals(List.of("DEBUG = True"), translate("#define DEBUG"));
		assertEquals(List.of("def NOOP():", "    pass"), translate("#define NOOP()"));
	}

	@Test
	void untranslatableBodyBecomesComment() {
		assertEquals(List.of("# could not translate macro BAD: 1 +"), translate("#define BAD 1 +"));
		assertEquals(List.of("# could not translate macro LOOP: for (;;)"), translate("#define LOOP for (;;)"));
		assertEquals(2, diagnostics.entries(Diagnostic.Severity.WARNING).size());
		assertTrue(diagnostics.entries(Diagnostic.Severity.INFO).isEmpty());
	}

	@Test
	void skipsInvalidAndNestedDefinitions() {
		assertTrue(translate("#define F(a,,b) a").isEmpty());
		assertTrue(translator.translate(new MacroDefinition("X", false, List.of(), "#define Y 1", 1, true)).isEmpty());
		assertEquals(2, diagnostics.entries(Diagnostic.Severity.WARNING).size());
	}

	@Test
	void renamesPythonKeywords() {
		assertEquals(List.of("None_ = 0"), translate("#define None 0"));
	}

	@Test
	void translatesEveryMacroInOrder() {
		assertEquals(List.of("A = 1", "B = A + 1"), translate("#define A 1\n#define B (A + 1)\nint x;"));
	}
}
