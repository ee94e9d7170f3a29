package codemorph.parse.c;

import codemorph.Diagnostic;
import codemorph.Diagnostics;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CLexerTest {
	private static String texts(List<CToken> tokens) {
		return tokens.stream()
				.filter(t -> t.kind() != CTokenKind.EOF)
				.map(CToken::text)
				.collect(Collectors.joining("|"));
	}

	private static List<CToken> lex(String source) {
		return new CLexer().tokenize(source).tokens();
	}

	@Test
	void lexesDeclarationWithPositions() {
		List<CToken> tokens = lex("int x = 5;");

		assertEquals(List.of(
				new CToken(CTokenKind.KEYWORD, "int", 1, 1),
				new CToken(CTokenKind.IDENTIFIER, "x", 1, 5),
				new CToken(CTokenKind.OPERATOR, "=", 1, 7),
				new CToken(CTokenKind.INTEGER_LITERAL, "5", 1, 9),
				new CToken(CTokenKind.SYMBOL, ";", 1, 10),
				new CToken(CTokenKind.EOF, "", 1, 11)), tokens);
	}

	@Test
	void everyInputEndsWithExactlyOneEof() {
		for (String source : List.of("", "   \n\t", "// only a comment", "/* open", "x", "\"open", "'")) {
			List<CToken> tokens = lex(source);
			assertEquals(CTokenKind.EOF, tokens.get(tokens.size() - 1).kind(), source);
			assertEquals(1, tokens.stream().filter(t -> t.kind() == CTokenKind.EOF).count(), source);
		}
	}

	@Test
	void skipsLineAndBlockCommentsButNotInsideStrings() {
		String input = "x = 1; // line\n" +
				"/* block */ y = \"/* not a comment */\"; // trailing\n";

		assertEquals("x|=|1|;|y|=|/* not a comment */|;", texts(lex(input)));
	}

	@Test
	void tracksLinesAcrossComments() {
		List<CToken> tokens = lex("/* one\ntwo */\n  z");

		assertEquals(new CToken(CTokenKind.IDENTIFIER, "z", 3, 3), tokens.get(0));
	}

	@Test
	void matchesLongestOperatorFirst() {
		assertEquals("a|<<=|b|>>=|c|...|d|!=|e|++|--|->|f|+=|1",
				texts(lex("a <<= b >>= c ... d != e ++ -- -> f += 1")));
	}

	@Test
	void lexesNumberForms() {
		List<CToken> tokens = lex("1.foo 3.14 .5 1e10 1e 2.e5 1e+5 42");

		assertEquals("1|.|foo|3.14|.5|1e10|1|e|2.e5|1e+5|42", texts(tokens));
		assertEquals(CTokenKind.INTEGER_LITERAL, tokens.get(0).kind());
		assertEquals(CTokenKind.OPERATOR, tokens.get(1).kind());
		assertEquals(CTokenKind.FLOAT_LITERAL, tokens.get(3).kind());
		assertEquals(CTokenKind.FLOAT_LITERAL, tokens.get(4).kind());
		assertEquals(CTokenKind.FLOAT_LITERAL, tokens.get(5).kind());
		assertEquals(CTokenKind.INTEGER_LITERAL, tokens.get(6).kind());
		assertEquals(CTokenKind.IDENTIFIER, tokens.get(7).kind());
		assertEquals(CTokenKind.FLOAT_LITERAL, tokens.get(8).kind());
		assertEquals(CTokenKind.INTEGER_LITERAL, tokens.get(10).kind());
	}

	@Test
	void unescapesStringLiterals() {
		CToken token = lex("\"a\\nb\\tc\\\"d\\\\\"").get(0);

		assertEquals(CTokenKind.STRING_LITERAL, token.kind());
		assertEquals("a\nb\tc\"d\\", token.text());
	}

	@Test
	void unterminatedStringBecomesErrorTokenAndScanningContinues() {
		Diagnostics diagnostics = new Diagnostics();
		List<CToken> tokens = new CLexer(diagnostics).tokenize("\"abc\nx").tokens();

		assertEquals(new CToken(CTokenKind.ERROR, "Unterminated string literal: \"abc", 1, 1), tokens.get(0));
		assertEquals(new CToken(CTokenKind.IDENTIFIER, "x", 2, 1), tokens.get(1));
		assertTrue(diagnostics.hasErrors());
	}

	@Test
	void lexesCharacterLiterals() {
		List<CToken> tokens = lex("'a' '\\n' 'ab' ''");

		assertEquals(new CToken(CTokenKind.CHAR_LITERAL, "a", 1, 1), tokens.get(0));
		assertEquals("\n", tokens.get(1).text());
		assertEquals(new CToken(CTokenKind.CHAR_LITERAL, "ab", 1, 10), tokens.get(2));
		assertEquals(new CToken(CTokenKind.ERROR, "Empty character literal", 1, 15), tokens.get(3));
	}

	@Test
	void reportsUnrecognizedCharacter() {
		List<CToken> tokens = lex("x @ y");

		assertEquals(new CToken(CTokenKind.ERROR, "Unrecognized character: @", 1, 3), tokens.get(1));
		assertEquals("y", tokens.get(2).text());
	}

	@Test
	void distinguishesBooleansFromKeywords() {
		List<CToken> tokens = lex("true false bool");

		assertEquals(CTokenKind.BOOLEAN_LITERAL, tokens.get(0).kind());
		assertEquals(CTokenKind.BOOLEAN_LITERAL, tokens.get(1).kind());
		assertEquals(CTokenKind.KEYWORD, tokens.get(2).kind());
	}

	@Test
	void capturesDefinesAndSkipsOtherDirectives() {
		LexResult result = new CLexer().tokenize(
				"#define MAX 100\n" +
						"#define SQUARE(x) ((x) * (x))\n" +
						"#include <stdio.h>\n" +
						"int y;");

		assertEquals(List.of(
				new MacroDefinition("MAX", false, List.of(), "100", 1, true),
				new MacroDefinition("SQUARE", true, List.of("x"), "((x) * (x))", 2, true)), result.macros());
		assertEquals("int|y|;", texts(result.tokens()));
		assertEquals(4, result.tokens().get(0).line());
	}

	@Test
	void hashInsideALineIsAnErrorNotADirective() {
		Diagnostics diagnostics = new Diagnostics();
		LexResult result = new CLexer(diagnostics).tokenize("a # b\nint c;");

		assertEquals(new CToken(CTokenKind.ERROR, "Unexpected '#' outside a directive", 1, 3), result.tokens().get(1));
		assertEquals("a|Unexpected '#' outside a directive|b|int|c|;", texts(result.tokens()));
		assertTrue(result.macros().isEmpty());
		assertTrue(diagnostics.hasErrors());
	}

	@Test
	void directivesMayFollowIndentationAndComments() {
		LexResult result = new CLexer().tokenize("  #define A 1\n/* note */ #define B 2\nx = 1; #define C 3\n");

		assertEquals(List.of("A", "B"), result.macros().stream().map(MacroDefinition::name).toList());
		assertEquals("x|=|1|;|Unexpected '#' outside a directive|define|C|3", texts(result.tokens()));
	}

	@Test
	void collapsesLineContinuationsInMacroBodies() {
		LexResult result = new CLexer().tokenize("#define LONG 1 + \\\n 2\nint z;");

		assertEquals("1 +   2", result.macros().get(0).body());
		assertEquals(3, result.tokens().get(0).line());
	}

	@Test
	void keepsMalformedMacrosAsInvalid() {
		Diagnostics diagnostics = new Diagnostics();
		LexResult result = new CLexer(diagnostics).tokenize(
				"#define 9X 1\n" +
						"#define F(a,,b) a\n" +
						"#define G(a b) a\n" +
						"int q;");

		assertEquals(3, result.macros().size());
		assertTrue(result.macros().stream().noneMatch(MacroDefinition::valid));
		assertEquals(List.of("", "F", "G"), result.macros().stream().map(MacroDefinition::name).toList());
		assertEquals(3, diagnostics.entries(Diagnostic.Severity.WARNING).size());
		assertEquals("int|q|;", texts(result.tokens()));
	}

	@Test
	void warnsAboutUnterminatedBlockComment() {
		Diagnostics diagnostics = new Diagnostics();
		List<CToken> tokens = new CLexer(diagnostics).tokenize("x /* never closed").tokens();

		assertEquals("x", texts(tokens));
		assertFalse(diagnostics.hasErrors());
		assertEquals(1, diagnostics.entries(Diagnostic.Severity.WARNING).size());
	}
}
