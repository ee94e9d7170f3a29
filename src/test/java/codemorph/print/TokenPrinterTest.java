package codemorph.print;

import codemorph.parse.c.CLexer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class TokenPrinterTest {
	@Test
	void printsOneLinePerTokenIncludingEof() {
		String printed = new TokenPrinter().print(new CLexer().tokenize("x;\n").tokens());

		assertEquals(" x ---->(Identifier) line: 1, col: 1\n" +
				" ; ---->(Symbol) line: 1, col: 2\n" +
				"  ---->(EndOfFile) line: 2, col: 1\n", printed);
	}

	@Test
	void keepsEscapesVisible() {
		String printed = new TokenPrinter().print(new CLexer().tokenize("\"a\\tb\\n\"").tokens());

		assertEquals(" a\\tb\\n ---->(StringLiteral) line: 1, col: 1\n" +
				"  ---->(EndOfFile) line: 1, col: 9\n", printed);
	}
}
