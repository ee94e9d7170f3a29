package codemorph;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MainTest {
	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	private int run(String stdin, String... args) {
		return Main.run(args, new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
				new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
	}

	private String stdout() {
		return out.toString(StandardCharsets.UTF_8);
	}

	@Test
	void printsTokensAstAndPythonFromStdin() {
		assertEquals(Main.EXIT_OK, run("int x = 1;"));

		String printed = stdout();
		int tokens = printed.indexOf("---TOKENS---\n");
		int ast = printed.indexOf("---AST---\n");
		int python = printed.indexOf("---PYTHON_CODE---\n");
		assertEquals(0, tokens);
		assertTrue(tokens < ast && ast < python, printed);
		assertTrue(printed.contains(" x ---->(Identifier) line: 1, col: 5\n"), printed);
		assertTrue(printed.contains("  (VariableDeclaration): int x\n"), printed);
		assertTrue(printed.endsWith("---PYTHON_CODE---\nx = 1\n"), printed);
	}

	@Test
	void readsSourceFile(@TempDir Path dir) throws Exception {
		Path source = dir.resolve("prog.c");
		Files.writeString(source, "int main() { return 0; }\n");

		assertEquals(Main.EXIT_OK, run("", "--no-main-guard", source.toString()));
		assertTrue(stdout().endsWith("---PYTHON_CODE---\ndef main():\n    return 0\n"), stdout());
	}

	@Test
	void appliesIndentAndMacroOptions() {
		assertEquals(Main.EXIT_OK, run("#define K 2\nvoid f() { g(K); }", "--indent=2", "--no-macros", "-"));

		assertTrue(stdout().endsWith("---PYTHON_CODE---\ndef f():\n  g(K)\n"), stdout());
	}

	@Test
	void rejectsBadUsage() {
		assertEquals(Main.EXIT_USAGE, run("", "--bogus"));
		assertEquals(Main.EXIT_USAGE, run("", "--indent=0"));
		assertEquals(Main.EXIT_USAGE, run("", "--indent=wide"));
		assertEquals(Main.EXIT_USAGE, run("", "a.c", "b.c"));
		assertEquals(Main.EXIT_USAGE, run("", "--tree", "only-one"));
		assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage: codemorph"));
		assertEquals("", stdout());
	}

	@Test
	void missingInputFileIsAnIoError(@TempDir Path dir) {
		assertEquals(Main.EXIT_IO_ERROR, run("", dir.resolve("missing.c").toString()));
		assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Cannot read input:"));
	}

	@Test
	void transpilesWholeTree(@TempDir Path dir) throws Exception {
		Path cRoot = dir.resolve("src");
		Files.createDirectories(cRoot.resolve("nested"));
		Files.writeString(cRoot.resolve("a.c"), "int a = 1;");
		Files.writeString(cRoot.resolve(Path.of("nested", "b.c")), "int b = 2;");
		Path pyRoot = dir.resolve("out");

		assertEquals(Main.EXIT_OK, run("", "--tree", cRoot.toString(), pyRoot.toString()));

		assertTrue(stdout().startsWith("Transpiled 2 file(s)"), stdout());
		assertEquals("b = 2\n", Files.readString(pyRoot.resolve(Path.of("nested", "b.py"))));
	}
}
