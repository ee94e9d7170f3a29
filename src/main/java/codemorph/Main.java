package codemorph;

import codemorph.print.AstPrinter;
import codemorph.print.TokenPrinter;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line driver.
 *
 * <pre>
 * codemorph [--indent=N] [--no-main-guard] [--no-macros] [file]
 * codemorph [options] --tree &lt;cRoot&gt; &lt;pyRoot&gt;
 * </pre>
 *
 * Without {@code --tree} the C source comes from {@code file} or standard input
 * and three sections are printed: tokens, AST outline and Python code.
 * Diagnostics go to the log (standard error), never into those sections.
 */
public final class Main {
	static final int EXIT_OK = 0;
	static final int EXIT_IO_ERROR = 1;
	static final int EXIT_USAGE = 2;

	private static final String USAGE = "Usage: codemorph [--indent=N] [--no-main-guard] [--no-macros] [file]\n"
			+ "       codemorph [options] --tree <cRoot> <pyRoot>";

	public static void main(String[] args) {
		System.exit(run(args, System.in, System.out, System.err));
	}

	static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
		TranspilerOptions options = TranspilerOptions.defaults();
		List<String> positional = new ArrayList<>();
		boolean tree = false;
		for (String arg : args) {
			if (arg.startsWith("--indent=")) {
				try {
					options = options.withIndentWidth(Integer.parseInt(arg.substring("--indent=".length())));
				} catch (IllegalArgumentException ex) {
					err.println("Invalid indent: " + arg);
					err.println(USAGE);
					return EXIT_USAGE;
				}
			} else if (arg.equals("--no-main-guard")) {
				options = options.withMainGuard(false);
			} else if (arg.equals("--no-macros")) {
				options = options.withMacros(false);
			} else if (arg.equals("--tree")) {
				tree = true;
			} else if (arg.startsWith("-") && !arg.equals("-")) {
				err.println("Unknown option: " + arg);
				err.println(USAGE);
				return EXIT_USAGE;
			} else {
				positional.add(arg);
			}
		}

		Transpiler transpiler = new Transpiler(options);
		if (tree) {
			if (positional.size() != 2) {
				err.println(USAGE);
				return EXIT_USAGE;
			}
			try {
				int written = new ProjectTranspiler(transpiler).transpileTree(Path.of(positional.get(0)),
						Path.of(positional.get(1)));
				out.println("Transpiled " + written + " file(s)");
				return EXIT_OK;
			} catch (IOException ex) {
				err.println("I/O error: " + ex.getMessage());
				return EXIT_IO_ERROR;
			}
		}

		if (positional.size() > 1) {
			err.println(USAGE);
			return EXIT_USAGE;
		}
		String source;
		try {
			source = positional.isEmpty() || positional.get(0).equals("-")
					? new String(in.readAllBytes(), StandardCharsets.UTF_8)
					: Files.readString(Path.of(positional.get(0)));
		} catch (IOException ex) {
			err.println("Cannot read input: " + ex.getMessage());
			return EXIT_IO_ERROR;
		}

		TranspileResult result = transpiler.run(source);
		out.print("---TOKENS---\n");
		out.print(new TokenPrinter().print(result.tokens()));
		out.print("---AST---\n");
		out.print(new AstPrinter().print(result.program()));
		out.print("---PYTHON_CODE---\n");
		out.print(result.output());
		out.flush();
		return EXIT_OK;
	}
}
