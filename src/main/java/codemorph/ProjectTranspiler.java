package codemorph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Transpiles a tree of C source files to a parallel tree of .py files.
 *
 * Each {@code .c} file becomes one {@code .py} file at the same relative path.
 */
public final class ProjectTranspiler {
	private static final Logger LOG = Logger.getLogger(ProjectTranspiler.class.getName());

	private final Transpiler transpiler;

	public ProjectTranspiler() {
		this(new Transpiler());
	}

	public ProjectTranspiler(Transpiler transpiler) {
		this.transpiler = transpiler;
	}

	/** Returns the number of files written. */
	public int transpileTree(Path cRoot, Path pyOutRoot) throws IOException {
		int[] count = {0};
		try (Stream<Path> paths = Files.walk(cRoot)) {
			paths
					.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().endsWith(".c"))
					.sorted()
					.forEach(p -> {
						try {
							transpileOne(cRoot, pyOutRoot, p);
							count[0]++;
						} catch (IOException e) {
							throw new RuntimeException(e);
						}
					});
		} catch (RuntimeException ex) {
			if (ex.getCause() instanceof IOException io) {
				throw io;
			}
			throw ex;
		}
		return count[0];
	}

	private void transpileOne(Path cRoot, Path pyOutRoot, Path cFile) throws IOException {
		Path rel = cRoot.relativize(cFile);
		String fileName = rel.getFileName().toString();
		String base = fileName.substring(0, fileName.length() - ".c".length());
		Path outRel = rel.getParent() == null ? Path.of(base + ".py") : rel.getParent().resolve(base + ".py");
		Path outFile = pyOutRoot.resolve(outRel);

		Files.createDirectories(outFile.getParent());
		String cSource = Files.readString(cFile);
		TranspileResult result = transpiler.run(cSource);
		Files.writeString(outFile, result.output());
		LOG.info(() -> "Wrote " + outFile + (result.hasErrors() ? " (with syntax errors)" : ""));
	}
}
