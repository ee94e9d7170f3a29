package codemorph;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProjectTranspilerTest {
	@Test
	void transpilesEachFileWithoutMerging(@TempDir Path dir) throws Exception {
		Path cRoot = dir.resolve("c");
		Path outRoot = dir.resolve("py");

		Path mainC = cRoot.resolve("main.c");
		Path utilC = cRoot.resolve(Path.of("lib", "util.c"));
		Path notes = cRoot.resolve("notes.txt");
		Files.createDirectories(utilC.getParent());

		Files.writeString(mainC, "int main() { return helper(); }\n");
		Files.writeString(utilC, "int helper() { return 42; }\n");
		Files.writeString(notes, "not C\n");

		int written = new ProjectTranspiler().transpileTree(cRoot, outRoot);

		assertEquals(2, written);
		Path mainPy = outRoot.resolve("main.py");
		Path utilPy = outRoot.resolve(Path.of("lib", "util.py"));
		assertTrue(Files.exists(mainPy), "expected main.py to be generated");
		assertTrue(Files.exists(utilPy), "expected lib/util.py to be generated");
		assertFalse(Files.exists(outRoot.resolve("notes.py")));
		assertEquals("def helper():\n    return 42\n", Files.readString(utilPy));
		assertFalse(Files.readString(mainPy).contains("42"));
	}

	@Test
	void writesOutputEvenForFilesWithSyntaxErrors(@TempDir Path dir) throws Exception {
		Path cRoot = dir.resolve("c");
		Files.createDirectories(cRoot);
		Files.writeString(cRoot.resolve("broken.c"), "int x = ; int y = 2;\n");

		new ProjectTranspiler().transpileTree(cRoot, dir.resolve("py"));

		assertEquals("y = 2\n", Files.readString(dir.resolve(Path.of("py", "broken.py"))));
	}

	@Test
	void missingSourceRootIsAnIoError(@TempDir Path dir) {
		assertThrows(IOException.class,
				() -> new ProjectTranspiler().transpileTree(dir.resolve("absent"), dir.resolve("py")));
	}
}
