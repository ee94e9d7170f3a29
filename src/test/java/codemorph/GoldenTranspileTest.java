package codemorph;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GoldenTranspileTest {
	@Test
	void transpilesSampleCToExpectedPython() throws Exception {
		Path cSourcePath = Path.of("src", "test", "resources", "golden", "sample.c");
		Path expectedPythonPath = Path.of("src", "test", "resources", "golden", "sample.py");

		String cSource = Files.readString(cSourcePath);
		String expected = Files.readString(expectedPythonPath);
		TranspileResult result = new Transpiler().run(cSource);

		assertEquals(normalize(expected), normalize(result.output()));
		assertTrue(result.diagnostics().isEmpty(), () -> result.diagnostics().toString());
	}

	private static String normalize(String s) {
		String normalized = s.replace("\r\n", "\n");
		if (!normalized.endsWith("\n")) {
			normalized += "\n";
		}
		return normalized;
	}
}
