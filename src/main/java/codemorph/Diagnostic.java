package codemorph;

/**
 * One advisory message produced by a pipeline stage.
 *
 * {@code line} is 1-based, or -1 when the message is not tied to a line.
 */
public record Diagnostic(Severity severity, Stage stage, int line, String message) {
	public enum Severity {
		INFO, WARNING, ERROR
	}

	public enum Stage {
		LEXER("codemorph.lexer"),
		PARSER("codemorph.parser"),
		GENERATOR("codemorph.generator");

		private final String loggerName;

		Stage(String loggerName) {
			this.loggerName = loggerName;
		}

		public String loggerName() {
			return loggerName;
		}
	}

	@Override
	public String toString() {
		String where = line > 0 ? " (line " + line + ")" : "";
		return stage.name().toLowerCase() + " " + severity.name().toLowerCase() + where + ": " + message;
	}
}
