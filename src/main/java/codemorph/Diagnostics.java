package codemorph;

import codemorph.Diagnostic.Severity;
import codemorph.Diagnostic.Stage;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Side channel for lexer, parser and generator messages.
 *
 * Every entry is kept in order for the caller and also written to the
 * stage's logger. Nothing here ever changes the translated output.
 */
public final class Diagnostics {
	private final List<Diagnostic> entries = new ArrayList<>();

	public void report(Diagnostic diagnostic) {
		entries.add(diagnostic);
		Logger.getLogger(diagnostic.stage().loggerName()).log(levelOf(diagnostic.severity()), diagnostic.toString());
	}

	public void info(Stage stage, int line, String message) {
		report(new Diagnostic(Severity.INFO, stage, line, message));
	}

	public void warning(Stage stage, int line, String message) {
		report(new Diagnostic(Severity.WARNING, stage, line, message));
	}

	public void error(Stage stage, int line, String message) {
		report(new Diagnostic(Severity.ERROR, stage, line, message));
	}

	public List<Diagnostic> entries() {
		return List.copyOf(entries);
	}

	public List<Diagnostic> entries(Severity severity) {
		return entries.stream().filter(d -> d.severity() == severity).toList();
	}

	public boolean hasErrors() {
		return entries.stream().anyMatch(d -> d.severity() == Severity.ERROR);
	}

	private static Level levelOf(Severity severity) {
		return switch (severity) {
			case ERROR -> Level.SEVERE;
			case WARNING -> Level.WARNING;
			case INFO -> Level.FINE;
		};
	}
}
