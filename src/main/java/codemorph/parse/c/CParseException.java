package codemorph.parse.c;

/**
 * Grammar violation raised inside {@link CParser}; never escapes
 * {@link CParser#parse}.
 */
public final class CParseException extends RuntimeException {
	private final CToken token;

	public CParseException(String message, CToken token) {
		super(message);
		this.token = token;
	}

	public CToken token() {
		return token;
	}
}
