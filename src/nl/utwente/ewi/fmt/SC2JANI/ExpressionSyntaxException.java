package nl.utwente.ewi.fmt.SC2JANI;

/** Malformed expression-language source text. */
public class ExpressionSyntaxException extends CompilationException {
	private static final long serialVersionUID = 1;
	public final String source;

	public ExpressionSyntaxException(String msg, String source) {
		super(msg + " in expression: " + source);
		this.source = source;
	}
}
