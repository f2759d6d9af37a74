package nl.utwente.ewi.fmt.SC2JANI;

public class UnknownOperatorException extends CompilationException {
	private static final long serialVersionUID = 1;
	public UnknownOperatorException(String op) { super("Unknown operator: " + op); }
}
