package nl.utwente.ewi.fmt.SC2JANI;

/** An operand or assignment target has an incompatible type or shape. */
public class ExpressionTypeException extends CompilationException {
	private static final long serialVersionUID = 1;
	public ExpressionTypeException(String msg) { super(msg); }
}
