package nl.utwente.ewi.fmt.SC2JANI;

public class UnsupportedConstructException extends CompilationException {
	private static final long serialVersionUID = 1;
	public UnsupportedConstructException(String msg) { super(msg); }
}
