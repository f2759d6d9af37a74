package nl.utwente.ewi.fmt.SC2JANI;

/** A structural invariant of the automaton network is violated. */
public class ModelException extends CompilationException {
	private static final long serialVersionUID = 1;
	public ModelException(String msg) { super(msg); }
}
