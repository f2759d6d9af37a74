package nl.utwente.ewi.fmt.SC2JANI;

/**
 * Base class of all errors that abort the compilation of a model.
 *
 * The automaton, state and transition being compiled when the error
 * occurred are filled in while the exception propagates outwards, so
 * the innermost code only needs to describe what went wrong.
 */
public class CompilationException extends RuntimeException {
	private static final long serialVersionUID = 1;

	private String automaton, state, transition;

	public CompilationException(String msg) { super(msg); }
	public CompilationException(String msg, Throwable cause) { super(msg, cause); }

	/** Record where the error occurred. Context that was already
	 * set by a more deeply nested caller is kept.
	 * @return this exception, for rethrowing.
	 */
	public CompilationException addContext(String automaton,
	                                       String state,
	                                       String transition)
	{
		if (this.automaton == null)
			this.automaton = automaton;
		if (this.state == null)
			this.state = state;
		if (this.transition == null)
			this.transition = transition;
		return this;
	}

	public String getAutomaton() { return automaton; }
	public String getState() { return state; }
	public String getTransition() { return transition; }

	public String getMessage() {
		StringBuilder ret = new StringBuilder();
		if (automaton != null)
			ret.append(" automaton '").append(automaton).append('\'');
		if (state != null)
			ret.append(" state '").append(state).append('\'');
		if (transition != null)
			ret.append(" transition '").append(transition).append('\'');
		if (ret.length() == 0)
			return super.getMessage();
		return "In" + ret + ": " + super.getMessage();
	}
}
