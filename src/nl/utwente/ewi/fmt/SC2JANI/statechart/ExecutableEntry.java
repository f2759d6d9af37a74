package nl.utwente.ewi.fmt.SC2JANI.statechart;

/**
 * A statement of an executable body: the onentry/onexit blocks of a
 * state and the body of a transition.
 */
public abstract class ExecutableEntry
{
	public enum Kind { ASSIGN, SEND, IF }

	public abstract Kind getKind();
}
