package nl.utwente.ewi.fmt.SC2JANI.statechart;

import java.util.List;

public class State
{
	public final String id;
	public final List<ExecutableEntry> onEntry;
	public final List<ExecutableEntry> onExit;
	public final List<Transition> transitions;

	public State(String id, List<ExecutableEntry> onEntry,
	             List<ExecutableEntry> onExit,
	             List<Transition> transitions)
	{
		if (id == null || id.isEmpty())
			throw new IllegalArgumentException("State without id");
		this.id = id;
		this.onEntry = List.copyOf(onEntry);
		this.onExit = List.copyOf(onExit);
		this.transitions = List.copyOf(transitions);
	}

	public State(String id, List<Transition> transitions)
	{
		this(id, List.of(), List.of(), transitions);
	}
}
