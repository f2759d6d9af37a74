package nl.utwente.ewi.fmt.SC2JANI.statechart;

import java.util.LinkedHashMap;
import java.util.List;

import nl.utwente.ewi.fmt.SC2JANI.ModelException;

/** A flat state chart: the input of {@link AutomatonBuilder}. */
public class StateChart
{
	public final String name;
	public final String initial;
	public final List<DataDeclaration> datamodel;
	private final LinkedHashMap<String, State> states = new LinkedHashMap<>();

	public StateChart(String name, String initial,
	                  List<DataDeclaration> datamodel,
	                  List<State> states)
	{
		if (name == null || name.isEmpty())
			throw new IllegalArgumentException("State chart without name");
		this.name = name;
		this.datamodel = List.copyOf(datamodel);
		for (State s : states) {
			if (this.states.putIfAbsent(s.id, s) != null)
				throw new ModelException("Duplicate state " + s.id + " in state chart " + name);
		}
		if (this.states.isEmpty())
			throw new ModelException("State chart " + name + " has no states");
		if (initial == null)
			initial = states.get(0).id;
		if (!this.states.containsKey(initial))
			throw new ModelException("Initial state " + initial + " of state chart " + name + " does not exist");
		this.initial = initial;
	}

	public State getState(String id) {
		return states.get(id);
	}

	public List<State> getStates() {
		return List.copyOf(states.values());
	}
}
