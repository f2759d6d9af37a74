package nl.utwente.ewi.fmt.SC2JANI.statechart;

import java.util.List;

/**
 * A transition out of a state, triggered by an event or taken
 * without one, leading to one or more targets with a probability
 * each.
 */
public class Transition
{
	public static class Target {
		public final String id;
		/** Null for the remaining probability mass. */
		public final Double probability;
		public final List<ExecutableEntry> body;

		public Target(String id, Double probability, List<ExecutableEntry> body) {
			if (id == null || id.isEmpty())
				throw new IllegalArgumentException("Transition target without state");
			this.id = id;
			this.probability = probability;
			this.body = List.copyOf(body);
		}

		public Target(String id, List<ExecutableEntry> body) {
			this(id, null, body);
		}
	}

	/** Null or empty for transitions without event. */
	public final String event;
	/** Null for unconditional transitions. */
	public final String cond;
	public final List<Target> targets;

	public Transition(String event, String cond, List<Target> targets)
	{
		if (targets.isEmpty())
			throw new IllegalArgumentException("Transition without targets");
		this.event = event == null || event.isEmpty() ? null : event;
		this.cond = cond;
		this.targets = List.copyOf(targets);
	}

	public Transition(String event, String cond, String target, List<ExecutableEntry> body)
	{
		this(event, cond, List.of(new Target(target, body)));
	}

	public String toString() {
		StringBuilder ret = new StringBuilder();
		ret.append(event == null ? "(eventless)" : event);
		if (cond != null)
			ret.append(" [").append(cond).append(']');
		ret.append(" ->");
		for (Target t : targets)
			ret.append(' ').append(t.id);
		return ret.toString();
	}
}
