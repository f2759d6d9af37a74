package nl.utwente.ewi.fmt.SC2JANI.statechart;

import java.util.List;

/** Sending an event, with the values of its data fields. */
public class Send extends ExecutableEntry
{
	public static class Param {
		public final String name;
		public final String expr;

		public Param(String name, String expr) {
			if (name == null || name.isEmpty())
				throw new IllegalArgumentException("Event parameter without name");
			if (expr == null)
				throw new IllegalArgumentException("Event parameter " + name + " without expression");
			this.name = name;
			this.expr = expr;
		}
	}

	public final String event;
	public final List<Param> params;

	public Send(String event, List<Param> params)
	{
		if (event == null || event.isEmpty())
			throw new IllegalArgumentException("Send without event");
		this.event = event;
		this.params = List.copyOf(params);
	}

	public Kind getKind() {
		return Kind.SEND;
	}

	public String toString() {
		return "send " + event;
	}
}
