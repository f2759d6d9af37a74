package nl.utwente.ewi.fmt.SC2JANI;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import nl.utwente.ewi.fmt.SC2JANI.expression.Expression;

/**
 * An edge of an automaton. Edges without an action are silent and
 * never synchronize.
 */
public class Edge
{
	public final String location;
	public final String action;
	private Expression guard;
	private final ArrayList<Destination> destinations = new ArrayList<>();

	public Edge(String location, String action, Expression guard)
	{
		if (location == null)
			throw new NullPointerException("Edge without source location");
		this.location = location;
		this.action = action;
		this.guard = guard;
	}

	public Edge(String location, String action)
	{
		this(location, action, null);
	}

	public Expression getGuard() {
		return guard;
	}

	public void setGuard(Expression guard) {
		this.guard = guard;
	}

	public List<Destination> getDestinations() {
		return Collections.unmodifiableList(destinations);
	}

	public void addDestination(Destination d) {
		destinations.add(d);
	}

	public void removeDestinations() {
		destinations.clear();
	}

	public boolean isEmptySelfLoop() {
		return destinations.size() == 1
		       && location.equals(destinations.get(0).getLocation())
		       && destinations.get(0).getAssignments().isEmpty();
	}

	public void printJani(PrintStream out, int indent, JaniModel model) {
		if (destinations.isEmpty())
			throw new ModelException("Edge from " + location + " without destinations");
		String tabs = JaniUtils.tabs(indent);
		out.print(tabs + "{\"location\": " + JaniUtils.quote(location));
		if (action != null)
			out.print(",\n" + tabs + " \"action\": " + JaniUtils.quote(action));
		if (guard != null) {
			out.print(",\n" + tabs + " \"guard\": {\"exp\": ");
			model.finish(guard).writeJani(out, indent + 1);
			out.print("}");
		}
		out.println(",\n" + tabs + " \"destinations\": [");
		for (int i = 0; i < destinations.size(); i++) {
			if (i > 0)
				out.println(",");
			destinations.get(i).printJani(out, indent + 1, model);
		}
		out.print("\n" + tabs + " ]}");
	}

	public String toString() {
		return location + " --" + action + "--> " + destinations.size() + " destination(s)";
	}
}
