package nl.utwente.ewi.fmt.SC2JANI;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniVariable;

/**
 * One automaton of the network: the compiled form of a single
 * state chart, or a helper automaton such as the one implementing
 * an event.
 */
public class Automaton
{
	public final String name;
	private final TreeSet<String> locations = new TreeSet<>();
	private String initialLocation;
	private final ArrayList<Edge> edges = new ArrayList<>();
	private final LinkedHashMap<String, JaniVariable> variables = new LinkedHashMap<>();

	public Automaton(String name)
	{
		if (name == null || name.isEmpty())
			throw new IllegalArgumentException("Automaton without name");
		this.name = name;
	}

	public void addLocation(String location) {
		locations.add(location);
	}

	public boolean hasLocation(String location) {
		return locations.contains(location);
	}

	public Set<String> getLocations() {
		return Collections.unmodifiableSet(locations);
	}

	public void setInitialLocation(String location) {
		locations.add(location);
		initialLocation = location;
	}

	public String getInitialLocation() {
		return initialLocation;
	}

	public void addEdge(Edge e) {
		edges.add(e);
	}

	public void addEdges(Collection<Edge> es) {
		edges.addAll(es);
	}

	/** Remove all edges matching the predicate.
	 * @return The number of edges removed.
	 */
	public int removeEdges(Predicate<Edge> which) {
		int before = edges.size();
		edges.removeIf(which);
		return before - edges.size();
	}

	public List<Edge> getEdges() {
		return Collections.unmodifiableList(edges);
	}

	/** The actions of all edges, without the silent action. */
	public Set<String> getActions() {
		TreeSet<String> ret = new TreeSet<>();
		for (Edge e : edges) {
			if (e.action != null)
				ret.add(e.action);
		}
		return ret;
	}

	public void addVariable(JaniVariable v) {
		if (variables.putIfAbsent(v.name, v) != null)
			throw new ModelException("Duplicate variable " + v.name + " in automaton " + name);
	}

	public JaniVariable getVariable(String name) {
		return variables.get(name);
	}

	public Collection<JaniVariable> getVariables() {
		return Collections.unmodifiableCollection(variables.values());
	}

	public void printJaniAutomaton(PrintStream out, JaniModel model)
	{
		if (initialLocation == null)
			throw new ModelException("Automaton " + name + " has no initial location");
		out.println("\t{\"name\": " + JaniUtils.quote(name) + ",");
		out.print("\t \"locations\": [");
		boolean first = true;
		for (String l : locations) {
			if (!first)
				out.print(", ");
			first = false;
			out.print("{\"name\": " + JaniUtils.quote(l) + "}");
		}
		out.println("],"); /* End of locations */
		out.println("\t \"initial-locations\": [" + JaniUtils.quote(initialLocation) + "],");
		if (!variables.isEmpty()) {
			out.println("\t \"variables\": [");
			first = true;
			for (JaniVariable v : variables.values()) {
				if (!first)
					out.println(",");
				first = false;
				v.printJani(out, 2, model);
			}
			out.println("\n\t ],");
		}
		out.print("\t \"edges\": [");
		first = true;
		for (Edge e : edges) {
			out.println(first ? "" : ",");
			first = false;
			e.printJani(out, 2, model);
		}
		out.print("\n\t]}");
	}

	public String toString() {
		return "automaton " + name + " (" + locations.size() + " locations, " + edges.size() + " edges)";
	}
}
