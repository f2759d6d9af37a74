package nl.utwente.ewi.fmt.SC2JANI;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parallel composition of the automata of a model: the list of
 * participating automata and the synchronization vectors between
 * their actions.
 */
public class Composition
{
	/** A synchronization vector: the action each participating
	 * automaton takes, and the resulting action. */
	public static class Sync {
		public final Map<String, String> actions;
		public final String result;

		public Sync(Map<String, String> actions, String result) {
			if (actions.isEmpty())
				throw new IllegalArgumentException("Synchronization vector without participants");
			this.actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions));
			this.result = result;
		}

		public String toString() {
			return actions + " -> " + result;
		}
	}

	private final ArrayList<String> elements = new ArrayList<>();
	private final ArrayList<Sync> syncs = new ArrayList<>();

	public void addElement(String automaton) {
		elements.add(automaton);
	}

	public List<String> getElements() {
		return Collections.unmodifiableList(elements);
	}

	public void addSync(Sync s) {
		for (String aut : s.actions.keySet()) {
			if (!elements.contains(aut))
				throw new ModelException("Synchronization vector " + s + " refers to unknown element " + aut);
		}
		syncs.add(s);
	}

	public void addSync(Map<String, String> actions, String result) {
		addSync(new Sync(actions, result));
	}

	public List<Sync> getSyncs() {
		return Collections.unmodifiableList(syncs);
	}

	/** Whether the automaton takes part in a sync with the given
	 * action. */
	public boolean isSynchronized(String automaton, String action) {
		for (Sync s : syncs) {
			if (action.equals(s.actions.get(automaton)))
				return true;
		}
		return false;
	}

	public void printJani(PrintStream out)
	{
		out.println("\"system\": {");
		out.print("\t\"elements\": [");
		for (int i = 0; i < elements.size(); i++) {
			if (i > 0)
				out.print(", ");
			out.print("{\"automaton\": " + JaniUtils.quote(elements.get(i)) + "}");
		}
		out.println("],");
		out.print("\t\"syncs\": [");
		ArrayList<Sync> sorted = new ArrayList<>(syncs);
		sorted.sort(Comparator.comparing((Sync s) -> s.result,
		                                 Comparator.nullsFirst(Comparator.naturalOrder())));
		boolean first = true;
		for (Sync s : sorted) {
			out.print(first ? "\n" : ",\n");
			first = false;
			out.print("\t\t{\"synchronise\": [");
			for (int i = 0; i < elements.size(); i++) {
				if (i > 0)
					out.print(", ");
				String a = s.actions.get(elements.get(i));
				out.print(a == null ? "null" : JaniUtils.quote(a));
			}
			out.print("]");
			if (s.result != null)
				out.print(", \"result\": " + JaniUtils.quote(s.result));
			out.print("}");
		}
		out.println(first ? "]" : "\n\t]");
		out.print("}");
	}
}
