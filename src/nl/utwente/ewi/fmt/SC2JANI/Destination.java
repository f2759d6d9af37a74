package nl.utwente.ewi.fmt.SC2JANI;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import nl.utwente.ewi.fmt.SC2JANI.expression.Expression;

public class Destination
{
	private String location;
	/* Null means probability 1. */
	private Expression probability;
	private final ArrayList<Assignment> assignments = new ArrayList<>();

	public Destination(String location, Expression probability)
	{
		this.location = location;
		this.probability = probability;
	}

	public Destination(String location)
	{
		this(location, null);
	}

	public String getLocation() {
		return location;
	}

	public void setLocation(String location) {
		this.location = location;
	}

	public Expression getProbability() {
		return probability;
	}

	public void setProbability(Expression probability) {
		this.probability = probability;
	}

	public List<Assignment> getAssignments() {
		return Collections.unmodifiableList(assignments);
	}

	/** The index at which the next assignment in execution order
	 * should be placed. */
	public int nextIndex() {
		return assignments.size();
	}

	public void addAssignment(Assignment a) {
		assignments.add(a);
	}

	public void addAssignments(List<Assignment> as) {
		assignments.addAll(as);
	}

	public void setAssignments(List<Assignment> as) {
		assignments.clear();
		assignments.addAll(as);
	}

	public void printJani(PrintStream out, int indent, JaniModel model) {
		if (location == null)
			throw new ModelException("Destination without target location");
		String tabs = JaniUtils.tabs(indent);
		out.print(tabs + "{\"location\": " + JaniUtils.quote(location));
		if (probability != null) {
			out.print(",\n" + tabs + " \"probability\": {\"exp\": ");
			model.finish(probability).writeJani(out, indent + 1);
			out.print("}");
		}
		out.print(",\n" + tabs + " \"assignments\": [");
		boolean first = true;
		for (Assignment a : assignments) {
			out.print(first ? "\n" : ",\n");
			first = false;
			out.print(tabs + "\t");
			a.printJani(out, model);
		}
		if (!first)
			out.print("\n" + tabs + " ");
		out.print("]}");
	}
}
