package nl.utwente.ewi.fmt.SC2JANI;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniVariable;
import nl.utwente.ewi.fmt.SC2JANI.expression.ConstantExpression;
import nl.utwente.ewi.fmt.SC2JANI.expression.DistributionExpansion;
import nl.utwente.ewi.fmt.SC2JANI.expression.Expression;

/**
 * Replaces assignments of random values by probabilistic choices
 * between a finite number of values.
 *
 * The destination of an edge with such an assignment is split in
 * three steps: the assignments before the random one, a silent
 * probabilistic edge choosing the value, and a continuation edge
 * with the remaining assignments.
 */
public class RandomAssignmentExpansion
{
	private static final Logger log = LoggerFactory.getLogger(RandomAssignmentExpansion.class);

	/** Action of the edges continuing after a random choice. */
	public static final String CONTINUATION_ACTION = "act";

	private RandomAssignmentExpansion() { }

	public static void expand(JaniModel model, int options)
	{
		for (JaniVariable v : model.getVariables())
			checkInitial(v, null);
		for (Automaton a : model.getAutomata()) {
			for (JaniVariable v : a.getVariables())
				checkInitial(v, a);
			ArrayList<Edge> generated = new ArrayList<>();
			for (Edge e : a.getEdges())
				generated.addAll(expand(e, options));
			for (Edge e : generated)
				a.addLocation(e.location);
			a.addEdges(generated);
			if (!generated.isEmpty())
				log.debug("Added {} edges for random assignments to automaton {}", generated.size(), a.name);
		}
		if (model.getComposition() != null)
			model.completeComposition();
	}

	private static void checkInitial(JaniVariable v, Automaton a) {
		if (v.initial.containsDistribution()) {
			String where = a == null ? "Global variable " : "Variable in automaton " + a.name + " ";
			throw new ModelException(where + v.name + " has a random initial value " + v.initial);
		}
	}

	/**
	 * Split the destinations of the edge containing random
	 * assignments, modifying the edge.
	 *
	 * @return The new edges.
	 */
	static List<Edge> expand(Edge edge, int options)
	{
		ArrayList<Edge> ret = new ArrayList<>();
		String id = edge.location + "_" + edge.action;
		List<Destination> dests = edge.getDestinations();
		for (int d = 0; d < dests.size(); d++) {
			Destination dest = dests.get(d);
			List<Assignment> assignments = dest.getAssignments();
			for (int i = 0; i < assignments.size(); i++) {
				Assignment random = assignments.get(i);
				List<Expression> values = DistributionExpansion.expand(random.value, options);
				if (values.size() == 1)
					continue;
				String choice = id + "_dest_" + d + "_expanded_assign_" + i;
				String after = id + "_dest_" + d + "_after_assign_" + i;

				Edge choose = new Edge(choice, null);
				Expression p = new ConstantExpression(1.0 / values.size());
				for (Expression v : values) {
					Destination option = new Destination(after, p);
					option.addAssignment(new Assignment(random.ref, v, 0));
					choose.addDestination(option);
				}
				ret.add(choose);

				Edge continuation = new Edge(after, CONTINUATION_ACTION);
				Destination rest = new Destination(dest.getLocation());
				rest.addAssignments(assignments.subList(i + 1, assignments.size()));
				continuation.addDestination(rest);
				ret.add(continuation);

				dest.setLocation(choice);
				dest.setAssignments(new ArrayList<>(assignments.subList(0, i)));
				ret.addAll(expand(continuation, options));
				break;
			}
		}
		return ret;
	}
}
