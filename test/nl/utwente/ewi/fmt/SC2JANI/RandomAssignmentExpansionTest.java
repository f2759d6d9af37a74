package nl.utwente.ewi.fmt.SC2JANI;

import java.util.List;

import org.junit.jupiter.api.Test;

import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniBaseType;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniType;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniVariable;
import nl.utwente.ewi.fmt.SC2JANI.expression.ConstantExpression;
import nl.utwente.ewi.fmt.SC2JANI.expression.DistributionExpression;
import nl.utwente.ewi.fmt.SC2JANI.expression.Expression;
import nl.utwente.ewi.fmt.SC2JANI.expression.ExpressionParser;

import static org.junit.jupiter.api.Assertions.*;

public class RandomAssignmentExpansionTest
{
	private static Edge edge(Assignment... as) {
		Edge e = new Edge("s", "go");
		Destination d = new Destination("t");
		d.addAssignments(List.of(as));
		e.addDestination(d);
		return e;
	}

	private static Assignment assign(String var, String value, int index) {
		return new Assignment(var, ExpressionParser.parse(value), index);
	}

	@Test
	void splitsDestination() {
		Edge e = edge(assign("x", "1", 0), assign("y", "Math.random() * 2", 0), assign("z", "y", 1));
		List<Edge> added = RandomAssignmentExpansion.expand(e, 2);
		assertEquals(2, added.size());

		String choice = "s_go_dest_0_expanded_assign_1";
		String after = "s_go_dest_0_after_assign_1";
		Destination d = e.getDestinations().get(0);
		assertEquals(choice, d.getLocation());
		assertEquals(1, d.getAssignments().size());
		assertEquals("x", d.getAssignments().get(0).getVariable());

		Edge choose = added.get(0);
		assertEquals(choice, choose.location);
		assertNull(choose.action);
		assertEquals(2, choose.getDestinations().size());
		for (Destination option : choose.getDestinations()) {
			assertEquals(after, option.getLocation());
			assertEquals(new ConstantExpression(0.5), option.getProbability());
			assertEquals(0, option.getAssignments().get(0).index);
			assertEquals("y", option.getAssignments().get(0).getVariable());
		}
		assertEquals(ExpressionParser.parse("0.0 * 2"), choose.getDestinations().get(0).getAssignments().get(0).value);
		assertEquals(ExpressionParser.parse("0.5 * 2"), choose.getDestinations().get(1).getAssignments().get(0).value);

		Edge continuation = added.get(1);
		assertEquals(after, continuation.location);
		assertEquals(RandomAssignmentExpansion.CONTINUATION_ACTION, continuation.action);
		Destination rest = continuation.getDestinations().get(0);
		assertEquals("t", rest.getLocation());
		assertEquals(1, rest.getAssignments().size());
		assertEquals("z", rest.getAssignments().get(0).getVariable());
	}

	@Test
	void withoutRandomness() {
		Edge e = edge(assign("x", "1", 0));
		assertTrue(RandomAssignmentExpansion.expand(e, 4).isEmpty());
		assertEquals("t", e.getDestinations().get(0).getLocation());
	}

	@Test
	void successiveRandomAssignments() {
		Edge e = edge(assign("x", "Math.random()", 0), assign("y", "Math.random()", 1));
		List<Edge> added = RandomAssignmentExpansion.expand(e, 3);
		assertEquals(4, added.size());
		assertEquals(3, added.get(0).getDestinations().size());
		Edge continuation = added.get(1);
		assertEquals("s_go_dest_0_expanded_assign_0", e.getDestinations().get(0).getLocation());
		assertTrue(e.getDestinations().get(0).getAssignments().isEmpty());
		/* The continuation is split in turn. */
		assertEquals("s_go_dest_0_after_assign_0_act_dest_0_expanded_assign_0",
		             continuation.getDestinations().get(0).getLocation());
		assertEquals("s_go_dest_0_after_assign_0_act_dest_0_after_assign_0", added.get(3).location);
		assertEquals("t", added.get(3).getDestinations().get(0).getLocation());
	}

	@Test
	void expandsModel() {
		JaniModel model = new JaniModel("m");
		Automaton a = new Automaton("a");
		a.setInitialLocation("s");
		a.addLocation("t");
		a.addVariable(new JaniVariable(new JaniType(JaniBaseType.REAL), "y", null));
		a.addEdge(edge(assign("y", "Math.random()", 0)));
		model.addAutomaton(a);
		Composition comp = new Composition();
		comp.addElement("a");
		model.setComposition(comp);

		RandomAssignmentExpansion.expand(model, 2);
		assertEquals(3, a.getEdges().size());
		assertTrue(a.hasLocation("s_go_dest_0_expanded_assign_0"));
		assertTrue(a.hasLocation("s_go_dest_0_after_assign_0"));
		assertTrue(comp.isSynchronized("a", RandomAssignmentExpansion.CONTINUATION_ACTION));
		for (Edge e : a.getEdges()) {
			for (Destination d : e.getDestinations()) {
				for (Assignment as : d.getAssignments())
					assertFalse(as.value.containsDistribution());
			}
		}
	}

	@Test
	void randomInitialValue() {
		JaniModel model = new JaniModel("m");
		Expression random = DistributionExpression.uniform(0.0, 1.0);
		model.addVariable(new JaniVariable(new JaniType(JaniBaseType.REAL), "g", random));
		assertThrows(ModelException.class, () -> RandomAssignmentExpansion.expand(model, 2));
	}
}
