package nl.utwente.ewi.fmt.SC2JANI;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import nl.utwente.ewi.fmt.SC2JANI.Composition.Sync;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniBaseType;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniType;
import nl.utwente.ewi.fmt.SC2JANI.statechart.AutomatonBuilder;
import nl.utwente.ewi.fmt.SC2JANI.statechart.EventRegistry;
import nl.utwente.ewi.fmt.SC2JANI.statechart.ExecutableEntry;
import nl.utwente.ewi.fmt.SC2JANI.statechart.Send;
import nl.utwente.ewi.fmt.SC2JANI.statechart.State;
import nl.utwente.ewi.fmt.SC2JANI.statechart.StateChart;
import nl.utwente.ewi.fmt.SC2JANI.statechart.Transition;

import static org.junit.jupiter.api.Assertions.*;

public class EventAutomataTest
{
	private final EventRegistry events = new EventRegistry();
	private final JaniModel model = new JaniModel("test");

	private void add(String name, State... states) {
		StateChart c = new StateChart(name, null, List.of(), List.of(states));
		model.addAutomaton(AutomatonBuilder.build(c, events, 3));
	}

	private static Send send(String event, String param, String expr) {
		if (param == null)
			return new Send(event, List.of());
		return new Send(event, List.of(new Send.Param(param, expr)));
	}

	/* A chart that sends once, then stops. */
	private void sender(String name, ExecutableEntry... body) {
		add(name,
		    new State("start", List.of(new Transition(null, null, "stop", List.of(body)))),
		    new State("stop", List.of()));
	}

	private void receiver(String name, String event) {
		add(name,
		    new State("wait", List.of(new Transition(event, "_event.value > 0", "done", List.of()))),
		    new State("done", List.of()));
	}

	private Sync sync(String result, String automaton) {
		for (Sync s : model.getComposition().getSyncs()) {
			if (result.equals(s.result) && s.actions.containsKey(automaton))
				return s;
		}
		fail("No sync for " + result + " of " + automaton + " in " + model.getComposition().getSyncs());
		return null;
	}

	@Test
	void sentAndReceived() {
		sender("a", send("ping", "value", "1"));
		receiver("b", "ping");
		EventAutomata.implement(events, model);

		Automaton ping = model.getAutomaton("ping");
		assertNotNull(ping);
		assertEquals(EventAutomata.WAITING, ping.getInitialLocation());
		assertTrue(ping.hasLocation(EventAutomata.RECEIVED));
		assertEquals(3, ping.getEdges().size());
		Edge first = ping.getEdges().get(0);
		assertEquals("ping_on_send", first.action);
		assertEquals(EventAutomata.WAITING, first.location);
		assertEquals(EventAutomata.RECEIVED, first.getDestinations().get(0).getLocation());
		Edge resend = ping.getEdges().get(1);
		assertEquals(EventAutomata.RECEIVED, resend.location);
		assertEquals(EventAutomata.RECEIVED, resend.getDestinations().get(0).getLocation());
		Edge receive = ping.getEdges().get(2);
		assertEquals("ping_on_receive", receive.action);
		assertEquals(EventAutomata.WAITING, receive.getDestinations().get(0).getLocation());

		assertEquals(new JaniType(JaniBaseType.BOOLEAN), model.getVariable("ping.valid").type);
		assertEquals(new JaniType(JaniBaseType.INTEGER), model.getVariable("ping.value").type);

		assertEquals(List.of("a", "b", "ping"), model.getComposition().getElements());
		assertEquals(Map.of("ping", "ping_on_send", "a", "ping_on_send"),
		             sync("ping_on_send", "a").actions);
		assertEquals(Map.of("ping", "ping_on_receive", "b", "ping_on_receive"),
		             sync("ping_on_receive", "b").actions);
		/* Actions internal to an automaton are completed. */
		for (String action : model.getAutomaton("a").getActions())
			assertTrue(model.getComposition().isSynchronized("a", action), action);
	}

	@Test
	void allReceiversTakePart() {
		sender("a", send("ping", "value", "1"));
		receiver("b", "ping");
		receiver("c", "ping");
		EventAutomata.implement(events, model);
		assertEquals(Map.of("ping", "ping_on_receive", "b", "ping_on_receive", "c", "ping_on_receive"),
		             sync("ping_on_receive", "b").actions);
	}

	@Test
	void eachSenderOwnVector() {
		sender("a", send("ping", "value", "1"));
		sender("a2", send("ping", "value", "2"));
		receiver("b", "ping");
		EventAutomata.implement(events, model);
		Sync fromA = sync("ping_on_send", "a");
		Sync fromA2 = sync("ping_on_send", "a2");
		assertNotSame(fromA, fromA2);
		assertFalse(fromA.actions.containsKey("a2"));
	}

	@Test
	void withoutReceivers() {
		sender("a", send("log", null, null));
		EventAutomata.implement(events, model);
		Automaton log = model.getAutomaton("log");
		assertEquals(1, log.getEdges().size());
		assertEquals(EventAutomata.WAITING, log.getEdges().get(0).getDestinations().get(0).getLocation());
		assertFalse(log.hasLocation(EventAutomata.RECEIVED));
	}

	@Test
	void arrayData() {
		sender("a", send("path", "points", "[1, 2]"));
		EventAutomata.implement(events, model);
		assertEquals(new JaniType(JaniBaseType.INTEGER, List.of(3)), model.getVariable("path.points").type);
		assertEquals(new JaniType(JaniBaseType.INTEGER), model.getVariable("path.points.d1_len").type);
	}

	@Test
	void receivedButNeverSent() {
		receiver("b", "ping");
		assertThrows(ModelException.class, () -> EventAutomata.implement(events, model));
	}

	@Test
	void feedbackIsDropped() {
		receiver("b", "action_nav_feedback");
		EventAutomata.implement(events, model);
		assertNull(model.getAutomaton("action_nav_feedback"));
		for (Edge e : model.getAutomaton("b").getEdges())
			assertNotEquals("action_nav_feedback_on_receive", e.action);
		assertEquals(List.of("b"), model.getComposition().getElements());
	}

	@Test
	void skippedEvents() {
		events.getOrCreate("bt_1_halt");
		assertTrue(EventAutomata.isSkipped(events.get("bt_1_halt")));
		events.getOrCreate("bt_1_halt").addSender("root", "bt_1_halt_on_send");
		assertFalse(EventAutomata.isSkipped(events.get("bt_1_halt")));
		assertTrue(EventAutomata.isSkipped(events.getOrCreate("action_nav_goal_rejected")));
		assertFalse(EventAutomata.isSkipped(events.getOrCreate("ping")));
	}
}
