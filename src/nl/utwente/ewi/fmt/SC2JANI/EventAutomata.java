package nl.utwente.ewi.fmt.SC2JANI;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniBaseType;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniType;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniVariable;
import nl.utwente.ewi.fmt.SC2JANI.expression.ArrayInfo;
import nl.utwente.ewi.fmt.SC2JANI.expression.ExpressionParser;
import nl.utwente.ewi.fmt.SC2JANI.statechart.Event;
import nl.utwente.ewi.fmt.SC2JANI.statechart.EventNames;
import nl.utwente.ewi.fmt.SC2JANI.statechart.EventRegistry;

/**
 * Implements events as automata synchronizing with their senders and
 * receivers.
 *
 * The event automaton waits for any sender; once sent, all receivers
 * must take the event together. A new send before the event is
 * received overwrites its data. The data of an event is kept in
 * global variables, written by the sender.
 */
public class EventAutomata
{
	private static final Logger log = LoggerFactory.getLogger(EventAutomata.class);

	public static final String WAITING = "waiting";
	public static final String RECEIVED = "received";

	private EventAutomata() { }

	/**
	 * Add the event automata and global event variables to the
	 * model, and set its composition. The model should contain the
	 * automata of all state charts.
	 */
	public static void implement(EventRegistry registry, JaniModel model)
	{
		Composition comp = new Composition();
		for (Automaton a : model.getAutomata())
			comp.addElement(a.name);
		LinkedHashMap<Event, Automaton> added = new LinkedHashMap<>();
		for (Event e : registry.getEvents()) {
			if (isSkipped(e)) {
				int removed = 0;
				for (Automaton a : model.getAutomata())
					removed += a.removeEdges(edge -> e.receiveAction().equals(edge.action));
				log.warn("Skipping event {}, removed {} edges receiving it", e.name, removed);
				continue;
			}
			if (e.getSenders().isEmpty()) {
				if (!e.getReceivers().isEmpty())
					throw new ModelException("Event " + e.name + " is received by " + e.getReceivers().keySet() + " but never sent");
				continue;
			}
			Automaton a = eventAutomaton(e);
			declareData(e, model);
			added.put(e, a);
		}
		for (Map.Entry<Event, Automaton> entry : added.entrySet()) {
			model.addAutomaton(entry.getValue());
			comp.addElement(entry.getValue().name);
		}
		for (Event e : added.keySet()) {
			for (Map.Entry<String, String> sender : e.getSenders().entrySet()) {
				LinkedHashMap<String, String> sync = new LinkedHashMap<>();
				sync.put(e.name, e.sendAction());
				sync.put(sender.getKey(), sender.getValue());
				comp.addSync(sync, e.sendAction());
			}
			if (!e.getReceivers().isEmpty()) {
				LinkedHashMap<String, String> sync = new LinkedHashMap<>();
				sync.put(e.name, e.receiveAction());
				sync.putAll(e.getReceivers());
				comp.addSync(sync, e.receiveAction());
			}
			log.debug("Implemented {}", e);
		}
		model.setComposition(comp);
	}

	/** Events that are not modelled: action feedback and goal
	 * rejection, and halts of Behavior-Tree nodes nobody halts. */
	public static boolean isSkipped(Event e) {
		return EventNames.isActionFeedback(e.name)
		       || EventNames.isGoalRejected(e.name)
		       || (EventNames.isBtHalt(e.name) && e.getSenders().isEmpty());
	}

	private static Automaton eventAutomaton(Event e) {
		Automaton ret = new Automaton(e.name);
		ret.setInitialLocation(WAITING);
		if (e.getReceivers().isEmpty()) {
			Edge send = new Edge(WAITING, e.sendAction());
			send.addDestination(new Destination(WAITING));
			ret.addEdge(send);
			return ret;
		}
		ret.addLocation(RECEIVED);
		Edge send = new Edge(WAITING, e.sendAction());
		send.addDestination(new Destination(RECEIVED));
		ret.addEdge(send);
		Edge resend = new Edge(RECEIVED, e.sendAction());
		resend.addDestination(new Destination(RECEIVED));
		ret.addEdge(resend);
		Edge receive = new Edge(RECEIVED, e.receiveAction());
		receive.addDestination(new Destination(WAITING));
		ret.addEdge(receive);
		return ret;
	}

	private static void declareData(Event e, JaniModel model) {
		model.addVariable(new JaniVariable(new JaniType(JaniBaseType.BOOLEAN),
				e.fieldVariable(Event.VALID_FIELD), null));
		for (Map.Entry<String, JaniType> field : e.getDataStructure().entrySet()) {
			String var = e.fieldVariable(field.getKey());
			JaniType type = field.getValue();
			model.addVariable(new JaniVariable(type, var, null));
			if (!type.isArray())
				continue;
			ArrayInfo shape = type.shape();
			for (int k = 1; k <= type.dimensions(); k++) {
				ArrayInfo lengths = shape.lengthShape(k);
				JaniType lt = lengths == null
				              ? new JaniType(JaniBaseType.INTEGER)
				              : new JaniType(JaniBaseType.INTEGER, lengths.maxSizes);
				model.addVariable(new JaniVariable(lt,
						ExpressionParser.lengthVariable(var, k),
						shape.lengthValue(k, null)));
			}
		}
	}
}
