package nl.utwente.ewi.fmt.SC2JANI.statechart;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import nl.utwente.ewi.fmt.SC2JANI.ExpressionTypeException;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniBaseType;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniType;

/**
 * An event exchanged between state charts, with the automata
 * sending and receiving it and the types of its data fields.
 */
public class Event
{
	public static final String SEND_SUFFIX = "_on_send";
	public static final String RECEIVE_SUFFIX = "_on_receive";
	public static final String VALID_FIELD = "valid";

	public final String name;
	private final LinkedHashMap<String, JaniType> fields = new LinkedHashMap<>();
	/* Automaton name to the action it sends or receives with. */
	private final TreeMap<String, String> senders = new TreeMap<>();
	private final TreeMap<String, String> receivers = new TreeMap<>();

	public Event(String name)
	{
		if (name == null || name.isEmpty())
			throw new IllegalArgumentException("Event without name");
		this.name = name;
	}

	public String sendAction() {
		return name + SEND_SUFFIX;
	}

	public String receiveAction() {
		return name + RECEIVE_SUFFIX;
	}

	/** Name of the global variable holding a data field. */
	public String fieldVariable(String field) {
		return name + "." + field;
	}

	/**
	 * Merge the types of the data fields. An integer field becomes
	 * real once a real value is sent in it; fields not seen before
	 * are added.
	 * @throws ExpressionTypeException if a field is sent with
	 * otherwise incompatible types.
	 */
	public void setDataStructure(Map<String, JaniType> structure) {
		for (Map.Entry<String, JaniType> e : structure.entrySet()) {
			JaniType type = e.getValue();
			if (type == null)
				continue;
			JaniType known = fields.get(e.getKey());
			fields.put(e.getKey(), known == null ? type : merge(e.getKey(), known, type));
		}
	}

	private JaniType merge(String field, JaniType known, JaniType type) {
		boolean knownBool = known.base == JaniBaseType.BOOLEAN;
		if (!known.sizes.equals(type.sizes) || knownBool != (type.base == JaniBaseType.BOOLEAN))
			throw new ExpressionTypeException("Field " + field + " of event " + name + " is sent as both " + known + " and " + type);
		if (known.base == type.base)
			return known;
		return new JaniType(JaniBaseType.REAL, known.sizes);
	}

	public Map<String, JaniType> getDataStructure() {
		return Collections.unmodifiableMap(fields);
	}

	public void addSender(String automaton, String action) {
		senders.put(automaton, action);
	}

	public void addReceiver(String automaton, String action) {
		receivers.put(automaton, action);
	}

	public SortedMap<String, String> getSenders() {
		return Collections.unmodifiableSortedMap(senders);
	}

	public SortedMap<String, String> getReceivers() {
		return Collections.unmodifiableSortedMap(receivers);
	}

	public String toString() {
		return "event " + name + " (" + senders.size() + " senders, " + receivers.size() + " receivers)";
	}
}
