package nl.utwente.ewi.fmt.SC2JANI.statechart;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;

import nl.utwente.ewi.fmt.SC2JANI.ModelException;

/** The events of a model, by name, in order of first use. */
public class EventRegistry
{
	private final LinkedHashMap<String, Event> events = new LinkedHashMap<>();

	/** Add a new event.
	 * @throws ModelException if an event with the same name exists.
	 */
	public void register(Event e) {
		if (events.putIfAbsent(e.name, e) != null)
			throw new ModelException("Event " + e.name + " declared twice");
	}

	public Event get(String name) {
		return events.get(name);
	}

	public Event getOrCreate(String name) {
		return events.computeIfAbsent(name, Event::new);
	}

	public Collection<Event> getEvents() {
		return Collections.unmodifiableCollection(events.values());
	}
}
